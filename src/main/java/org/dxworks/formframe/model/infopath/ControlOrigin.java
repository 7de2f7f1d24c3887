package org.dxworks.formframe.model.infopath;

/**
 * Where a control was captured: directly in the main flow of the view, or while
 * expanding a moded template.
 */
public enum ControlOrigin {
    MAIN,
    TEMPLATE
}
