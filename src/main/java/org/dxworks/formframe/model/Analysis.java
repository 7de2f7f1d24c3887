package org.dxworks.formframe.model;

/**
 * Marker interface for all analysis result types.
 * Allows different form formats to return different analysis structures.
 */
public interface Analysis {
    String getFormPath();
    String getFormat();
}
