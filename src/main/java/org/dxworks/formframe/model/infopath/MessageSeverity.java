package org.dxworks.formframe.model.infopath;

public enum MessageSeverity {
    INFO,
    WARNING,
    ERROR
}
