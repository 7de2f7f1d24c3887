package org.dxworks.formframe.analyzer.infopath;

/**
 * A view document could not be read or is not well-formed XML.
 */
public class ViewLoadException extends Exception {

    public ViewLoadException(String message) {
        super(message);
    }

    public ViewLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
