package org.dxworks.formframe.model.infopath;

public class AnalysisMessage {
    public MessageSeverity severity;
    public String message;
    public String details;
    public String source;

    public AnalysisMessage() {
    }

    public AnalysisMessage(MessageSeverity severity, String message, String details, String source) {
        this.severity = severity;
        this.message = message;
        this.details = details;
        this.source = source;
    }
}
