package com.example.concierge.assistant.source;

public class SourceUnavailableException extends SourceException {

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    public SourceUnavailableException(String source, String message) {
        super(source, message, null);
    }
}
