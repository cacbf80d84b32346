package com.example.concierge.assistant.source;

public class SourceTimeoutException extends SourceException {

    public SourceTimeoutException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
