package com.example.concierge.assistant.source;

public class SourceException extends RuntimeException {

    private final String source;

    public SourceException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
