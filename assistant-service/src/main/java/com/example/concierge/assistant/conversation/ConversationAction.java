package com.example.concierge.assistant.conversation;

public enum ConversationAction {
    PROMPT_MISSING("prompt_missing"),
    SEARCH_FLIGHTS("search_flights"),
    REQUEST_PAYMENT("request_payment"),
    CONFIRM("confirm");

    private final String value;

    ConversationAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
