package com.example.concierge.assistant.conversation;

import java.util.Locale;

public enum Intent {
    SEARCH_FLIGHTS("search_flights"),
    BOOK_FLIGHT("book_flight"),
    CONFIRM("confirm"),
    PAYMENT_DONE("payment_done"),
    RESTART("restart");

    private final String value;

    Intent(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Lenient lookup by wire value or constant name; unknown or blank input yields null. */
    public static Intent fromValue(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (Intent i : values()) {
            if (i.value.equals(v) || i.name().equalsIgnoreCase(v)) return i;
        }
        return null;
    }
}
