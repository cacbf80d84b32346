package com.example.concierge.assistant.conversation;

import java.util.Locale;

public enum Preference {
    NONE(""),
    CHEAPEST("cheapest"),
    EARLIEST("earliest"),
    BUSINESS("business");

    private final String keyword;

    Preference(String keyword) {
        this.keyword = keyword;
    }

    /** Text handed to the ranker; empty for {@link #NONE}. */
    public String keyword() {
        return keyword;
    }

    public static Preference fromValue(String raw) {
        if (raw == null || raw.isBlank()) return NONE;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (Preference p : values()) {
            if (p != NONE && (p.keyword.equals(v) || p.name().equalsIgnoreCase(v))) return p;
        }
        return NONE;
    }
}
