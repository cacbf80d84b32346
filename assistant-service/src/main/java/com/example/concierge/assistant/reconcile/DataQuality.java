package com.example.concierge.assistant.reconcile;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DataQuality {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    UNKNOWN("unknown");

    private final String value;

    DataQuality(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static DataQuality fromConfidence(double confidence) {
        if (confidence >= 0.8) return HIGH;
        if (confidence >= 0.6) return MEDIUM;
        if (confidence >= 0.3) return LOW;
        return UNKNOWN;
    }
}
