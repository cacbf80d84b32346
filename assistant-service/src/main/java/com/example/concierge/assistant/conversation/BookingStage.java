package com.example.concierge.assistant.conversation;

/**
 * Booking progress of a session. Declaration order is the only allowed direction of travel.
 */
public enum BookingStage {
    COLLECT_SLOTS("collect_slots"),
    SEARCH("search"),
    REVIEW("review"),
    PAYMENT("payment"),
    CONFIRMED("confirmed");

    private final String value;

    BookingStage(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isBefore(BookingStage other) {
        return other != null && ordinal() < other.ordinal();
    }
}
