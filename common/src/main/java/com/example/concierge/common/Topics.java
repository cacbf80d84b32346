package com.example.concierge.common;

public final class Topics {

    private Topics() {
    }

    public static final String BOOKINGS_CONFIRMED = "concierge.bookings.confirmed";
}
