package com.example.concierge.assistant.booking;

import com.example.concierge.common.events.BookingConfirmedEvent;

/**
 * Tells the outside world that a booking was confirmed.
 */
public interface BookingNotifier {

    void bookingConfirmed(BookingConfirmedEvent event);
}
