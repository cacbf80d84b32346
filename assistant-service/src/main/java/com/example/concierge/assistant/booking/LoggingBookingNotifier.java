package com.example.concierge.assistant.booking;

import com.example.concierge.common.events.BookingConfirmedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Used when Kafka publishing is switched off.
 */
@Service
@ConditionalOnProperty(prefix = "assistant.notifications.kafka", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingBookingNotifier implements BookingNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingBookingNotifier.class);

    @Override
    public void bookingConfirmed(BookingConfirmedEvent event) {
        log.info("[LoggingBookingNotifier] Booking confirmed: pnr={}, route={}, date={}, flight={}, price={}",
                event.getPnr(), event.getRoute(), event.getDate(), event.getFlightCode(), event.getPrice());
    }
}
