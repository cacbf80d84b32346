package com.example.concierge.assistant.booking;

import com.example.concierge.common.Topics;
import com.example.concierge.common.events.BookingConfirmedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "assistant.notifications.kafka", name = "enabled", havingValue = "true")
public class KafkaBookingNotifier implements BookingNotifier {

    private static final Logger log = LoggerFactory.getLogger(KafkaBookingNotifier.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public KafkaBookingNotifier(KafkaTemplate<String, Object> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    @Override
    public void bookingConfirmed(BookingConfirmedEvent event) {
        kafkaTemplate.send(Topics.BOOKINGS_CONFIRMED, event.getSessionId(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("[KafkaBookingNotifier] Failed to publish {}: {}", event.getPnr(), ex.toString());
                    } else {
                        log.info("[KafkaBookingNotifier] Published {} to {}", event.getPnr(), Topics.BOOKINGS_CONFIRMED);
                    }
                });
    }
}
