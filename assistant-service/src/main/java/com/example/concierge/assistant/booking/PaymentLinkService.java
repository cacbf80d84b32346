package com.example.concierge.assistant.booking;

import com.example.concierge.assistant.conversation.CityRef;
import com.example.concierge.assistant.conversation.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Issues UPI deep links for the selected flight. No money moves here; the link is handed to the user's UPI app.
 */
@Service
public class PaymentLinkService {

    private static final Logger log = LoggerFactory.getLogger(PaymentLinkService.class);

    static final int DEFAULT_PRICE = 5000;
    private static final String PAYEE = "travel@agent";
    private static final String PAYEE_NAME = "Travel Agent";

    private final Clock clock;

    public PaymentLinkService(Clock clock) {
        this.clock = clock;
    }

    public PaymentLink create(SessionContext ctx) {
        String from = cityName(ctx.getFrom());
        String to = cityName(ctx.getTo());
        String date = ctx.hasDate() ? ctx.getDate() : "Unknown";
        int price = ctx.getSelectedPrice() != null ? ctx.getSelectedPrice() : DEFAULT_PRICE;

        String paymentId = UUID.randomUUID().toString().substring(0, 8);
        String link = "upi://pay?pa=" + PAYEE + "&pn=" + PAYEE_NAME + "&am=" + price
                + "&cu=INR&tn=Flight " + from + "-" + to;
        log.info("[PaymentLinkService] Payment link {} for {} -> {} at {}", paymentId, from, to, price);
        return new PaymentLink(paymentId, link, price, "INR",
                "Flight from " + from + " to " + to + " on " + date, clock.instant(), "pending");
    }

    private static String cityName(CityRef ref) {
        return CityRef.isPresent(ref) ? ref.name() : "Unknown";
    }
}
