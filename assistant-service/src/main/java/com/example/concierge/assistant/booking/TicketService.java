package com.example.concierge.assistant.booking;

import com.example.concierge.assistant.conversation.CityRef;
import com.example.concierge.assistant.conversation.SessionContext;
import com.example.concierge.common.events.BookingConfirmedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Issues the ticket for a paid session, stores it and announces it.
 */
@Service
public class TicketService {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    static final String STATUS_CONFIRMED = "CONFIRMED";

    private final BookingRecordRepository repository;
    private final BookingNotifier notifier;

    public TicketService(BookingRecordRepository repository, BookingNotifier notifier) {
        this.repository = repository;
        this.notifier = notifier;
    }

    @Transactional
    public Ticket issue(String sessionId, SessionContext ctx) {
        String from = CityRef.isPresent(ctx.getFrom()) ? ctx.getFrom().name() : "Unknown";
        String to = CityRef.isPresent(ctx.getTo()) ? ctx.getTo().name() : "Unknown";
        String date = ctx.hasDate() ? ctx.getDate() : "Unknown";
        int price = ctx.getSelectedPrice() != null ? ctx.getSelectedPrice() : PaymentLinkService.DEFAULT_PRICE;

        String pnr = newPnr();
        BookingRecord saved = repository.save(new BookingRecord(sessionId, pnr, from, to, date,
                ctx.getSelectedFlightCode(), price, ctx.getSelectedSource(), STATUS_CONFIRMED));
        Ticket ticket = new Ticket(saved.getId(), pnr, from + " → " + to, date, ctx.getSelectedFlightCode(), price);
        log.info("[TicketService] Booking {} confirmed for session {}", pnr, sessionId);

        try {
            notifier.bookingConfirmed(new BookingConfirmedEvent(String.valueOf(saved.getId()), sessionId, pnr,
                    ticket.route(), date, ticket.flightCode(), price));
        } catch (RuntimeException e) {
            log.warn("[TicketService] Notification for {} failed: {}", pnr, e.toString());
        }
        return ticket;
    }

    public List<BookingRecord> bookingsFor(String sessionId) {
        return repository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    static String newPnr() {
        return "PNR" + UUID.randomUUID().toString().substring(0, 6).toUpperCase(Locale.ROOT);
    }
}
