package com.example.concierge.assistant.api;

import com.example.concierge.assistant.booking.BookingRecord;
import com.example.concierge.assistant.booking.TicketService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/bookings")
public class BookingController {

    private final TicketService ticketService;

    public BookingController(TicketService ticketService) {
        this.ticketService = ticketService;
    }

    @GetMapping
    public List<BookingRecord> list(@RequestParam String sessionId) {
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return ticketService.bookingsFor(sessionId);
    }
}
