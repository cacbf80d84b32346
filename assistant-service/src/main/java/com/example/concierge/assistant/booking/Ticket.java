package com.example.concierge.assistant.booking;

import java.util.UUID;

public record Ticket(UUID bookingId, String pnr, String route, String date, String flightCode, int price) {
}
