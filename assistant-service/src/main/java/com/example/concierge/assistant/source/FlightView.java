package com.example.concierge.assistant.source;

/**
 * Read-only view shared by raw and reconciled flights, so ranking and rendering work on either.
 */
public interface FlightView {
    String airline();
    String flightCode();
    String departureTime();
    int price();
    String duration();
    int stops();
    String source();
    String searchDate();
}
