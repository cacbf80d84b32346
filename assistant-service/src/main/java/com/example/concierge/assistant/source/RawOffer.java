package com.example.concierge.assistant.source;

/**
 * One quote from one upstream source. {@code departureTime} is HH:mm, {@code price} whole rupees.
 */
public record RawOffer(String airline,
                       String flightCode,
                       String departureTime,
                       int price,
                       String duration,
                       int stops,
                       String source,
                       String searchDate) implements FlightView {

    public RawOffer {
        stops = Math.max(0, stops);
    }

    public RawOffer withSource(String newSource) {
        return new RawOffer(airline, flightCode, departureTime, price, duration, stops, newSource, searchDate);
    }
}
