package com.example.concierge.common.events;

public class BookingConfirmedEvent {
    private String bookingId;
    private String sessionId;
    private String pnr;
    private String route; // "mumbai → delhi"
    private String date;
    private String flightCode;
    private int price;

    public BookingConfirmedEvent() {}

    public BookingConfirmedEvent(String bookingId, String sessionId, String pnr, String route,
                                 String date, String flightCode, int price) {
        this.bookingId = bookingId;
        this.sessionId = sessionId;
        this.pnr = pnr;
        this.route = route;
        this.date = date;
        this.flightCode = flightCode;
        this.price = price;
    }

    public String getBookingId() {
        return bookingId;
    }

    public void setBookingId(String bookingId) {
        this.bookingId = bookingId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getPnr() {
        return pnr;
    }

    public void setPnr(String pnr) {
        this.pnr = pnr;
    }

    public String getRoute() {
        return route;
    }

    public void setRoute(String route) {
        this.route = route;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getFlightCode() {
        return flightCode;
    }

    public void setFlightCode(String flightCode) {
        this.flightCode = flightCode;
    }

    public int getPrice() {
        return price;
    }

    public void setPrice(int price) {
        this.price = price;
    }
}
