package com.example.concierge.assistant.conversation;

import java.time.Instant;

/**
 * Per-conversation state. Instances handed out by the session store are private copies, so a turn
 * may mutate its context freely and decide at the end whether to persist it.
 */
public class SessionContext {

    public static final String WEEK_SEARCH = "WEEK_SEARCH";

    private Intent intent;
    private CityRef from;
    private CityRef to;
    private String date; // yyyy-MM-dd or WEEK_SEARCH
    private Preference preference = Preference.NONE;
    private BookingStage bookingStage = BookingStage.COLLECT_SLOTS;
    private boolean paymentConfirmed;
    private String selectedFlightCode;
    private Integer selectedPrice;
    private String selectedSource;
    private int lastResultsCount;
    private Instant lastUpdated;

    public SessionContext() {
    }

    public SessionContext copy() {
        SessionContext c = new SessionContext();
        c.intent = intent;
        c.from = from;
        c.to = to;
        c.date = date;
        c.preference = preference;
        c.bookingStage = bookingStage;
        c.paymentConfirmed = paymentConfirmed;
        c.selectedFlightCode = selectedFlightCode;
        c.selectedPrice = selectedPrice;
        c.selectedSource = selectedSource;
        c.lastResultsCount = lastResultsCount;
        c.lastUpdated = lastUpdated;
        return c;
    }

    /**
     * Moves the stage forward. A target at or behind the current stage is ignored;
     * only {@link #restart()} goes back.
     */
    public boolean advanceTo(BookingStage target) {
        if (target == null) return false;
        BookingStage current = bookingStage != null ? bookingStage : BookingStage.COLLECT_SLOTS;
        if (current.isBefore(target)) {
            bookingStage = target;
            return true;
        }
        return false;
    }

    public void restart() {
        intent = null;
        from = null;
        to = null;
        date = null;
        preference = Preference.NONE;
        bookingStage = BookingStage.COLLECT_SLOTS;
        paymentConfirmed = false;
        selectedFlightCode = null;
        selectedPrice = null;
        selectedSource = null;
        lastResultsCount = 0;
    }

    public boolean hasIntent() { return intent != null; }

    public boolean hasFrom() { return CityRef.isPresent(from); }

    public boolean hasTo() { return CityRef.isPresent(to); }

    public boolean hasDate() { return date != null && !date.isBlank(); }

    public boolean hasAllSlots() {
        return hasIntent() && hasFrom() && hasTo() && hasDate();
    }

    public boolean isWeekSearch() {
        return !hasDate() || WEEK_SEARCH.equalsIgnoreCase(date);
    }

    public Intent getIntent() { return intent; }
    public void setIntent(Intent intent) { this.intent = intent; }

    public CityRef getFrom() { return from; }
    public void setFrom(CityRef from) { this.from = from; }

    public CityRef getTo() { return to; }
    public void setTo(CityRef to) { this.to = to; }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public Preference getPreference() { return preference; }
    public void setPreference(Preference preference) { this.preference = preference != null ? preference : Preference.NONE; }

    public BookingStage getBookingStage() { return bookingStage; }
    public void setBookingStage(BookingStage bookingStage) { this.bookingStage = bookingStage; }

    public boolean isPaymentConfirmed() { return paymentConfirmed; }
    public void setPaymentConfirmed(boolean paymentConfirmed) { this.paymentConfirmed = paymentConfirmed; }

    public String getSelectedFlightCode() { return selectedFlightCode; }
    public void setSelectedFlightCode(String selectedFlightCode) { this.selectedFlightCode = selectedFlightCode; }

    public Integer getSelectedPrice() { return selectedPrice; }
    public void setSelectedPrice(Integer selectedPrice) { this.selectedPrice = selectedPrice; }

    public String getSelectedSource() { return selectedSource; }
    public void setSelectedSource(String selectedSource) { this.selectedSource = selectedSource; }

    public int getLastResultsCount() { return lastResultsCount; }
    public void setLastResultsCount(int lastResultsCount) { this.lastResultsCount = lastResultsCount; }

    public Instant getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; }

    @Override
    public String toString() {
        return "SessionContext{intent=" + (intent != null ? intent.value() : null)
                + ", from=" + (from != null ? from.name() : null)
                + ", to=" + (to != null ? to.name() : null)
                + ", date=" + date
                + ", preference=" + preference
                + ", stage=" + bookingStage + '}';
    }
}
