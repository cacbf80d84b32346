package com.example.concierge.assistant.response;

import com.example.concierge.assistant.conversation.BookingStage;
import com.example.concierge.assistant.conversation.CityRef;
import com.example.concierge.assistant.conversation.SessionContext;
import com.example.concierge.assistant.reconcile.DataQuality;
import com.example.concierge.assistant.reconcile.ReconciledFlight;
import com.example.concierge.assistant.source.FlightView;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds everything the user sees: reply sentences, flight cards, the state chip and follow-up suggestions.
 */
@Component
public class ResponseAssembler {

    public static final String NO_FLIGHTS = "No flights found. Would you like to try a different time or airline?";
    public static final String ERROR_REPLY = "Sorry, I encountered an error. Please try again.";
    public static final List<String> ERROR_ACTIONS = List.of("Try again", "Start over");

    private static final Map<String, String> AIRLINE_NAMES = Map.of(
            "AI", "Air India",
            "6E", "IndiGo",
            "QP", "Akasa Air",
            "SG", "SpiceJet",
            "G8", "GoAir",
            "UK", "Vistara");

    public String promptForMissing(SessionContext ctx) {
        boolean noFrom = ctx == null || !ctx.hasFrom();
        boolean noTo = ctx == null || !ctx.hasTo();
        if (noFrom && noTo) {
            return "Where would you like to fly from and to? (From → To)";
        }
        if (ctx == null || !ctx.hasDate()) {
            return "When would you like to travel? You can specify a date (e.g., 'tomorrow', 'next Friday') "
                    + "or I can show you the best options for the next week.";
        }
        return "Please provide flight details: From, To, Date.";
    }

    /**
     * One sentence describing the results. Wording depends on the result count, a "cheap" preference
     * and whether the user gave a specific date.
     */
    public String summarize(SessionContext ctx, List<? extends FlightView> flights) {
        if (flights == null || flights.isEmpty()) return NO_FLIGHTS;
        int total = flights.size();
        int cheapest = flights.stream().mapToInt(FlightView::price).min().getAsInt();
        int dearest = flights.stream().mapToInt(FlightView::price).max().getAsInt();
        String from = ctx.getFrom() != null ? ctx.getFrom().displayName() : "";
        String to = ctx.getTo() != null ? ctx.getTo().displayName() : "";
        String preference = ctx.getPreference().keyword();
        String range = " | " + rupees(cheapest) + " - " + rupees(dearest);

        String when;
        boolean preferenceFirst;
        if (ctx.isWeekSearch()) {
            when = dateRange(flights);
            preferenceFirst = preference.toLowerCase(Locale.ROOT).contains("cheap");
        } else {
            when = "on " + ctx.getDate();
            preferenceFirst = !preference.isEmpty();
        }
        String route = " from " + from + " to " + to + " " + when;

        if (preferenceFirst) {
            return "Found " + total + " " + preference.toLowerCase(Locale.ROOT) + " flights" + route + range;
        }
        if (total == 1) {
            return "Perfect! Found 1 flight" + route + " for " + rupees(cheapest);
        }
        if (total <= 3) {
            return "Great! Found " + total + " flights" + route + range;
        }
        return "Found " + total + " flight options" + route + range;
    }

    /**
     * Cards sorted by price. The first card is flagged cheapest; the card with the smallest duration
     * string is flagged fastest.
     */
    public List<FlightCard> cards(List<? extends FlightView> flights) {
        if (flights == null || flights.isEmpty()) return List.of();
        List<FlightCard> cards = new ArrayList<>(flights.size());
        for (FlightView f : flights) {
            cards.add(toCard(f));
        }
        cards.sort(Comparator.comparingInt(FlightCard::getPrice));
        cards.get(0).setCheapest(true);
        FlightCard fastest = cards.get(0);
        for (FlightCard c : cards) {
            // plain string comparison; "10:05:00" sorts before "9:40:00"
            if (Objects.toString(c.getDuration(), "").compareTo(Objects.toString(fastest.getDuration(), "")) < 0) {
                fastest = c;
            }
        }
        fastest.setFastest(true);
        return cards;
    }

    public String paymentPrompt(String upiLink) {
        return "Ready to pay? Tap UPI link: " + upiLink;
    }

    public String confirmation(String pnr, String route, String date) {
        return "Booked! PNR " + pnr + ". Route " + route + " on " + date + ". Ticket and receipt sent.";
    }

    public Map<String, Object> stateSummary(SessionContext ctx) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (ctx == null) return out;
        out.put("intent", ctx.getIntent() != null ? ctx.getIntent().value() : null);
        out.put("from", CityRef.isPresent(ctx.getFrom()) ? ctx.getFrom().name() : null);
        out.put("to", CityRef.isPresent(ctx.getTo()) ? ctx.getTo().name() : null);
        out.put("date", ctx.getDate());
        out.put("preference", ctx.getPreference().keyword().isEmpty() ? null : ctx.getPreference().keyword());
        out.put("bookingStage", ctx.getBookingStage() != null ? ctx.getBookingStage().value() : null);
        return out;
    }

    public List<String> suggestedActions(SessionContext ctx) {
        BookingStage stage = ctx != null ? ctx.getBookingStage() : null;
        if (stage == null || stage == BookingStage.COLLECT_SLOTS) {
            return List.of("Set date to tomorrow", "Evening flights");
        }
        switch (stage) {
            case REVIEW:
                return List.of("Confirm & Pay", "Change date", "Change destination");
            case PAYMENT:
                return List.of("Retry payment", "Change payment method");
            case CONFIRMED:
                return List.of("Start over");
            default:
                return List.of();
        }
    }

    FlightCard toCard(FlightView f) {
        int stops = f.stops();
        String stopsText = stops == 0 ? "Direct" : stops + " stop" + (stops > 1 ? "s" : "");
        String fareClass = f.price() < 3000 ? "Economy" : f.price() < 6000 ? "Premium Economy" : "Business";
        double confidence = 0.8;
        String quality = DataQuality.MEDIUM.value();
        if (f instanceof ReconciledFlight rf) {
            confidence = rf.confidenceScore();
            quality = rf.dataQuality().value();
        }
        String airline = Objects.toString(f.airline(), "");
        return new FlightCard(
                airline + "_" + Objects.toString(f.flightCode(), "") + "_" + Objects.toString(f.departureTime(), ""),
                airline,
                AIRLINE_NAMES.getOrDefault(airline, airline),
                f.flightCode(),
                f.departureTime(),
                f.searchDate(),
                f.price(),
                rupees(f.price()),
                f.duration(),
                stopsText,
                stops,
                fareClass,
                f.source(),
                confidence,
                quality);
    }

    static String rupees(int amount) {
        return String.format(Locale.US, "₹%,d", amount);
    }

    private static String dateRange(List<? extends FlightView> flights) {
        String earliest = null;
        String latest = null;
        for (FlightView f : flights) {
            String d = f.searchDate();
            if (d == null || d.isBlank()) continue;
            if (earliest == null || d.compareTo(earliest) < 0) earliest = d;
            if (latest == null || d.compareTo(latest) > 0) latest = d;
        }
        if (earliest == null) return "across multiple dates";
        return earliest.equals(latest) ? "on " + earliest : "from " + earliest + " to " + latest;
    }
}
