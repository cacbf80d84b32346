package com.example.concierge.assistant.response;

import com.example.concierge.assistant.conversation.BookingStage;
import com.example.concierge.assistant.conversation.CityRef;
import com.example.concierge.assistant.conversation.Intent;
import com.example.concierge.assistant.conversation.Preference;
import com.example.concierge.assistant.conversation.SessionContext;
import com.example.concierge.assistant.source.RawOffer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseAssemblerTest {

    private final ResponseAssembler assembler = new ResponseAssembler();

    private static SessionContext route(String date) {
        SessionContext ctx = new SessionContext();
        ctx.setIntent(Intent.SEARCH_FLIGHTS);
        ctx.setFrom(new CityRef("mumbai", "BOM"));
        ctx.setTo(new CityRef("new york", "JFK"));
        ctx.setDate(date);
        return ctx;
    }

    private static RawOffer offer(String airline, int price, String duration, int stops, String date) {
        return new RawOffer(airline, airline + "-1", "09:15", price, duration, stops, "Mock", date);
    }

    @Test
    void promptsForRouteThenDate() {
        assertThat(assembler.promptForMissing(new SessionContext()))
                .isEqualTo("Where would you like to fly from and to? (From → To)");
        SessionContext noDate = route(null);
        assertThat(assembler.promptForMissing(noDate)).startsWith("When would you like to travel?");
    }

    @Test
    void summaryForOneFlight() {
        String reply = assembler.summarize(route("2025-06-02"), List.of(offer("AI", 4500, "2:00:00", 0, "2025-06-02")));
        assertThat(reply).isEqualTo("Perfect! Found 1 flight from Mumbai to New York on 2025-06-02 for ₹4,500");
    }

    @Test
    void summaryForSeveralFlights() {
        List<RawOffer> flights = List.of(offer("AI", 4500, "2:00:00", 0, "2025-06-02"),
                offer("6E", 3000, "2:10:00", 0, "2025-06-02"));

        assertThat(assembler.summarize(route("2025-06-02"), flights))
                .isEqualTo("Great! Found 2 flights from Mumbai to New York on 2025-06-02 | ₹3,000 - ₹4,500");

        SessionContext cheap = route("2025-06-02");
        cheap.setPreference(Preference.CHEAPEST);
        assertThat(assembler.summarize(cheap, flights))
                .isEqualTo("Found 2 cheapest flights from Mumbai to New York on 2025-06-02 | ₹3,000 - ₹4,500");
    }

    @Test
    void weekSearchSummaryNamesTheDateRange() {
        List<RawOffer> flights = List.of(offer("AI", 4500, "2:00:00", 0, "2025-06-03"),
                offer("6E", 3000, "2:10:00", 0, "2025-06-01"));

        assertThat(assembler.summarize(route(SessionContext.WEEK_SEARCH), flights))
                .isEqualTo("Great! Found 2 flights from Mumbai to New York from 2025-06-01 to 2025-06-03 | ₹3,000 - ₹4,500");
    }

    @Test
    void noFlights() {
        assertThat(assembler.summarize(route("2025-06-02"), List.of())).isEqualTo(ResponseAssembler.NO_FLIGHTS);
        assertThat(assembler.cards(List.of())).isEmpty();
    }

    @Test
    void cardsSortedByPriceWithCheapestAndFastestFlags() {
        List<FlightCard> cards = assembler.cards(List.of(
                offer("UK", 7000, "9:40:00", 2, "2025-06-02"),
                offer("6E", 2900, "2:30:00", 0, "2025-06-02"),
                offer("AI", 4500, "10:05:00", 1, "2025-06-02")));

        assertThat(cards).extracting(FlightCard::getPrice).containsExactly(2900, 4500, 7000);
        assertThat(cards.get(0).isCheapest()).isTrue();
        assertThat(cards.get(1).isFastest()).isTrue();
        assertThat(cards.stream().filter(FlightCard::isFastest)).hasSize(1);

        FlightCard indigo = cards.get(0);
        assertThat(indigo.getAirlineName()).isEqualTo("IndiGo");
        assertThat(indigo.getFormattedPrice()).isEqualTo("₹2,900");
        assertThat(indigo.getStops()).isEqualTo("Direct");
        assertThat(indigo.isDirect()).isTrue();
        assertThat(indigo.getFareClass()).isEqualTo("Economy");
        assertThat(indigo.getId()).isEqualTo("6E_6E-1_09:15");
        assertThat(cards.get(1).getFareClass()).isEqualTo("Premium Economy");
        assertThat(cards.get(2).getStops()).isEqualTo("2 stops");
        assertThat(cards.get(2).getFareClass()).isEqualTo("Business");
    }

    @Test
    void suggestedActionsFollowTheStage() {
        SessionContext ctx = route("2025-06-02");
        assertThat(assembler.suggestedActions(ctx)).containsExactly("Set date to tomorrow", "Evening flights");
        ctx.advanceTo(BookingStage.SEARCH);
        assertThat(assembler.suggestedActions(ctx)).isEmpty();
        ctx.advanceTo(BookingStage.REVIEW);
        assertThat(assembler.suggestedActions(ctx)).containsExactly("Confirm & Pay", "Change date", "Change destination");
        ctx.advanceTo(BookingStage.PAYMENT);
        assertThat(assembler.suggestedActions(ctx)).containsExactly("Retry payment", "Change payment method");
        ctx.advanceTo(BookingStage.CONFIRMED);
        assertThat(assembler.suggestedActions(ctx)).containsExactly("Start over");
    }

    @Test
    void stateSummary() {
        SessionContext ctx = route("2025-06-02");
        ctx.setPreference(Preference.EARLIEST);

        Map<String, Object> summary = assembler.stateSummary(ctx);

        assertThat(summary).containsEntry("intent", "search_flights")
                .containsEntry("from", "mumbai")
                .containsEntry("to", "new york")
                .containsEntry("date", "2025-06-02")
                .containsEntry("preference", "earliest")
                .containsEntry("bookingStage", BookingStage.COLLECT_SLOTS.value());
    }

    @Test
    void bookingMessages() {
        assertThat(assembler.paymentPrompt("upi://pay?x")).isEqualTo("Ready to pay? Tap UPI link: upi://pay?x");
        assertThat(assembler.confirmation("PNRABC123", "mumbai → goa", "2025-06-02"))
                .isEqualTo("Booked! PNR PNRABC123. Route mumbai → goa on 2025-06-02. Ticket and receipt sent.");
        assertThat(ResponseAssembler.rupees(123456)).isEqualTo("₹123,456");
    }
}
