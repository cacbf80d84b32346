package com.example.concierge.assistant.conversation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionContextTest {

    @Test
    void stageOnlyMovesForward() {
        SessionContext ctx = new SessionContext();
        assertThat(ctx.advanceTo(BookingStage.REVIEW)).isTrue();
        assertThat(ctx.advanceTo(BookingStage.SEARCH)).isFalse();
        assertThat(ctx.getBookingStage()).isEqualTo(BookingStage.REVIEW);
        assertThat(ctx.advanceTo(BookingStage.REVIEW)).isFalse();
        assertThat(ctx.advanceTo(BookingStage.CONFIRMED)).isTrue();
    }

    @Test
    void restartClearsEverything() {
        SessionContext ctx = new SessionContext();
        ctx.setIntent(Intent.CONFIRM);
        ctx.setFrom(CityRef.of("pune"));
        ctx.setDate("2025-01-01");
        ctx.setPreference(Preference.CHEAPEST);
        ctx.setPaymentConfirmed(true);
        ctx.advanceTo(BookingStage.PAYMENT);

        ctx.restart();

        assertThat(ctx.hasIntent()).isFalse();
        assertThat(ctx.hasFrom()).isFalse();
        assertThat(ctx.hasDate()).isFalse();
        assertThat(ctx.getPreference()).isEqualTo(Preference.NONE);
        assertThat(ctx.isPaymentConfirmed()).isFalse();
        assertThat(ctx.getBookingStage()).isEqualTo(BookingStage.COLLECT_SLOTS);
    }

    @Test
    void copyIsIndependent() {
        SessionContext ctx = new SessionContext();
        ctx.setDate("2025-01-01");
        SessionContext copy = ctx.copy();
        copy.setDate("2025-02-02");
        assertThat(ctx.getDate()).isEqualTo("2025-01-01");
    }

    @Test
    void weekSearchWhenDateIsOpen() {
        SessionContext ctx = new SessionContext();
        assertThat(ctx.isWeekSearch()).isTrue();
        ctx.setDate(SessionContext.WEEK_SEARCH);
        assertThat(ctx.isWeekSearch()).isTrue();
        ctx.setDate("2025-03-04");
        assertThat(ctx.isWeekSearch()).isFalse();
    }
}
