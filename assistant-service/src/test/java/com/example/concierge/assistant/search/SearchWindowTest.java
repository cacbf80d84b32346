package com.example.concierge.assistant.search;

import com.example.concierge.assistant.conversation.SessionContext;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SearchWindowTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void specificDateIsSearchedAlone() {
        SessionContext ctx = new SessionContext();
        ctx.setDate("2025-06-10");
        assertThat(SearchWindow.datesFor(ctx, clock, 7)).containsExactly("2025-06-10");
    }

    @Test
    void weekSearchCoversComingDays() {
        SessionContext ctx = new SessionContext();
        ctx.setDate(SessionContext.WEEK_SEARCH);
        assertThat(SearchWindow.datesFor(ctx, clock, 3)).containsExactly("2025-06-01", "2025-06-02", "2025-06-03");
    }
}
