package com.example.concierge.assistant.conversation;

import com.example.concierge.assistant.config.AssistantSessionProperties;
import com.example.concierge.assistant.session.InMemorySessionRepository;
import com.example.concierge.assistant.session.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SlotStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);
    private SlotStore store;

    @BeforeEach
    void setUp() {
        AssistantSessionProperties props = new AssistantSessionProperties();
        store = new SlotStore(new InMemorySessionRepository(clock, props), props, clock);
    }

    @Test
    void mergeKeepsStoredSlotsWhenNewOnesAreEmpty() {
        store.save("s1", store.merge("s1", new SlotExtraction(Intent.SEARCH_FLIGHTS,
                new CityRef("mumbai", "BOM"), new CityRef("delhi", "DEL"), null, Preference.NONE)));

        SessionContext ctx = store.merge("s1", new SlotExtraction(null, null, null, "2025-06-02", Preference.NONE));

        assertThat(ctx.getFrom().name()).isEqualTo("mumbai");
        assertThat(ctx.getTo().name()).isEqualTo("delhi");
        assertThat(ctx.getDate()).isEqualTo("2025-06-02");
        assertThat(ctx.getIntent()).isEqualTo(Intent.SEARCH_FLIGHTS);
        assertThat(ctx.getLastUpdated()).isEqualTo(clock.instant());
    }

    @Test
    void mergeDoesNotPersistUntilSaved() {
        store.merge("s2", new SlotExtraction(Intent.SEARCH_FLIGHTS, CityRef.of("goa"), null, null, Preference.NONE));
        assertThat(store.load("s2")).isEmpty();
    }

    @Test
    void restartClearsStoredSlotsAndIsNotStoredAsIntent() {
        SessionContext first = store.merge("s3", new SlotExtraction(Intent.SEARCH_FLIGHTS,
                CityRef.of("pune"), CityRef.of("goa"), "2025-06-05", Preference.CHEAPEST));
        first.advanceTo(BookingStage.REVIEW);
        store.save("s3", first);

        SessionContext ctx = store.merge("s3", SlotExtraction.empty().withIntent(Intent.RESTART));

        assertThat(ctx.hasFrom()).isFalse();
        assertThat(ctx.hasTo()).isFalse();
        assertThat(ctx.getIntent()).isNull();
        assertThat(ctx.getPreference()).isEqualTo(Preference.NONE);
        assertThat(ctx.getBookingStage()).isEqualTo(BookingStage.COLLECT_SLOTS);
    }

    @Test
    void failingRepositoryYieldsMinimalContext() {
        SessionRepository broken = new SessionRepository() {
            @Override
            public Optional<SessionContext> get(String sessionId) {
                throw new IllegalStateException("store down");
            }

            @Override
            public void put(String sessionId, SessionContext context, Duration ttl) {
            }

            @Override
            public void delete(String sessionId) {
            }

            @Override
            public Set<String> keys() {
                return Set.of();
            }
        };
        SlotStore failing = new SlotStore(broken, new AssistantSessionProperties(), clock);

        SessionContext ctx = failing.merge("s4", new SlotExtraction(Intent.SEARCH_FLIGHTS,
                CityRef.of("delhi"), null, null, Preference.NONE));

        assertThat(ctx.getFrom().name()).isEqualTo("delhi");
        assertThat(ctx.getIntent()).isEqualTo(Intent.SEARCH_FLIGHTS);
    }

    @Test
    void clearRemovesSession() {
        store.save("s5", new SessionContext());
        assertThat(store.sessionIds()).contains("s5");
        store.clear("s5");
        assertThat(store.load("s5")).isEmpty();
    }
}
