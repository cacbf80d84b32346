package com.example.concierge.assistant.source;

import com.example.concierge.assistant.config.MockSourceProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockSourceClientTest {

    private final MockSourceClient client = new MockSourceClient(new MockSourceProperties());

    @Test
    void sameQueryGivesSameOffers() {
        List<RawOffer> first = client.fetch("BOM", "DEL", "2025-06-02");
        List<RawOffer> second = client.fetch("bom", "del", "2025-06-02");

        assertThat(first).hasSize(5).isEqualTo(second);
        assertThat(first).allSatisfy(o -> {
            assertThat(o.source()).isEqualTo("Mock");
            assertThat(o.searchDate()).isEqualTo("2025-06-02");
            assertThat(o.departureTime()).matches("\\d{2}:\\d{2}");
            assertThat(o.price()).isPositive();
        });
    }

    @Test
    void missingRouteIsRejected() {
        assertThatThrownBy(() -> client.fetch(null, "DEL", "2025-06-02"))
                .isInstanceOf(SourceUnavailableException.class);
    }
}
