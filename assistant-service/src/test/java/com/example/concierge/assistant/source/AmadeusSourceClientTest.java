package com.example.concierge.assistant.source;

import com.example.concierge.assistant.config.AmadeusProperties;
import com.example.concierge.assistant.config.AssistantSearchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmadeusSourceClientTest {

    private final AmadeusSourceClient client = new AmadeusSourceClient(WebClient.builder(),
            new AmadeusProperties(), new AssistantSearchProperties(), Clock.systemUTC());

    @Test
    void mapsFlightOffers() throws Exception {
        JsonNode body = new ObjectMapper().readTree("""
                {"data":[
                  {"id":"1","price":{"total":"5321.40"},
                   "itineraries":[{"segments":[
                     {"carrierCode":"AI","number":"865","departure":{"at":"2025-06-02T07:05:00"},"arrival":{"at":"2025-06-02T08:10:00"}},
                     {"carrierCode":"AI","number":"701","departure":{"at":"2025-06-02T09:00:00"},"arrival":{"at":"2025-06-02T09:50:00"}}
                   ]}]},
                  {"id":"2","price":{"total":"4100"},
                   "itineraries":[{"segments":[{"carrierCode":"","number":"1"}]}]}
                ]}""");

        List<RawOffer> offers = client.mapOffers(body, "2025-06-02");

        assertThat(offers).hasSize(1);
        RawOffer o = offers.get(0);
        assertThat(o.airline()).isEqualTo("AI");
        assertThat(o.flightCode()).isEqualTo("AI-865");
        assertThat(o.departureTime()).isEqualTo("07:05");
        assertThat(o.price()).isEqualTo(5321);
        assertThat(o.duration()).isEqualTo("2:45:00");
        assertThat(o.stops()).isEqualTo(1);
        assertThat(o.source()).isEqualTo("Amadeus");
    }

    @Test
    void emptyBodyMapsToNothing() {
        assertThat(client.mapOffers(null, "2025-06-02")).isEmpty();
    }

    @Test
    void durationFormat() {
        assertThat(AmadeusSourceClient.formatDuration(Duration.ofMinutes(125))).isEqualTo("2:05:00");
    }

    @Test
    void missingCredentialsMakeSourceUnavailable() {
        assertThatThrownBy(() -> client.fetch("BOM", "DEL", "2025-06-02"))
                .isInstanceOf(SourceUnavailableException.class);
    }
}
