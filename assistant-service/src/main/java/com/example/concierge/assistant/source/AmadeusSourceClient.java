package com.example.concierge.assistant.source;

import com.example.concierge.assistant.config.AmadeusProperties;
import com.example.concierge.assistant.config.AssistantSearchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Amadeus Self-Service flight-offers search with an in-memory client-credentials token.
 */
@Component
@ConditionalOnProperty(prefix = "assistant.sources.amadeus", name = "enabled", havingValue = "true")
public class AmadeusSourceClient implements SourceClient {

    private static final Logger log = LoggerFactory.getLogger(AmadeusSourceClient.class);
    static final String NAME = "Amadeus";

    private final WebClient webClient;
    private final AmadeusProperties props;
    private final int maxOffers;
    private final Clock clock;

    private final ReentrantLock tokenLock = new ReentrantLock();
    private volatile String accessToken;
    private volatile Instant tokenExpiresAt = Instant.EPOCH;

    public AmadeusSourceClient(WebClient.Builder builder, AmadeusProperties props,
                               AssistantSearchProperties searchProps, Clock clock) {
        this.webClient = builder.baseUrl(props.getBaseUrl()).build();
        this.props = props;
        this.maxOffers = Math.max(1, searchProps.getMaxOffersRequested());
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<RawOffer> fetch(String fromCode, String toCode, String date) {
        Duration timeout = Duration.ofMillis(props.getRequestTimeoutMs());
        try {
            String token = ensureToken(timeout);
            JsonNode body = webClient.get()
                    .uri(uri -> uri.path(props.getOffersPath())
                            .queryParam("originLocationCode", fromCode)
                            .queryParam("destinationLocationCode", toCode)
                            .queryParam("departureDate", date)
                            .queryParam("adults", props.getAdults())
                            .queryParam("currencyCode", props.getCurrency())
                            .queryParam("max", maxOffers)
                            .build())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            List<RawOffer> offers = mapOffers(body, date);
            log.info("[AmadeusSourceClient] {} offers for {} -> {} on {}", offers.size(), fromCode, toCode, date);
            return offers;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 401) {
                invalidateToken();
            }
            throw new SourceUnavailableException(NAME, "HTTP " + e.getStatusCode().value() + " from flight-offers", e);
        } catch (SourceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(e, "flight-offers");
        }
    }

    private String ensureToken(Duration timeout) {
        if (accessToken != null && clock.instant().isBefore(tokenExpiresAt)) {
            return accessToken;
        }
        tokenLock.lock();
        try {
            if (accessToken != null && clock.instant().isBefore(tokenExpiresAt)) {
                return accessToken;
            }
            if (props.getClientId() == null || props.getClientId().isBlank()) {
                throw new SourceUnavailableException(NAME, "Amadeus client id is not configured");
            }
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("grant_type", "client_credentials");
            form.add("client_id", props.getClientId());
            form.add("client_secret", props.getClientSecret());

            JsonNode resp;
            try {
                resp = webClient.post()
                        .uri(props.getTokenPath())
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .body(BodyInserters.fromFormData(form))
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(timeout)
                        .block();
            } catch (WebClientResponseException e) {
                throw new SourceUnavailableException(NAME, "Token request rejected: HTTP " + e.getStatusCode().value(), e);
            } catch (RuntimeException e) {
                throw translate(e, "token");
            }
            String token = resp != null ? resp.path("access_token").asText(null) : null;
            if (token == null || token.isBlank()) {
                throw new SourceUnavailableException(NAME, "Token response carried no access_token");
            }
            long serverTtl = resp.path("expires_in").asLong(props.getTokenTtlSeconds()) - 60;
            long ttl = Math.max(30, Math.min(serverTtl, props.getTokenTtlSeconds()));
            accessToken = token;
            tokenExpiresAt = clock.instant().plusSeconds(ttl);
            log.info("[AmadeusSourceClient] Obtained access token valid for {}s", ttl);
            return token;
        } finally {
            tokenLock.unlock();
        }
    }

    private void invalidateToken() {
        accessToken = null;
        tokenExpiresAt = Instant.EPOCH;
    }

    private static SourceException translate(RuntimeException e, String call) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof TimeoutException) {
            return new SourceTimeoutException(NAME, "Timed out on " + call + " call", cause);
        }
        return new SourceUnavailableException(NAME, "Failed " + call + " call: " + cause, cause);
    }

    List<RawOffer> mapOffers(JsonNode body, String searchDate) {
        List<RawOffer> out = new ArrayList<>();
        if (body == null || !body.path("data").isArray()) return out;
        for (JsonNode offer : body.path("data")) {
            try {
                JsonNode segments = offer.path("itineraries").path(0).path("segments");
                JsonNode first = segments.path(0);
                JsonNode last = segments.path(segments.size() - 1);
                String carrier = first.path("carrierCode").asText();
                String number = first.path("number").asText();
                String departAt = first.path("departure").path("at").asText();
                String arriveAt = last.path("arrival").path("at").asText();
                if (carrier.isEmpty() || departAt.length() < 16) {
                    log.warn("[AmadeusSourceClient] Skipping offer {} with incomplete segment data", offer.path("id").asText());
                    continue;
                }
                int price = (int) Double.parseDouble(offer.path("price").path("total").asText("0"));
                Duration duration = Duration.between(LocalDateTime.parse(departAt), LocalDateTime.parse(arriveAt));
                out.add(new RawOffer(
                        carrier,
                        carrier + "-" + number,
                        departAt.substring(11, 16),
                        price,
                        formatDuration(duration),
                        segments.size() - 1,
                        NAME,
                        searchDate));
            } catch (RuntimeException e) {
                log.warn("[AmadeusSourceClient] Error parsing offer: {}", e.toString());
            }
        }
        return out;
    }

    /** H:MM:SS, the format every source uses for durations. */
    static String formatDuration(Duration d) {
        long seconds = Math.max(0, d.getSeconds());
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
