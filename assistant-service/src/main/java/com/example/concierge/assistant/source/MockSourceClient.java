package com.example.concierge.assistant.source;

import com.example.concierge.assistant.config.MockSourceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Offline source. The same route and date always produce the same offers.
 */
@Component
@ConditionalOnProperty(prefix = "assistant.sources.mock", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MockSourceClient implements SourceClient {

    private static final Logger log = LoggerFactory.getLogger(MockSourceClient.class);

    private static final String[] CARRIERS = {"AI", "6E", "SG", "QP", "UK"};

    private final MockSourceProperties props;

    public MockSourceClient(MockSourceProperties props) {
        this.props = props;
    }

    @Override
    public String name() {
        return props.getName();
    }

    @Override
    public List<RawOffer> fetch(String fromCode, String toCode, String date) {
        if (fromCode == null || toCode == null || date == null) {
            throw new SourceUnavailableException(name(), "route and date are required");
        }
        simulateLatency();
        int seed = Objects.hash(fromCode.toUpperCase(Locale.ROOT), toCode.toUpperCase(Locale.ROOT), date);
        Random rnd = new Random(seed);

        int count = Math.max(0, props.getOffers());
        List<RawOffer> offers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String carrier = CARRIERS[i % CARRIERS.length];
            int hour = 5 + (i * 17 / Math.max(1, count)) + rnd.nextInt(2);
            int minute = rnd.nextInt(12) * 5;
            int stops = rnd.nextInt(4) == 0 ? 1 : 0;
            int durationMinutes = 95 + rnd.nextInt(60) + stops * 110;
            int price = 2800 + rnd.nextInt(60) * 100 + stops * 400;
            offers.add(new RawOffer(
                    carrier,
                    carrier + "-" + (100 + rnd.nextInt(900)),
                    String.format("%02d:%02d", Math.min(hour, 23), minute),
                    price,
                    String.format("%d:%02d:00", durationMinutes / 60, durationMinutes % 60),
                    stops,
                    name(),
                    date));
        }
        log.debug("[MockSourceClient] {} offers for {} -> {} on {}", offers.size(), fromCode, toCode, date);
        return offers;
    }

    private void simulateLatency() {
        if (props.getLatencyMs() <= 0) return;
        try {
            Thread.sleep(props.getLatencyMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceTimeoutException(name(), "interrupted while simulating latency", e);
        }
    }
}
