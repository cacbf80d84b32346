package com.example.concierge.assistant.search;

import com.example.concierge.assistant.config.AssistantSearchProperties;
import com.example.concierge.assistant.source.FlightView;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Orders flights by what the user asked for and keeps the first {@code displayCount}.
 */
@Component
public class Ranker {

    private static final Set<String> PRICE_KEYWORDS = Set.of("cheap", "cheapest", "lowest", "budget", "affordable");
    private static final String LATEST_TIME = "23:59";

    private final int displayCount;

    public Ranker(AssistantSearchProperties props) {
        this.displayCount = Math.max(1, props.getDisplayCount());
    }

    public <T extends FlightView> List<T> rank(List<T> flights, String preference) {
        List<T> sorted = sort(flights, preference);
        return sorted.size() > displayCount ? new ArrayList<>(sorted.subList(0, displayCount)) : sorted;
    }

    /** Full ordering without the display cap. Stable for equal keys. */
    public <T extends FlightView> List<T> sort(List<T> flights, String preference) {
        if (flights == null || flights.isEmpty()) return new ArrayList<>();
        List<T> out = new ArrayList<>(flights);
        Comparator<FlightView> byPrice = Comparator.comparingInt(FlightView::price);
        if (preference == null || preference.isBlank() || mentionsPrice(preference)) {
            out.sort(byPrice);
        } else {
            Comparator<FlightView> byTime = Comparator.comparing(f -> f.departureTime() != null ? f.departureTime() : LATEST_TIME);
            out.sort(byTime.thenComparing(byPrice));
        }
        return out;
    }

    static boolean mentionsPrice(String preference) {
        String low = preference.toLowerCase(Locale.ROOT);
        for (String kw : PRICE_KEYWORDS) {
            if (low.contains(kw)) return true;
        }
        return false;
    }
}
