package com.example.concierge.assistant.reconcile;

import com.example.concierge.assistant.source.FlightView;

import java.util.List;

/**
 * A flight as trusted after comparing sources. Descriptive fields come verbatim from {@code selectedSource}.
 */
public record ReconciledFlight(String airline,
                               String flightCode,
                               String departureTime,
                               int price,
                               String duration,
                               int stops,
                               String source,
                               String searchDate,
                               double confidenceScore,
                               DataQuality dataQuality,
                               List<String> sourcesUsed,
                               String selectedSource,
                               String conflictResolution,
                               PriceAnalysis priceAnalysis) implements FlightView {

    public static final String SINGLE_SOURCE = "single_source";
    public static final String MOST_RELIABLE_SOURCE = "most_reliable_source";

    public ReconciledFlight {
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
    }
}
