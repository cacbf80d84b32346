package com.example.concierge.assistant.reconcile;

import com.example.concierge.assistant.config.ReconciliationProperties;
import com.example.concierge.assistant.source.RawOffer;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReconcilerTest {

    private final ReconciliationProperties props = new ReconciliationProperties();
    private final Reconciler reconciler = new Reconciler(new SourceReliability(props), props);

    private static RawOffer offer(String airline, String code, String time, int price) {
        return new RawOffer(airline, code, time, price, "2:05:00", 0, "ignored", "2025-12-25");
    }

    @Test
    void twoSourcesAgreeingOnOneFlightMergeIntoTheMoreReliableRecord() {
        Map<String, List<RawOffer>> bySource = new LinkedHashMap<>();
        bySource.put("Skyscanner", List.of(offer("AI", "AI-101", "08:10", 5200)));
        bySource.put("Amadeus", List.of(offer("AI", "AI-101", "08:00", 5000)));

        List<ReconciledFlight> out = reconciler.reconcile(bySource);

        assertThat(out).hasSize(1);
        ReconciledFlight f = out.get(0);
        assertThat(f.price()).isEqualTo(5000);
        assertThat(f.departureTime()).isEqualTo("08:00");
        assertThat(f.selectedSource()).isEqualTo("Amadeus");
        assertThat(f.source()).isEqualTo("Amadeus");
        assertThat(f.sourcesUsed()).containsExactly("Skyscanner", "Amadeus");
        assertThat(f.conflictResolution()).isEqualTo(ReconciledFlight.MOST_RELIABLE_SOURCE);
        assertThat(f.confidenceScore()).isGreaterThan(0.8).isLessThanOrEqualTo(1.0);
        assertThat(f.dataQuality()).isEqualTo(DataQuality.HIGH);

        PriceAnalysis pa = f.priceAnalysis();
        assertThat(pa.variance()).isEqualTo(200);
        assertThat(pa.variancePercentage()).isEqualTo(3.8);
        assertThat(pa.consistency()).isEqualTo("high");
        assertThat(pa.priceRange()).isEqualTo(new PriceAnalysis.PriceRange(5000, 5200));
        assertThat(pa.priceCount()).isEqualTo(2);
    }

    @Test
    void singleSourceFlightCarriesSourceReliabilityAsConfidence() {
        List<ReconciledFlight> out = reconciler.reconcile(Map.of("Mock", List.of(offer("6E", "6E-202", "09:00", 4000))));

        assertThat(out).hasSize(1);
        ReconciledFlight f = out.get(0);
        assertThat(f.confidenceScore()).isCloseTo(0.1, within(1e-9));
        assertThat(f.dataQuality()).isEqualTo(DataQuality.UNKNOWN);
        assertThat(f.conflictResolution()).isEqualTo(ReconciledFlight.SINGLE_SOURCE);
        assertThat(f.priceAnalysis().consistency()).isEqualTo("single_source");
        assertThat(f.sourcesUsed()).containsExactly("Mock");
    }

    @Test
    void unknownSourceUsesDefaultReliability() {
        List<ReconciledFlight> out = reconciler.reconcile(Map.of("Kayak", List.of(offer("SG", "SG-1", "10:00", 3000))));
        assertThat(out.get(0).confidenceScore()).isCloseTo(0.5, within(1e-9));
        assertThat(out.get(0).dataQuality()).isEqualTo(DataQuality.LOW);
    }

    @Test
    void equalReliabilityKeepsTheFirstOffer() {
        Map<String, List<RawOffer>> bySource = new LinkedHashMap<>();
        bySource.put("Cleartrip", List.of(offer("UK", "UK-811", "18:00", 4000)));
        bySource.put("MakeMyTrip", List.of(offer("UK", "UK-811", "18:05", 4100)));

        ReconciledFlight f = reconciler.reconcile(bySource).get(0);

        assertThat(f.selectedSource()).isEqualTo("Cleartrip");
        assertThat(f.price()).isEqualTo(4000);
    }

    @Test
    void offersFromOneSourceAreNeverMerged() {
        List<ReconciledFlight> out = reconciler.reconcile(Map.of("Amadeus", List.of(
                offer("AI", "AI-101", "08:00", 5000),
                offer("AI", "AI-103", "08:05", 5000))));

        assertThat(out).hasSize(2);
    }

    @Test
    void resultIsCappedAndOrderedByConfidence() {
        Map<String, List<RawOffer>> bySource = new LinkedHashMap<>();
        bySource.put("Mock", List.of(offer("AI", "AI-1", "06:00", 3000), offer("6E", "6E-2", "07:00", 3100)));
        bySource.put("Cleartrip", List.of(offer("SG", "SG-3", "12:00", 3200)));
        bySource.put("Amadeus", List.of(offer("QP", "QP-4", "15:00", 3300), offer("UK", "UK-5", "20:00", 3400)));

        List<ReconciledFlight> out = reconciler.reconcile(bySource);

        assertThat(out).hasSize(3);
        assertThat(out).extracting(ReconciledFlight::flightCode).containsExactly("QP-4", "UK-5", "SG-3");
    }

    @Test
    void emptyInputGivesEmptyResult() {
        assertThat(reconciler.reconcile(Map.of())).isEmpty();
        assertThat(reconciler.reconcile(Map.of("Amadeus", List.of()))).isEmpty();
        assertThat(reconciler.reconcile(null)).isEmpty();
    }

    @Test
    void similarity() {
        RawOffer base = offer("AI", "AI-101", "08:00", 5000);

        assertThat(reconciler.similar(base, offer("AI", "AI-101", "08:30", 5750))).isTrue();
        assertThat(reconciler.similar(base, offer("6E", "6E-101", "08:00", 5000))).isFalse();
        assertThat(reconciler.similar(base, offer("AI", "AI-101", "08:31", 5000))).isFalse();
        assertThat(reconciler.similar(base, offer("AI", "AI-101", "08:00", 6000))).isFalse();
        assertThat(reconciler.similar(base, offer("AI", "AI-101", "morning", 5000))).isTrue();
        assertThat(reconciler.similar(base, null)).isFalse();
    }

    @Test
    void confidenceBlendsReliabilityWithAgreement() {
        List<Reconciler.TaggedOffer> group = List.of(
                new Reconciler.TaggedOffer(offer("AI", "AI-1", "08:00", 5000), "Amadeus", 0.9),
                new Reconciler.TaggedOffer(offer("AI", "AI-1", "08:00", 5000), "Skyscanner", 0.8));

        // perfect agreement: 0.9 * 0.7 + 1.0 * 0.3
        assertThat(reconciler.confidence(group)).isCloseTo(0.93, within(1e-9));
    }

    @Test
    void minutesOfDayRejectsOtherShapes() {
        assertThat(Reconciler.minutesOfDay("08:30")).isEqualTo(510);
        assertThat(Reconciler.minutesOfDay("8:30:00")).isNull();
        assertThat(Reconciler.minutesOfDay("25:00")).isNull();
        assertThat(Reconciler.minutesOfDay("")).isNull();
    }

    @Test
    void reportCountsCrossSourceMatches() {
        Map<String, List<RawOffer>> bySource = new LinkedHashMap<>();
        bySource.put("Amadeus", List.of(offer("AI", "AI-101", "08:00", 5000), offer("SG", "SG-9", "21:00", 2500)));
        bySource.put("Skyscanner", List.of(offer("AI", "AI-101", "08:10", 5200)));

        ReconciliationReport report = reconciler.report(bySource);

        assertThat(report.totalSources()).isEqualTo(2);
        assertThat(report.totalFlights()).isEqualTo(3);
        assertThat(report.conflictsDetected()).isEqualTo(2);
        assertThat(report.reconciliationNeeded()).isTrue();
        assertThat(report.sourceReliability()).containsEntry("Amadeus", 0.9);
    }
}
