package com.example.concierge.assistant.reconcile;

import com.example.concierge.assistant.config.ReconciliationProperties;
import com.example.concierge.assistant.source.RawOffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Merges offers that several sources report for the same real flight into one trusted record.
 *
 * <p>Grouping is first-match: each ungrouped offer opens a group and pulls in every later ungrouped offer
 * similar to it. Within a group every field is taken from the most reliable source; nothing is averaged.
 * All methods are stateless and safe to call from any thread.</p>
 */
@Component
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final SourceReliability reliability;
    private final double priceTolerance;
    private final int timeToleranceMinutes;
    private final int maxResults;

    public Reconciler(SourceReliability reliability, ReconciliationProperties props) {
        this.reliability = reliability;
        this.priceTolerance = props.getPriceTolerance();
        this.timeToleranceMinutes = props.getTimeToleranceMinutes();
        this.maxResults = Math.max(1, props.getMaxResults());
    }

    /** An offer tagged with the source it came from and that source's weight. */
    record TaggedOffer(RawOffer offer, String source, double reliability) {}

    /**
     * @param offersBySource offers keyed by source name, iterated in map order
     * @return at most {@code maxResults} flights, highest confidence first
     */
    public List<ReconciledFlight> reconcile(Map<String, List<RawOffer>> offersBySource) {
        if (offersBySource == null || offersBySource.isEmpty()) return List.of();
        List<TaggedOffer> all = flatten(offersBySource);
        if (all.isEmpty()) return List.of();

        List<List<TaggedOffer>> groups = group(all);
        List<ReconciledFlight> out = new ArrayList<>(groups.size());
        for (List<TaggedOffer> g : groups) {
            out.add(g.size() == 1 ? single(g.get(0)) : resolve(g));
        }
        out.sort(Comparator.comparingDouble(ReconciledFlight::confidenceScore).reversed());
        List<ReconciledFlight> top = out.size() > maxResults ? new ArrayList<>(out.subList(0, maxResults)) : out;
        log.debug("[Reconciler] {} offers from {} sources -> {} groups, returning {}",
                all.size(), offersBySource.size(), groups.size(), top.size());
        return top;
    }

    /**
     * Counts, for each offer, how many other sources report a similar flight.
     */
    public ReconciliationReport report(Map<String, List<RawOffer>> offersBySource) {
        int totalSources = offersBySource == null ? 0 : offersBySource.size();
        int totalFlights = 0;
        int conflicts = 0;
        if (offersBySource != null) {
            for (Map.Entry<String, List<RawOffer>> en : offersBySource.entrySet()) {
                List<RawOffer> offers = en.getValue() != null ? en.getValue() : List.of();
                totalFlights += offers.size();
                for (RawOffer offer : offers) {
                    for (Map.Entry<String, List<RawOffer>> other : offersBySource.entrySet()) {
                        if (en.getKey().equals(other.getKey()) || other.getValue() == null) continue;
                        for (RawOffer candidate : other.getValue()) {
                            if (candidate != null && similar(offer, candidate)) {
                                conflicts++;
                                break;
                            }
                        }
                    }
                }
            }
        }
        return new ReconciliationReport(totalSources, totalFlights, conflicts, conflicts > 0,
                reliability.asMap(), priceTolerance, timeToleranceMinutes);
    }

    /**
     * Same airline, departure within the time tolerance and price within the price tolerance.
     * An unparsable time or a non-positive price does not count against a match.
     */
    public boolean similar(RawOffer a, RawOffer b) {
        if (a == null || b == null) return false;
        if (a.airline() == null || !a.airline().equals(b.airline())) return false;

        Integer t1 = minutesOfDay(a.departureTime());
        Integer t2 = minutesOfDay(b.departureTime());
        if (t1 != null && t2 != null && Math.abs(t1 - t2) > timeToleranceMinutes) {
            return false;
        }
        int p1 = a.price();
        int p2 = b.price();
        if (p1 > 0 && p2 > 0) {
            double diff = Math.abs(p1 - p2) / (double) Math.max(p1, p2);
            if (diff > priceTolerance) return false;
        }
        return true;
    }

    private List<TaggedOffer> flatten(Map<String, List<RawOffer>> offersBySource) {
        List<TaggedOffer> all = new ArrayList<>();
        offersBySource.forEach((source, offers) -> {
            if (offers == null) return;
            double weight = reliability.weightOf(source);
            for (RawOffer o : offers) {
                if (o != null) all.add(new TaggedOffer(o.withSource(source), source, weight));
            }
        });
        return all;
    }

    private List<List<TaggedOffer>> group(List<TaggedOffer> all) {
        List<List<TaggedOffer>> groups = new ArrayList<>();
        boolean[] used = new boolean[all.size()];
        for (int i = 0; i < all.size(); i++) {
            if (used[i]) continue;
            TaggedOffer opener = all.get(i);
            List<TaggedOffer> g = new ArrayList<>();
            g.add(opener);
            used[i] = true;
            for (int j = i + 1; j < all.size(); j++) {
                if (used[j]) continue;
                TaggedOffer other = all.get(j);
                // distinct flights from one source are never the same flight
                if (g.stream().anyMatch(m -> m.source().equals(other.source()))) continue;
                if (similar(opener.offer(), other.offer())) {
                    g.add(other);
                    used[j] = true;
                }
            }
            groups.add(g);
        }
        return groups;
    }

    private ReconciledFlight single(TaggedOffer t) {
        RawOffer o = t.offer();
        double confidence = t.reliability();
        return new ReconciledFlight(o.airline(), o.flightCode(), o.departureTime(), o.price(), o.duration(),
                o.stops(), t.source(), o.searchDate(), confidence, DataQuality.fromConfidence(confidence),
                List.of(t.source()), t.source(), ReconciledFlight.SINGLE_SOURCE, PriceAnalysis.singleSource(o.price()));
    }

    private ReconciledFlight resolve(List<TaggedOffer> group) {
        TaggedOffer winner = group.get(0);
        for (TaggedOffer t : group) {
            if (t.reliability() > winner.reliability()) winner = t;
        }
        double confidence = confidence(group);
        List<Integer> prices = group.stream().map(t -> t.offer().price()).filter(p -> p > 0).toList();
        LinkedHashSet<String> sources = new LinkedHashSet<>();
        group.forEach(t -> sources.add(t.source()));

        RawOffer w = winner.offer();
        ReconciledFlight out = new ReconciledFlight(w.airline(), w.flightCode(), w.departureTime(), w.price(),
                w.duration(), w.stops(), winner.source(), w.searchDate(), confidence,
                DataQuality.fromConfidence(confidence), new ArrayList<>(sources), winner.source(),
                ReconciledFlight.MOST_RELIABLE_SOURCE, PriceAnalysis.of(prices, w.price()));
        log.info("[Reconciler] Reconciled {} records into {} {} at {} from {} (confidence {})",
                group.size(), out.airline(), out.flightCode(), out.price(), out.selectedSource(),
                String.format("%.2f", confidence));
        return out;
    }

    /** 0.7 x best source weight + 0.3 x mean of price and time agreement, clamped to [0, 1]. */
    double confidence(List<TaggedOffer> group) {
        double base = group.stream().mapToDouble(TaggedOffer::reliability).max().orElse(0.0);
        if (group.size() < 2) return clamp(base);

        List<Integer> prices = group.stream().map(t -> t.offer().price()).filter(p -> p > 0).toList();
        double priceAgreement = 0.5;
        if (!prices.isEmpty()) {
            int max = prices.stream().mapToInt(Integer::intValue).max().getAsInt();
            int min = prices.stream().mapToInt(Integer::intValue).min().getAsInt();
            priceAgreement = Math.max(0.0, 1.0 - (max - min) / (double) max);
        }

        List<Integer> times = new ArrayList<>();
        for (TaggedOffer t : group) {
            Integer m = minutesOfDay(t.offer().departureTime());
            if (m != null) times.add(m);
        }
        double timeAgreement = 0.5;
        if (!times.isEmpty()) {
            int spread = times.stream().mapToInt(Integer::intValue).max().getAsInt()
                    - times.stream().mapToInt(Integer::intValue).min().getAsInt();
            double hours = spread / 60.0;
            timeAgreement = Math.max(0.0, 1.0 - hours / 2.0);
        }
        double agreementBonus = (priceAgreement + timeAgreement) / 2.0;
        return clamp(base * 0.7 + agreementBonus * 0.3);
    }

    /** "HH:mm" to minutes since midnight; null when the value is not exactly that shape. */
    static Integer minutesOfDay(String time) {
        if (time == null || time.isBlank() || time.indexOf(':') < 0) return null;
        String[] parts = time.trim().split(":");
        if (parts.length != 2) return null;
        try {
            int h = Integer.parseInt(parts[0].trim());
            int m = Integer.parseInt(parts[1].trim());
            if (h < 0 || h > 23 || m < 0 || m > 59) return null;
            return h * 60 + m;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double clamp(double v) {
        return Math.min(1.0, Math.max(0.0, v));
    }
}
