package com.example.concierge.assistant.reconcile;

import java.util.List;

/**
 * How far the sources disagreed on price for one reconciled flight.
 */
public record PriceAnalysis(String consistency,
                            int variance,
                            double variancePercentage,
                            PriceRange priceRange,
                            int selectedPrice,
                            int priceCount) {

    public record PriceRange(int min, int max) {}

    public static PriceAnalysis singleSource(int selectedPrice) {
        return new PriceAnalysis("single_source", 0, 0.0,
                new PriceRange(selectedPrice, selectedPrice), selectedPrice, 1);
    }

    /** @param prices positive prices only */
    public static PriceAnalysis of(List<Integer> prices, int selectedPrice) {
        if (prices == null || prices.size() < 2) return singleSource(selectedPrice);
        int min = prices.stream().mapToInt(Integer::intValue).min().orElse(selectedPrice);
        int max = prices.stream().mapToInt(Integer::intValue).max().orElse(selectedPrice);
        int variance = max - min;
        double pct = max > 0 ? (variance * 100.0) / max : 0.0;
        String consistency = pct <= 5 ? "high" : pct <= 15 ? "medium" : "low";
        return new PriceAnalysis(consistency, variance, Math.round(pct * 10) / 10.0,
                new PriceRange(min, max), selectedPrice, prices.size());
    }
}
