package com.example.concierge.assistant.reconcile;

import com.example.concierge.assistant.config.ReconciliationProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static trust weight per source, fixed at startup.
 */
@Component
public class SourceReliability {

    private final Map<String, Double> weights;
    private final double defaultWeight;

    public SourceReliability(ReconciliationProperties props) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (props.getSourceReliability() != null) {
            props.getSourceReliability().forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, clamp(v));
            });
        }
        this.weights = Collections.unmodifiableMap(copy);
        this.defaultWeight = clamp(props.getDefaultReliability());
    }

    public static SourceReliability of(Map<String, Double> weights, double defaultWeight) {
        ReconciliationProperties props = new ReconciliationProperties();
        props.setSourceReliability(weights);
        props.setDefaultReliability(defaultWeight);
        return new SourceReliability(props);
    }

    public double weightOf(String source) {
        if (source == null) return defaultWeight;
        return weights.getOrDefault(source, defaultWeight);
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    private static double clamp(double v) {
        return Math.min(1.0, Math.max(0.0, v));
    }
}
