package com.example.concierge.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "assistant.reconciliation")
public class ReconciliationProperties {
    private Map<String, Double> sourceReliability = defaults();
    private double defaultReliability = 0.5;
    private double priceTolerance = 0.15;
    private int timeToleranceMinutes = 30;
    private int maxResults = 3;

    private static Map<String, Double> defaults() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("Amadeus", 0.9);
        m.put("Skyscanner", 0.8);
        m.put("Cleartrip", 0.7);
        m.put("MakeMyTrip", 0.7);
        m.put("Mock", 0.1);
        return m;
    }

    public Map<String, Double> getSourceReliability() { return sourceReliability; }
    public void setSourceReliability(Map<String, Double> sourceReliability) { this.sourceReliability = sourceReliability; }

    public double getDefaultReliability() { return defaultReliability; }
    public void setDefaultReliability(double defaultReliability) { this.defaultReliability = defaultReliability; }

    public double getPriceTolerance() { return priceTolerance; }
    public void setPriceTolerance(double priceTolerance) { this.priceTolerance = priceTolerance; }

    public int getTimeToleranceMinutes() { return timeToleranceMinutes; }
    public void setTimeToleranceMinutes(int timeToleranceMinutes) { this.timeToleranceMinutes = timeToleranceMinutes; }

    public int getMaxResults() { return maxResults; }
    public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
}
