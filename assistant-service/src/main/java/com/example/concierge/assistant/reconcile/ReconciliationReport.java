package com.example.concierge.assistant.reconcile;

import java.util.Map;

public record ReconciliationReport(int totalSources,
                                   int totalFlights,
                                   int conflictsDetected,
                                   boolean reconciliationNeeded,
                                   Map<String, Double> sourceReliability,
                                   double priceTolerance,
                                   int timeToleranceMinutes) {
}
