package com.example.concierge.assistant.service;

import com.example.concierge.assistant.response.FlightCard;

import java.util.List;
import java.util.Map;

/**
 * What one chat turn returns to the caller.
 */
public record ChatTurnResult(String sessionId,
                             String reply,
                             List<FlightCard> flightCards,
                             Map<String, Object> stateSummary,
                             List<String> suggestedActions) {

    public ChatTurnResult {
        flightCards = flightCards == null ? List.of() : List.copyOf(flightCards);
        stateSummary = stateSummary == null ? Map.of() : stateSummary;
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
