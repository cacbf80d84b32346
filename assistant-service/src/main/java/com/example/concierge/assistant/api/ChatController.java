package com.example.concierge.assistant.api;

import com.example.concierge.assistant.response.FlightCard;
import com.example.concierge.assistant.service.ChatTurnResult;
import com.example.concierge.assistant.service.ChatTurnService;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    public static class ChatRequest {
        private final String sessionId;
        private final String message;
        private final String locale; // accepted, replies are English only

        @JsonCreator
        public ChatRequest(@JsonProperty("sessionId") String sessionId,
                           @JsonProperty("message") String message,
                           @JsonProperty("locale") String locale) {
            this.sessionId = sessionId;
            this.message = message;
            this.locale = locale;
        }
        public String getSessionId() { return sessionId; }
        public String getMessage() { return message; }
        public String getLocale() { return locale; }
    }

    public static class ChatResponse {
        private final String sessionId;
        private final String reply;
        private final List<FlightCard> flightCards;
        private final Map<String, Object> stateSummary;
        private final List<String> suggestedActions;

        public ChatResponse(ChatTurnResult result) {
            this.sessionId = result.sessionId();
            this.reply = result.reply();
            this.flightCards = result.flightCards();
            this.stateSummary = result.stateSummary();
            this.suggestedActions = result.suggestedActions();
        }
        public String getSessionId() { return sessionId; }
        public String getReply() { return reply; }
        public List<FlightCard> getFlightCards() { return flightCards; }
        public Map<String, Object> getStateSummary() { return stateSummary; }
        public List<String> getSuggestedActions() { return suggestedActions; }
    }

    private final ChatTurnService chatTurnService;

    public ChatController(ChatTurnService chatTurnService) {
        this.chatTurnService = chatTurnService;
    }

    @PostMapping
    public CompletableFuture<ResponseEntity<ChatResponse>> chat(@RequestBody(required = false) ChatRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Bad request: empty body");
        }
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("Please provide a non-empty 'message'.");
        }
        return chatTurnService.handleTurnAsync(request.getSessionId(), request.getMessage())
                .thenApply(result -> ResponseEntity.ok(new ChatResponse(result)));
    }

    @PostMapping("/{sessionId}/checkout")
    public ResponseEntity<ChatResponse> checkout(@PathVariable String sessionId) {
        return ResponseEntity.ok(new ChatResponse(chatTurnService.checkout(sessionId)));
    }

    @PostMapping("/{sessionId}/payment-confirmation")
    public ResponseEntity<ChatResponse> confirmPayment(@PathVariable String sessionId) {
        return ResponseEntity.ok(new ChatResponse(chatTurnService.confirmPayment(sessionId)));
    }
}
