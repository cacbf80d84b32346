package com.example.concierge.assistant.api;

import com.example.concierge.assistant.conversation.SlotStore;
import com.example.concierge.assistant.response.ResponseAssembler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SlotStore slotStore;
    private final ResponseAssembler assembler;

    public SessionController(SlotStore slotStore, ResponseAssembler assembler) {
        this.slotStore = slotStore;
        this.assembler = assembler;
    }

    @GetMapping
    public Map<String, Object> listKeys() {
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("keys", slotStore.sessionIds());
        return resp;
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<Map<String, Object>> read(@PathVariable String sessionId) {
        return slotStore.load(sessionId)
                .map(ctx -> {
                    Map<String, Object> resp = new LinkedHashMap<>();
                    resp.put("sessionId", sessionId);
                    resp.put("state", assembler.stateSummary(ctx));
                    resp.put("suggestedActions", assembler.suggestedActions(ctx));
                    resp.put("lastUpdated", ctx.getLastUpdated());
                    return ResponseEntity.ok(resp);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> clear(@PathVariable String sessionId) {
        slotStore.clear(sessionId);
        return ResponseEntity.noContent().build();
    }
}
