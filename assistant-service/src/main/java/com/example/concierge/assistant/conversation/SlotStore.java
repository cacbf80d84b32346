package com.example.concierge.assistant.conversation;

import com.example.concierge.assistant.config.AssistantSessionProperties;
import com.example.concierge.assistant.session.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * Merges freshly extracted slots into the persisted session context.
 * Merging and saving are separate steps so a turn can be abandoned without leaving partial state behind.
 */
@Component
public class SlotStore {

    private static final Logger log = LoggerFactory.getLogger(SlotStore.class);

    private final SessionRepository repository;
    private final AssistantSessionProperties props;
    private final Clock clock;

    public SlotStore(SessionRepository repository, AssistantSessionProperties props, Clock clock) {
        this.repository = repository;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Returns the stored context with every non-empty extracted field applied on top.
     * Never throws; on failure the result holds only what the extraction carried.
     */
    public SessionContext merge(String sessionId, SlotExtraction extraction) {
        SlotExtraction ex = extraction != null ? extraction : SlotExtraction.empty();
        try {
            SessionContext ctx = repository.get(sessionId).orElseGet(SessionContext::new);
            if (ex.intent() == Intent.RESTART) {
                ctx.restart();
            }
            apply(ctx, ex);
            ctx.setLastUpdated(clock.instant());
            return ctx;
        } catch (RuntimeException e) {
            log.warn("[SlotStore] Failed to merge session {}: {}", sessionId, e.toString());
            SessionContext minimal = new SessionContext();
            apply(minimal, ex);
            minimal.setLastUpdated(clock.instant());
            return minimal;
        }
    }

    public Optional<SessionContext> load(String sessionId) {
        return repository.get(sessionId);
    }

    public void save(String sessionId, SessionContext context) {
        repository.put(sessionId, context, props.getTtl());
        log.debug("[SlotStore] Saved {} -> {}", sessionId, context);
    }

    public void clear(String sessionId) {
        repository.delete(sessionId);
    }

    public Set<String> sessionIds() {
        return repository.keys();
    }

    private static void apply(SessionContext ctx, SlotExtraction ex) {
        if (ex.intent() != null && ex.intent() != Intent.RESTART) ctx.setIntent(ex.intent());
        if (CityRef.isPresent(ex.from())) ctx.setFrom(ex.from());
        if (CityRef.isPresent(ex.to())) ctx.setTo(ex.to());
        if (ex.date() != null && !ex.date().isBlank()) ctx.setDate(ex.date().trim());
        if (ex.preference() != null && ex.preference() != Preference.NONE) ctx.setPreference(ex.preference());
    }
}
