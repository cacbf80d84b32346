package com.example.concierge.assistant.session;

import com.example.concierge.assistant.config.AssistantSessionProperties;
import com.example.concierge.assistant.conversation.SessionContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Session store on a bounded Caffeine cache. Each entry expires after the ttl it was last written with;
 * expired entries are dropped by the cache itself, whether or not anyone asks for them again.
 */
@Repository
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionRepository.class);

    private record Entry(SessionContext context, long ttlNanos) {}

    private static final class TtlExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    private final Cache<String, Entry> sessions;

    public InMemorySessionRepository(Clock clock, AssistantSessionProperties props) {
        this.sessions = Caffeine.newBuilder()
                .maximumSize(Math.max(1, props.getMaxSessions()))
                .expireAfter(new TtlExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .scheduler(Scheduler.systemScheduler())
                .executor(Runnable::run)
                .removalListener((String id, Entry e, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("[InMemorySessionRepository] Session {} evicted ({})", id, cause);
                    }
                })
                .build();
    }

    @Override
    public Optional<SessionContext> get(String sessionId) {
        if (sessionId == null) return Optional.empty();
        Entry e = sessions.getIfPresent(sessionId);
        return e == null ? Optional.empty() : Optional.of(e.context().copy());
    }

    @Override
    public void put(String sessionId, SessionContext context, Duration ttl) {
        if (sessionId == null || context == null) return;
        long ttlNanos = ttl == null || ttl.isZero() || ttl.isNegative() ? Long.MAX_VALUE : ttl.toNanos();
        sessions.put(sessionId, new Entry(context.copy(), ttlNanos));
    }

    @Override
    public void delete(String sessionId) {
        if (sessionId != null) sessions.invalidate(sessionId);
    }

    @Override
    public Set<String> keys() {
        return new TreeSet<>(sessions.asMap().keySet());
    }

    /** Number of live sessions after pending expiry has been applied. */
    long size() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
