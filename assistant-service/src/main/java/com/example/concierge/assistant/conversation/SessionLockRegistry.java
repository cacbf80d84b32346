package com.example.concierge.assistant.conversation;

import com.example.concierge.assistant.config.AssistantSessionProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per session id, so turns of the same session run one at a time while
 * different sessions proceed in parallel.
 *
 * <p>Locks are weakly held: a lock stays registered while some turn references it and is
 * collected once none does, so every caller of one session shares the same instance.</p>
 */
@Component
public class SessionLockRegistry {

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .executor(Runnable::run)
            .build();
    private final long timeoutMs;

    public SessionLockRegistry(AssistantSessionProperties props) {
        this.timeoutMs = Math.max(1, props.getLockTimeout().toMillis());
    }

    public <T> T withLock(String sessionId, Supplier<T> work) {
        ReentrantLock lock = locks.get(sessionId, k -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for session " + sessionId, e);
        }
        if (!acquired) {
            throw new IllegalStateException("Session " + sessionId + " is busy");
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String sessionId) {
        ReentrantLock lock = locks.getIfPresent(sessionId);
        return lock != null && lock.isLocked();
    }

    /** Locks still registered after collected ones have been purged. */
    long size() {
        locks.cleanUp();
        return locks.estimatedSize();
    }
}
