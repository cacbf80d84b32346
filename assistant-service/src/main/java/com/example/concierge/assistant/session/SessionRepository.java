package com.example.concierge.assistant.session;

import com.example.concierge.assistant.conversation.SessionContext;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value store for session contexts. Implementations hand out copies so callers never share
 * a live instance with the store.
 */
public interface SessionRepository {

    Optional<SessionContext> get(String sessionId);

    void put(String sessionId, SessionContext context, Duration ttl);

    void delete(String sessionId);

    Set<String> keys();
}
