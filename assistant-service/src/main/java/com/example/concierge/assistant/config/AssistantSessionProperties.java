package com.example.concierge.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "assistant.session")
public class AssistantSessionProperties {
    private Duration ttl = Duration.ofSeconds(86400);
    private Duration lockTimeout = Duration.ofSeconds(30);
    private long maxSessions = 10_000;

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }

    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }

    public long getMaxSessions() { return maxSessions; }
    public void setMaxSessions(long maxSessions) { this.maxSessions = maxSessions; }
}
