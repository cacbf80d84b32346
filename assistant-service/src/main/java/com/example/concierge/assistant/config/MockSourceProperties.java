package com.example.concierge.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "assistant.sources.mock")
public class MockSourceProperties {
    private boolean enabled = true;
    private String name = "Mock";
    private int offers = 5;
    private long latencyMs = 0;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getOffers() { return offers; }
    public void setOffers(int offers) { this.offers = offers; }

    public long getLatencyMs() { return latencyMs; }
    public void setLatencyMs(long latencyMs) { this.latencyMs = latencyMs; }
}
