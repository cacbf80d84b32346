package com.example.concierge.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "assistant.search")
public class AssistantSearchProperties {
    private int maxOffersRequested = 7; // per source, per date
    private int displayCount = 3;
    private long sourceTimeoutMs = 7000;
    private boolean offloadReconciliation = true;
    private int weekSearchDays = 7;
    private int sourcePoolSize = 8;
    private int reconcilePoolSize = 2;
    private int turnPoolSize = 4;

    public int getMaxOffersRequested() { return maxOffersRequested; }
    public void setMaxOffersRequested(int maxOffersRequested) { this.maxOffersRequested = maxOffersRequested; }

    public int getDisplayCount() { return displayCount; }
    public void setDisplayCount(int displayCount) { this.displayCount = displayCount; }

    public long getSourceTimeoutMs() { return sourceTimeoutMs; }
    public void setSourceTimeoutMs(long sourceTimeoutMs) { this.sourceTimeoutMs = sourceTimeoutMs; }

    public boolean isOffloadReconciliation() { return offloadReconciliation; }
    public void setOffloadReconciliation(boolean offloadReconciliation) { this.offloadReconciliation = offloadReconciliation; }

    public int getWeekSearchDays() { return weekSearchDays; }
    public void setWeekSearchDays(int weekSearchDays) { this.weekSearchDays = weekSearchDays; }

    public int getSourcePoolSize() { return sourcePoolSize; }
    public void setSourcePoolSize(int sourcePoolSize) { this.sourcePoolSize = sourcePoolSize; }

    public int getReconcilePoolSize() { return reconcilePoolSize; }
    public void setReconcilePoolSize(int reconcilePoolSize) { this.reconcilePoolSize = reconcilePoolSize; }

    public int getTurnPoolSize() { return turnPoolSize; }
    public void setTurnPoolSize(int turnPoolSize) { this.turnPoolSize = turnPoolSize; }
}
