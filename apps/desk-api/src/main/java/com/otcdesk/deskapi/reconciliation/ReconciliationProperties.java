package com.otcdesk.deskapi.reconciliation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "reconciliation.deals")
public class ReconciliationProperties {
  private boolean enabled = false;
  private long fixedDelayMs = 300_000L;
  private int batchSize = 500;
  private int conflictRetries = 3;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public long getFixedDelayMs() {
    return fixedDelayMs;
  }

  public void setFixedDelayMs(long fixedDelayMs) {
    this.fixedDelayMs = fixedDelayMs;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getConflictRetries() {
    return conflictRetries;
  }

  public void setConflictRetries(int conflictRetries) {
    this.conflictRetries = conflictRetries;
  }
}
