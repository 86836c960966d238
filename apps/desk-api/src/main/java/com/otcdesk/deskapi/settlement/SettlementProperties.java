package com.otcdesk.deskapi.settlement;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "desk.settlement")
public class SettlementProperties {
  private long claimLeaseMs = 120_000L;
  private long claimWaitTimeoutMs = 150_000L;
  private long claimPollIntervalMs = 250L;
  private long defaultMaxTimeToExecuteSeconds = 1_800L;
  private long quoteTtlSeconds = 1_800L;
  private BigDecimal defaultThresholdPercent = BigDecimal.TEN;
  private Retry retry = new Retry();

  public long getClaimLeaseMs() {
    return claimLeaseMs;
  }

  public void setClaimLeaseMs(long claimLeaseMs) {
    this.claimLeaseMs = claimLeaseMs;
  }

  public long getClaimWaitTimeoutMs() {
    return claimWaitTimeoutMs;
  }

  public void setClaimWaitTimeoutMs(long claimWaitTimeoutMs) {
    this.claimWaitTimeoutMs = claimWaitTimeoutMs;
  }

  public long getClaimPollIntervalMs() {
    return claimPollIntervalMs;
  }

  public void setClaimPollIntervalMs(long claimPollIntervalMs) {
    this.claimPollIntervalMs = claimPollIntervalMs;
  }

  public long getDefaultMaxTimeToExecuteSeconds() {
    return defaultMaxTimeToExecuteSeconds;
  }

  public void setDefaultMaxTimeToExecuteSeconds(long defaultMaxTimeToExecuteSeconds) {
    this.defaultMaxTimeToExecuteSeconds = defaultMaxTimeToExecuteSeconds;
  }

  public long getQuoteTtlSeconds() {
    return quoteTtlSeconds;
  }

  public void setQuoteTtlSeconds(long quoteTtlSeconds) {
    this.quoteTtlSeconds = quoteTtlSeconds;
  }

  public BigDecimal getDefaultThresholdPercent() {
    return defaultThresholdPercent;
  }

  public void setDefaultThresholdPercent(BigDecimal defaultThresholdPercent) {
    this.defaultThresholdPercent = defaultThresholdPercent;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public static class Retry {
    private int maxAttempts = 4;
    private long baseBackoffMs = 500L;
    private long maxBackoffMs = 8_000L;
    private boolean jitterEnabled = true;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getBaseBackoffMs() {
      return baseBackoffMs;
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
      this.baseBackoffMs = baseBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }
}
