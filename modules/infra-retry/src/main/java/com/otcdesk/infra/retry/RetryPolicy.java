package com.otcdesk.infra.retry;

import java.time.Duration;

/** Bounded exponential retry: attempt count, base delay, delay ceiling and optional jitter. */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, boolean jitter) {
  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must be >= 0");
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }
  }

  public static RetryPolicy of(int maxAttempts, long baseDelayMs, long maxDelayMs, boolean jitter) {
    return new RetryPolicy(
        maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs), jitter);
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, false);
  }

  public JitteredExponentialBackoff backoff() {
    return new JitteredExponentialBackoff(baseDelay.toMillis(), maxDelay.toMillis(), jitter);
  }
}
