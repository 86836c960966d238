package com.otcdesk.infra.retry;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Applies a {@link RetryPolicy} to an operation. Only failures the classifier marks transient are
 * retried; everything else propagates on the first attempt. When attempts run out the last failure
 * is rethrown unchanged so callers can translate it.
 */
public class TransientRetryExecutor {
  private static final String RETRY_COUNTER = "desk.retry.attempts";
  private static final String EXHAUSTED_COUNTER = "desk.retry.exhausted";
  private static final Sleeper SYSTEM_SLEEPER = duration -> Thread.sleep(duration.toMillis());

  private final String name;
  private final RetryPolicy policy;
  private final JitteredExponentialBackoff backoff;
  private final Predicate<RuntimeException> transientClassifier;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public TransientRetryExecutor(
      String name,
      RetryPolicy policy,
      Predicate<RuntimeException> transientClassifier,
      MeterRegistry meterRegistry) {
    this(name, policy, policy.backoff(), transientClassifier, SYSTEM_SLEEPER, meterRegistry);
  }

  public TransientRetryExecutor(
      String name,
      RetryPolicy policy,
      JitteredExponentialBackoff backoff,
      Predicate<RuntimeException> transientClassifier,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.policy = Objects.requireNonNull(policy, "policy must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.transientClassifier =
        Objects.requireNonNull(transientClassifier, "transientClassifier must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (RuntimeException ex) {
        boolean retryable = transientClassifier.test(ex);
        if (!retryable || attempt >= policy.maxAttempts()) {
          if (retryable) {
            meterRegistry.counter(EXHAUSTED_COUNTER, "executor", name).increment();
          }
          throw ex;
        }
        meterRegistry.counter(RETRY_COUNTER, "executor", name).increment();
        sleep(backoff.backoffForAttempt(attempt));
        attempt++;
      }
    }
  }

  public RetryPolicy policy() {
    return policy;
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during " + name + " retry backoff", interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
