package com.otcdesk.integration.ledger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/** Polls a receipt lookup until it yields a final status or the deadline passes. */
public class ConfirmationPoller {
  private final Duration pollInterval;
  private final Duration timeout;
  private final Clock clock;
  private final Sleeper sleeper;

  public ConfirmationPoller(Duration pollInterval, Duration timeout, Clock clock) {
    this(pollInterval, timeout, clock, duration -> Thread.sleep(duration.toMillis()));
  }

  public ConfirmationPoller(Duration pollInterval, Duration timeout, Clock clock, Sleeper sleeper) {
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public static ConfirmationPoller from(LedgerProperties properties, Clock clock) {
    return new ConfirmationPoller(
        Duration.ofMillis(Math.max(1L, properties.getConfirmation().getPollIntervalMs())),
        Duration.ofMillis(Math.max(0L, properties.getConfirmation().getTimeoutMs())),
        clock);
  }

  public ConfirmationStatus await(Supplier<Optional<ConfirmationStatus>> lookup) {
    Instant deadline = clock.instant().plus(timeout);
    while (true) {
      Optional<ConfirmationStatus> status = lookup.get();
      if (status.isPresent() && status.get() != ConfirmationStatus.PENDING) {
        return status.get();
      }
      if (!clock.instant().isBefore(deadline)) {
        return ConfirmationStatus.PENDING;
      }
      try {
        sleeper.sleep(pollInterval);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        return ConfirmationStatus.PENDING;
      }
    }
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
