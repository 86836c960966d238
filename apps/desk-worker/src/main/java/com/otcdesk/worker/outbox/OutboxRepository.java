package com.otcdesk.worker.outbox;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface OutboxRepository {
  /** Claims up to {@code limit} due rows and moves them to PROCESSING. */
  List<OutboxEventRecord> claimDueBatch(int limit);

  void markPublished(UUID id, Instant publishedAt);

  /** Schedules a retry with backoff, or moves the row to DEAD once attempts are used up. */
  void markFailed(UUID id, String errorMessage);

  /** Rows that can never be published, such as an unknown event type. */
  void markDead(UUID id, String errorMessage);
}
