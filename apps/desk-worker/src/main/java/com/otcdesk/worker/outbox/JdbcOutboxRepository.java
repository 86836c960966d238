package com.otcdesk.worker.outbox;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcOutboxRepository implements OutboxRepository {
  private final JdbcTemplate jdbcTemplate;
  private final int maxAttempts;
  private final long staleLeaseSeconds;

  public JdbcOutboxRepository(JdbcTemplate jdbcTemplate, OutboxPublisherProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.maxAttempts = Math.max(1, properties.getMaxAttempts());
    this.staleLeaseSeconds = Math.max(1L, properties.getStaleLeaseSeconds());
  }

  @Override
  @Transactional
  public List<OutboxEventRecord> claimDueBatch(int limit) {
    // A worker that died mid-publish leaves its rows in PROCESSING.
    String reclaimSql =
        """
        UPDATE outbox_events
        SET status = 'FAILED',
            next_attempt_at = NOW(),
            processing_started_at = NULL,
            last_error = COALESCE(last_error, 'Reclaimed stale publishing lease')
        WHERE status = 'PROCESSING'
          AND processing_started_at < NOW() - INTERVAL '1 second' * ?
        """;
    jdbcTemplate.update(reclaimSql, staleLeaseSeconds);

    String claimSql =
        """
        WITH due AS (
            SELECT id
            FROM outbox_events
            WHERE status IN ('NEW', 'FAILED')
              AND next_attempt_at <= NOW()
            ORDER BY created_at ASC
            FOR UPDATE SKIP LOCKED
            LIMIT ?
        )
        UPDATE outbox_events outbox
        SET status = 'PROCESSING',
            processing_started_at = NOW()
        FROM due
        WHERE outbox.id = due.id
        RETURNING outbox.id,
                  outbox.aggregate_type,
                  outbox.aggregate_id,
                  outbox.event_type,
                  outbox.event_payload,
                  outbox.topic,
                  outbox.event_key,
                  outbox.attempt_count,
                  outbox.created_at
        """;
    return jdbcTemplate.query(claimSql, this::mapRecord, Math.max(1, limit));
  }

  @Override
  public void markPublished(UUID id, Instant publishedAt) {
    String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = ?,
            last_error = NULL,
            processing_started_at = NULL
        WHERE id = ?
        """;
    jdbcTemplate.update(sql, Timestamp.from(publishedAt), id);
  }

  @Override
  public void markFailed(UUID id, String errorMessage) {
    String sql =
        """
        UPDATE outbox_events
        SET status = CASE WHEN attempt_count + 1 >= ? THEN 'DEAD' ELSE 'FAILED' END,
            attempt_count = attempt_count + 1,
            last_error = ?,
            processing_started_at = NULL,
            next_attempt_at = CASE
                WHEN attempt_count + 1 >= ? THEN next_attempt_at
                ELSE NOW() + INTERVAL '5 seconds' * POWER(2, LEAST(attempt_count + 1, 6))
            END
        WHERE id = ?
        """;
    jdbcTemplate.update(sql, maxAttempts, errorMessage, maxAttempts, id);
  }

  @Override
  public void markDead(UUID id, String errorMessage) {
    String sql =
        """
        UPDATE outbox_events
        SET status = 'DEAD',
            attempt_count = attempt_count + 1,
            last_error = ?,
            processing_started_at = NULL
        WHERE id = ?
        """;
    jdbcTemplate.update(sql, errorMessage, id);
  }

  private OutboxEventRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        rs.getObject("id", UUID.class),
        rs.getString("aggregate_type"),
        rs.getString("aggregate_id"),
        rs.getString("event_type"),
        rs.getString("event_payload"),
        rs.getString("topic"),
        rs.getString("event_key"),
        rs.getInt("attempt_count"),
        rs.getTimestamp("created_at").toInstant());
  }
}
