package com.otcdesk.deskapi.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.infra.kafka.contract.EventTypes;
import com.otcdesk.infra.kafka.contract.payload.OfferLifecycleV1;
import com.otcdesk.infra.kafka.contract.payload.RecordReconciledV1;
import com.otcdesk.infra.kafka.contract.payload.SettlementRejectedV1;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOutboxAppendRepository implements OutboxAppendRepository {
  private static final String OFFER_AGGREGATE_TYPE = "OFFER";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcOutboxAppendRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public void appendOfferLifecycle(String eventType, OfferLifecycleV1 payload) {
    append(
        OFFER_AGGREGATE_TYPE,
        payload.chain() + ":" + payload.offerId(),
        eventType,
        payload);
  }

  @Override
  public void appendSettlementRejected(SettlementRejectedV1 payload) {
    append(
        OFFER_AGGREGATE_TYPE,
        payload.chain() + ":" + payload.offerId(),
        EventTypes.SETTLEMENT_REJECTED,
        payload);
  }

  @Override
  public void appendRecordReconciled(RecordReconciledV1 payload) {
    append(
        payload.recordType(),
        payload.chain() + ":" + payload.recordId(),
        EventTypes.RECORD_RECONCILED,
        payload);
  }

  private void append(String aggregateType, String aggregateId, String eventType, Object payload) {
    String payloadJson = toJson(payload);
    String sql =
        """
        INSERT INTO outbox_events (
            id,
            aggregate_type,
            aggregate_id,
            event_type,
            event_payload,
            topic,
            event_key,
            status,
            attempt_count,
            created_at
        ) VALUES (?, ?, ?, ?, CAST(? AS JSONB), ?, ?, 'NEW', 0, NOW())
        """;
    jdbcTemplate.update(
        sql,
        UUID.randomUUID(),
        aggregateType,
        aggregateId,
        eventType,
        payloadJson,
        EventTypes.topicFor(eventType),
        aggregateId);
  }

  private String toJson(Object payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize outbox payload", ex);
    }
  }
}
