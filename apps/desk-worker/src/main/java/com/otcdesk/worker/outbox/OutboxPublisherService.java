package com.otcdesk.worker.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.infra.kafka.contract.EventEnvelope;
import com.otcdesk.infra.kafka.contract.EventTypes;
import com.otcdesk.infra.kafka.producer.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Relays deal lifecycle events written by the desk API's outbox onto Kafka. Each row is published
 * with its outbox id as the event id, so consumers can drop the duplicates a retried row produces.
 */
@Service
@ConditionalOnProperty(
    prefix = "outbox.publisher",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class OutboxPublisherService {
  private static final Logger log = LoggerFactory.getLogger(OutboxPublisherService.class);

  private final OutboxRepository outboxRepository;
  private final EventPublisher eventPublisher;
  private final OutboxPublisherProperties properties;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public OutboxPublisherService(
      OutboxRepository outboxRepository,
      EventPublisher eventPublisher,
      OutboxPublisherProperties properties,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this(
        outboxRepository,
        eventPublisher,
        properties,
        objectMapper,
        meterRegistry,
        Clock.systemUTC());
  }

  OutboxPublisherService(
      OutboxRepository outboxRepository,
      EventPublisher eventPublisher,
      OutboxPublisherProperties properties,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.outboxRepository = outboxRepository;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${outbox.publisher.fixed-delay-ms:1000}")
  public void publishPendingEvents() {
    List<OutboxEventRecord> due = outboxRepository.claimDueBatch(properties.getBatchSize());
    for (OutboxEventRecord record : due) {
      publishSingle(record);
    }
  }

  private void publishSingle(OutboxEventRecord record) {
    EventEnvelope<JsonNode> envelope;
    try {
      envelope = envelopeFor(record);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      String error = errorMessage(ex);
      outboxRepository.markDead(record.id(), error);
      count(record, "dead");
      log.error(
          "Outbox row unpublishable outbox_id={} event_type={} error={}",
          record.id(),
          record.eventType(),
          error);
      return;
    }

    try {
      eventPublisher.publish(record.topic(), envelope.key(), envelope).join();
      outboxRepository.markPublished(record.id(), clock.instant());
      count(record, "published");
      log.info(
          "Outbox publish success outbox_id={} topic={} event_type={} aggregate={}:{}"
              + " attempt_count={}",
          record.id(),
          record.topic(),
          record.eventType(),
          record.aggregateType(),
          record.aggregateId(),
          record.attemptCount());
    } catch (RuntimeException ex) {
      String error = errorMessage(unwrap(ex));
      outboxRepository.markFailed(record.id(), error);
      count(record, "failed");
      log.warn(
          "Outbox publish failed outbox_id={} topic={} event_type={} attempt_count={} error={}",
          record.id(),
          record.topic(),
          record.eventType(),
          record.attemptCount() + 1,
          error);
    }
  }

  private EventEnvelope<JsonNode> envelopeFor(OutboxEventRecord record)
      throws JsonProcessingException {
    String expectedTopic = EventTypes.topicFor(record.eventType());
    if (!expectedTopic.equals(record.topic())) {
      throw new IllegalArgumentException(
          "Topic " + record.topic() + " does not carry " + record.eventType());
    }
    JsonNode payload =
        record.eventPayload() == null || record.eventPayload().isBlank()
            ? objectMapper.createObjectNode()
            : objectMapper.readTree(record.eventPayload());
    String key = messageKeyFor(record);
    return EventEnvelope.fromOutbox(
        record.id(),
        record.eventType(),
        record.createdAt(),
        properties.getProducerName(),
        record.aggregateType() + ":" + record.aggregateId(),
        key,
        payload);
  }

  private void count(OutboxEventRecord record, String result) {
    Counter.builder("desk.outbox.relayed")
        .tag("event_type", record.eventType())
        .tag("result", result)
        .register(meterRegistry)
        .increment();
  }

  private static String messageKeyFor(OutboxEventRecord record) {
    if (record.eventKey() != null && !record.eventKey().isBlank()) {
      return record.eventKey();
    }
    return record.aggregateId();
  }

  private static Throwable unwrap(RuntimeException ex) {
    if (ex instanceof CompletionException && ex.getCause() != null) {
      return ex.getCause();
    }
    return ex;
  }

  private static String errorMessage(Throwable ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getSimpleName();
    }
    return message;
  }
}
