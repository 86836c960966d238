package com.otcdesk.worker.outbox;

import java.time.Instant;
import java.util.UUID;

/** A claimed outbox row. {@code aggregateType} is OFFER, CONSIGNMENT or QUOTE. */
public record OutboxEventRecord(
    UUID id,
    String aggregateType,
    String aggregateId,
    String eventType,
    String eventPayload,
    String topic,
    String eventKey,
    int attemptCount,
    Instant createdAt) {}
