package com.otcdesk.infra.kafka.contract.payload;

import java.time.Instant;

public record RecordReconciledV1(
    String recordType,
    String chain,
    String recordId,
    String before,
    String after,
    Instant occurredAt) {}
