package com.otcdesk.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record SettlementRejectedV1(
    String chain,
    String offerId,
    String reason,
    String detail,
    BigDecimal candidatePrice,
    BigDecimal aggregatedPrice,
    BigDecimal divergencePercent,
    Instant occurredAt) {}
