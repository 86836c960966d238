package com.otcdesk.infra.kafka.contract.payload;

import java.time.Instant;

/** Offer approved, paid, cancelled or fulfilled. Amounts are in the payment asset's base unit. */
public record OfferLifecycleV1(
    String chain,
    String offerId,
    String consignmentId,
    String status,
    String paymentCurrency,
    String paymentAmount,
    String txHash,
    String quoteId,
    Instant occurredAt) {}
