package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.settlement.SettlementOutcome;

public record SettlementResponse(
    String chain,
    String offerId,
    String status,
    boolean approved,
    boolean paid,
    boolean fulfilled,
    boolean cancelled,
    String currency,
    String paymentAmount,
    String txHash,
    String quoteId,
    String lastRejection,
    boolean pending) {

  public static SettlementResponse from(SettlementOutcome outcome) {
    return new SettlementResponse(
        outcome.chain().id(),
        outcome.offerId(),
        outcome.status().name(),
        outcome.flags().approved(),
        outcome.flags().paid(),
        outcome.flags().fulfilled(),
        outcome.flags().cancelled(),
        outcome.currency() != null ? outcome.currency().name() : null,
        outcome.paymentAmount() != null ? outcome.paymentAmount().toString() : null,
        outcome.lastTxHash(),
        outcome.quoteId(),
        outcome.lastRejection(),
        outcome.pending());
  }
}
