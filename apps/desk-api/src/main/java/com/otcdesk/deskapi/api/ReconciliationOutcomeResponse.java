package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.reconciliation.ReconciliationOutcome;

public record ReconciliationOutcomeResponse(
    String recordType,
    String chain,
    String recordId,
    String localStatus,
    String ledgerStatus,
    boolean corrected) {

  public static ReconciliationOutcomeResponse from(ReconciliationOutcome outcome) {
    return new ReconciliationOutcomeResponse(
        outcome.record().type().name(),
        outcome.record().chain() != null ? outcome.record().chain().id() : null,
        outcome.record().id(),
        outcome.localStatus(),
        outcome.ledgerStatus(),
        outcome.corrected());
  }
}
