package com.otcdesk.deskapi.reconciliation;

/** Local and ledger view of one record after a reconciliation attempt. Not persisted. */
public record ReconciliationOutcome(
    RecordRef record, String localStatus, String ledgerStatus, boolean corrected) {

  static ReconciliationOutcome unchanged(RecordRef record, String status) {
    return new ReconciliationOutcome(record, status, status, false);
  }
}
