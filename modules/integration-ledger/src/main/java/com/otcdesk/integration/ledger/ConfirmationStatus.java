package com.otcdesk.integration.ledger;

public enum ConfirmationStatus {
  CONFIRMED,
  FAILED,
  /** The confirmation deadline passed without a final outcome. */
  PENDING
}
