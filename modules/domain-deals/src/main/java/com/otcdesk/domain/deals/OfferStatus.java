package com.otcdesk.domain.deals;

public enum OfferStatus {
  CREATED,
  APPROVED,
  PAID,
  FULFILLED,
  CANCELLED;

  public boolean isTerminal() {
    return this == FULFILLED || this == CANCELLED;
  }
}
