package com.otcdesk.domain.deals;

public enum QuoteStatus {
  PENDING,
  EXECUTED,
  EXPIRED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
