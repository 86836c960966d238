package com.otcdesk.domain.deals;

public enum ConsignmentStatus {
  ACTIVE,
  PAUSED,
  WITHDRAWN,
  EXHAUSTED;

  public boolean isTerminal() {
    return this == WITHDRAWN || this == EXHAUSTED;
  }
}
