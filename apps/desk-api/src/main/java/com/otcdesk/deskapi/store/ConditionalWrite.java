package com.otcdesk.deskapi.store;

/**
 * Result of a check-and-set write. {@code CONFLICT} means the expected prior state no longer
 * matched; the caller re-reads and decides whether its goal was already reached.
 */
public enum ConditionalWrite {
  APPLIED,
  CONFLICT;

  public static ConditionalWrite fromRowCount(int updated) {
    return updated > 0 ? APPLIED : CONFLICT;
  }

  public boolean applied() {
    return this == APPLIED;
  }
}
