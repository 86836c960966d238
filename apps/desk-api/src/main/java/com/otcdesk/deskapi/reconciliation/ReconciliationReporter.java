package com.otcdesk.deskapi.reconciliation;

public interface ReconciliationReporter {
  void report(ReconciliationReport report);
}
