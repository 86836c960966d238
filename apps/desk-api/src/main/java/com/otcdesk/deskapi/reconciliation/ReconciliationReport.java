package com.otcdesk.deskapi.reconciliation;

import java.time.Instant;
import java.util.List;

public record ReconciliationReport(
    Instant startedAt,
    Instant finishedAt,
    int total,
    int corrected,
    int failed,
    List<ReconciliationOutcome> outcomes) {}
