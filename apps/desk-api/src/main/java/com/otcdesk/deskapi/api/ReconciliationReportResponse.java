package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.reconciliation.ReconciliationReport;
import java.time.Instant;
import java.util.List;

public record ReconciliationReportResponse(
    Instant startedAt,
    Instant finishedAt,
    int total,
    int corrected,
    int failed,
    List<ReconciliationOutcomeResponse> outcomes) {

  public static ReconciliationReportResponse from(ReconciliationReport report) {
    return new ReconciliationReportResponse(
        report.startedAt(),
        report.finishedAt(),
        report.total(),
        report.corrected(),
        report.failed(),
        report.outcomes().stream().map(ReconciliationOutcomeResponse::from).toList());
  }
}
