package com.otcdesk.deskapi.reconciliation;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingReconciliationReporter implements ReconciliationReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingReconciliationReporter.class);

  @Override
  public void report(ReconciliationReport report) {
    if (report.failed() > 0) {
      log.warn(
          "Deal reconciliation finished total={} corrected={} failed={} duration_ms={}",
          report.total(),
          report.corrected(),
          report.failed(),
          Duration.between(report.startedAt(), report.finishedAt()).toMillis());
      return;
    }
    log.info(
        "Deal reconciliation finished total={} corrected={} failed={} duration_ms={}",
        report.total(),
        report.corrected(),
        report.failed(),
        Duration.between(report.startedAt(), report.finishedAt()).toMillis());
  }
}
