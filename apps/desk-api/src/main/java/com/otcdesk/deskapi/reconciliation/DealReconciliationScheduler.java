package com.otcdesk.deskapi.reconciliation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "reconciliation.deals",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class DealReconciliationScheduler {
  private final DealReconciliationService dealReconciliationService;

  public DealReconciliationScheduler(DealReconciliationService dealReconciliationService) {
    this.dealReconciliationService = dealReconciliationService;
  }

  @Scheduled(fixedDelayString = "${reconciliation.deals.fixed-delay-ms:300000}")
  public void runScheduled() {
    dealReconciliationService.reconcileAllActive();
  }
}
