package com.otcdesk.deskapi.reconciliation;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;

class DealReconciliationSchedulerTest {

  @Test
  void shouldRunFullPassOnSchedule() {
    DealReconciliationService service = mock(DealReconciliationService.class);

    new DealReconciliationScheduler(service).runScheduled();

    verify(service).reconcileAllActive();
  }
}
