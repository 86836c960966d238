package com.otcdesk.infra.kafka.topics;

import java.util.List;

public final class TopicNames {
  public static final String OFFERS_APPROVED_V1 = "offers.approved.v1";
  public static final String OFFERS_PAID_V1 = "offers.paid.v1";
  public static final String OFFERS_CANCELLED_V1 = "offers.cancelled.v1";
  public static final String OFFERS_FULFILLED_V1 = "offers.fulfilled.v1";
  public static final String SETTLEMENTS_REJECTED_V1 = "settlements.rejected.v1";
  public static final String RECONCILIATION_CORRECTED_V1 = "reconciliation.corrected.v1";

  private TopicNames() {}

  public static List<String> all() {
    return List.of(
        OFFERS_APPROVED_V1,
        OFFERS_PAID_V1,
        OFFERS_CANCELLED_V1,
        OFFERS_FULFILLED_V1,
        SETTLEMENTS_REJECTED_V1,
        RECONCILIATION_CORRECTED_V1);
  }
}
