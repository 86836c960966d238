package com.otcdesk.infra.kafka.contract;

import com.otcdesk.infra.kafka.topics.TopicNames;
import java.util.Map;

public final class EventTypes {
  public static final String OFFER_APPROVED = "OfferApproved";
  public static final String OFFER_PAID = "OfferPaid";
  public static final String OFFER_CANCELLED = "OfferCancelled";
  public static final String OFFER_FULFILLED = "OfferFulfilled";
  public static final String SETTLEMENT_REJECTED = "SettlementRejected";
  public static final String RECORD_RECONCILED = "RecordReconciled";

  private static final Map<String, String> TOPICS =
      Map.of(
          OFFER_APPROVED, TopicNames.OFFERS_APPROVED_V1,
          OFFER_PAID, TopicNames.OFFERS_PAID_V1,
          OFFER_CANCELLED, TopicNames.OFFERS_CANCELLED_V1,
          OFFER_FULFILLED, TopicNames.OFFERS_FULFILLED_V1,
          SETTLEMENT_REJECTED, TopicNames.SETTLEMENTS_REJECTED_V1,
          RECORD_RECONCILED, TopicNames.RECONCILIATION_CORRECTED_V1);

  private EventTypes() {}

  public static String topicFor(String eventType) {
    String topic = TOPICS.get(eventType);
    if (topic == null) {
      throw new IllegalArgumentException("Unknown event type: " + eventType);
    }
    return topic;
  }
}
