package com.otcdesk.deskapi.store;

import com.otcdesk.infra.kafka.contract.payload.OfferLifecycleV1;
import com.otcdesk.infra.kafka.contract.payload.RecordReconciledV1;
import com.otcdesk.infra.kafka.contract.payload.SettlementRejectedV1;

/** Appends deal events inside the caller's transaction; the worker relays them to Kafka. */
public interface OutboxAppendRepository {
  void appendOfferLifecycle(String eventType, OfferLifecycleV1 payload);

  void appendSettlementRejected(SettlementRejectedV1 payload);

  void appendRecordReconciled(RecordReconciledV1 payload);
}
