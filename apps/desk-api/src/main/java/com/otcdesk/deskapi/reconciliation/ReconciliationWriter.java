package com.otcdesk.deskapi.reconciliation;

import com.otcdesk.deskapi.store.ConditionalWrite;
import com.otcdesk.deskapi.store.ConsignmentStore;
import com.otcdesk.deskapi.store.OfferStore;
import com.otcdesk.deskapi.store.OutboxAppendRepository;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.StoredConsignment;
import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.deskapi.store.StoredQuote;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.QuoteStatus;
import com.otcdesk.infra.kafka.contract.EventTypes;
import com.otcdesk.infra.kafka.contract.payload.OfferLifecycleV1;
import com.otcdesk.infra.kafka.contract.payload.RecordReconciledV1;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Applies one correction and its outbox events in a single transaction. */
@Component
public class ReconciliationWriter {
  private final OfferStore offerStore;
  private final ConsignmentStore consignmentStore;
  private final QuoteStore quoteStore;
  private final OutboxAppendRepository outboxAppendRepository;
  private final Clock clock;

  public ReconciliationWriter(
      OfferStore offerStore,
      ConsignmentStore consignmentStore,
      QuoteStore quoteStore,
      OutboxAppendRepository outboxAppendRepository,
      Clock clock) {
    this.offerStore = offerStore;
    this.consignmentStore = consignmentStore;
    this.quoteStore = quoteStore;
    this.outboxAppendRepository = outboxAppendRepository;
    this.clock = clock;
  }

  @Transactional
  public ConditionalWrite applyOfferFlags(StoredOffer stored, OfferFlags merged) {
    Offer offer = stored.offer();
    OfferFlags before = stored.flags();
    ConditionalWrite write =
        offerStore.mergeFlags(offer.chain(), offer.id(), stored.version(), merged);
    if (!write.applied()) {
      return write;
    }
    Instant now = clock.instant();
    outboxAppendRepository.appendRecordReconciled(
        new RecordReconciledV1(
            RecordType.OFFER.name(),
            offer.chain().id(),
            offer.id(),
            before.status().name(),
            merged.status().name(),
            now));
    if (merged.approved() && !before.approved()) {
      appendLifecycle(EventTypes.OFFER_APPROVED, stored, "APPROVED", now);
    }
    if (merged.paid() && !before.paid()) {
      appendLifecycle(EventTypes.OFFER_PAID, stored, "PAID", now);
    }
    if (merged.fulfilled() && !before.fulfilled()) {
      appendLifecycle(EventTypes.OFFER_FULFILLED, stored, "FULFILLED", now);
    }
    if (merged.cancelled() && !before.cancelled()) {
      appendLifecycle(EventTypes.OFFER_CANCELLED, stored, "CANCELLED", now);
    }
    return write;
  }

  @Transactional
  public ConditionalWrite applyConsignmentState(
      StoredConsignment stored, BigInteger remainingAmount, ConsignmentStatus status) {
    Consignment consignment = stored.consignment();
    ConditionalWrite write =
        consignmentStore.updateLedgerState(
            consignment.chain(), consignment.id(), stored.version(), remainingAmount, status);
    if (write.applied()) {
      outboxAppendRepository.appendRecordReconciled(
          new RecordReconciledV1(
              RecordType.CONSIGNMENT.name(),
              consignment.chain().id(),
              consignment.id(),
              consignment.status() + "/" + consignment.remainingAmount(),
              status + "/" + remainingAmount,
              clock.instant()));
    }
    return write;
  }

  @Transactional
  public ConditionalWrite applyQuoteStatus(StoredQuote stored, QuoteStatus status) {
    ConditionalWrite write =
        quoteStore.updateStatus(stored.quote().quoteId(), stored.version(), status);
    if (write.applied()) {
      outboxAppendRepository.appendRecordReconciled(
          new RecordReconciledV1(
              RecordType.QUOTE.name(),
              stored.quote().chain().id(),
              stored.quote().quoteId(),
              stored.quote().status().name(),
              status.name(),
              clock.instant()));
    }
    return write;
  }

  private void appendLifecycle(String eventType, StoredOffer stored, String status, Instant at) {
    Offer offer = stored.offer();
    BigInteger paymentAmount = stored.paymentAmount();
    outboxAppendRepository.appendOfferLifecycle(
        eventType,
        new OfferLifecycleV1(
            offer.chain().id(),
            offer.id(),
            offer.consignmentId(),
            status,
            offer.currency().name(),
            paymentAmount == null ? null : paymentAmount.toString(),
            stored.lastTxHash(),
            stored.quoteId(),
            at));
  }
}
