package com.otcdesk.deskapi.settlement;

import com.otcdesk.deskapi.store.ClaimStage;
import com.otcdesk.deskapi.store.ConditionalWrite;
import com.otcdesk.deskapi.store.ConsignmentStore;
import com.otcdesk.deskapi.store.OfferStore;
import com.otcdesk.deskapi.store.OutboxAppendRepository;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.StoredConsignment;
import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.PaymentCalculator.PaymentAmount;
import com.otcdesk.domain.deals.QuoteStatus;
import com.otcdesk.infra.kafka.contract.EventTypes;
import com.otcdesk.infra.kafka.contract.payload.OfferLifecycleV1;
import com.otcdesk.infra.kafka.contract.payload.SettlementRejectedV1;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes ledger-confirmed settlement steps. Each method is one database transaction covering the
 * offer write, its dependent records and the outbox event.
 */
@Component
public class SettlementRecorder {
  private static final Logger log = LoggerFactory.getLogger(SettlementRecorder.class);

  private final OfferStore offerStore;
  private final ConsignmentStore consignmentStore;
  private final QuoteStore quoteStore;
  private final OutboxAppendRepository outboxAppendRepository;
  private final Clock clock;

  public SettlementRecorder(
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
  public ConditionalWrite recordApproval(
      Offer offer, String quoteId, UUID claimToken, String txHash) {
    ConditionalWrite write =
        offerStore.advanceClaim(
            offer.chain(),
            offer.id(),
            claimToken,
            new OfferFlags(true, false, false, false),
            txHash,
            ClaimStage.PAYING);
    if (write.applied()) {
      appendLifecycle(EventTypes.OFFER_APPROVED, offer, "APPROVED", null, txHash, quoteId);
    }
    return write;
  }

  /**
   * Records a ledger-confirmed payment. Follow-up writes happen only for the write that moves the
   * offer from unpaid to paid; the consignment balance is copied from the ledger read taken after
   * confirmation, since the ledger reserved the offer's tokens when the offer was created.
   */
  @Transactional
  public ConditionalWrite recordPayment(
      StoredOffer stored,
      UUID claimToken,
      String txHash,
      PaymentAmount payment,
      Optional<Consignment> ledgerConsignment) {
    Offer offer = stored.offer();
    boolean firstPaid = offerStore.markPaid(offer.chain(), offer.id(), claimToken).applied();
    ConditionalWrite write =
        offerStore.completeClaim(
            offer.chain(),
            offer.id(),
            claimToken,
            new OfferFlags(true, true, false, false),
            txHash,
            payment.amount());
    if (!write.applied()) {
      return write;
    }
    if (!firstPaid) {
      log.info(
          "Payment already recorded chain={} offer_id={} tx_hash={}",
          offer.chain().id(),
          offer.id(),
          txHash);
      return write;
    }
    ledgerConsignment.ifPresent(consignment -> refreshConsignment(consignment, offer.id()));
    if (stored.hasQuote()) {
      quoteStore.closePending(stored.quoteId(), QuoteStatus.EXECUTED);
    }
    appendLifecycle(
        EventTypes.OFFER_PAID, offer, "PAID", payment.amount(), txHash, stored.quoteId());
    return write;
  }

  @Transactional
  public ConditionalWrite recordCancellation(StoredOffer stored, UUID claimToken, String txHash) {
    Offer offer = stored.offer();
    ConditionalWrite write =
        offerStore.completeClaim(
            offer.chain(),
            offer.id(),
            claimToken,
            new OfferFlags(false, false, false, true),
            txHash,
            null);
    if (!write.applied()) {
      return write;
    }
    if (stored.hasQuote()) {
      quoteStore.closePending(stored.quoteId(), QuoteStatus.EXPIRED);
    }
    appendLifecycle(
        EventTypes.OFFER_CANCELLED, offer, "CANCELLED", null, txHash, stored.quoteId());
    return write;
  }

  @Transactional
  public ConditionalWrite recordRejection(
      Offer offer,
      UUID claimToken,
      String reason,
      String detail,
      BigDecimal candidatePrice,
      BigDecimal aggregatedPrice,
      BigDecimal divergencePercent) {
    Instant now = clock.instant();
    ConditionalWrite write =
        offerStore.recordRejection(offer.chain(), offer.id(), claimToken, reason, detail, now);
    if (write.applied()) {
      outboxAppendRepository.appendSettlementRejected(
          new SettlementRejectedV1(
              offer.chain().id(),
              offer.id(),
              reason,
              detail,
              candidatePrice,
              aggregatedPrice,
              divergencePercent,
              now));
    }
    return write;
  }

  private void refreshConsignment(Consignment ledger, String offerId) {
    Optional<StoredConsignment> local = consignmentStore.find(ledger.chain(), ledger.id());
    if (local.isEmpty()) {
      consignmentStore.insertIfAbsent(ledger);
      return;
    }
    Consignment current = local.get().consignment();
    ConsignmentStatus status = ledger.status();
    if (status == ConsignmentStatus.ACTIVE && current.status() == ConsignmentStatus.PAUSED) {
      status = ConsignmentStatus.PAUSED;
    }
    if (current.remainingAmount().compareTo(ledger.remainingAmount()) == 0
        && current.status() == status) {
      return;
    }
    ConditionalWrite write =
        consignmentStore.updateLedgerState(
            ledger.chain(), ledger.id(), local.get().version(), ledger.remainingAmount(), status);
    if (!write.applied()) {
      log.warn(
          "Consignment refresh skipped after conflict chain={} consignment_id={} offer_id={}",
          ledger.chain().id(),
          ledger.id(),
          offerId);
    }
  }

  private void appendLifecycle(
      String eventType,
      Offer offer,
      String status,
      BigInteger paymentAmount,
      String txHash,
      String quoteId) {
    outboxAppendRepository.appendOfferLifecycle(
        eventType,
        new OfferLifecycleV1(
            offer.chain().id(),
            offer.id(),
            offer.consignmentId(),
            status,
            offer.currency().name(),
            paymentAmount == null ? null : paymentAmount.toString(),
            txHash,
            quoteId,
            clock.instant()));
  }
}
