package com.otcdesk.deskapi.reconciliation;

import com.otcdesk.deskapi.store.ConditionalWrite;
import com.otcdesk.deskapi.store.ConsignmentStore;
import com.otcdesk.deskapi.store.OfferStore;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.StoredConsignment;
import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.deskapi.store.StoredQuote;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.DealNotFoundException;
import com.otcdesk.domain.deals.InfrastructureException;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.Quote;
import com.otcdesk.domain.deals.QuoteStatus;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.LedgerAdapter;
import com.otcdesk.integration.ledger.LedgerAdapterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-derives cached deal records from ledger truth. Offer flags are merged monotonically, so a
 * stale or lagging ledger read can never clear a flag; consignment balances are overwritten; quotes
 * are closed once their offer settles or their validity lapses.
 */
public class DealReconciliationService {
  private static final Logger log = LoggerFactory.getLogger(DealReconciliationService.class);

  private static final String RECORDS_COUNTER = "desk.reconciliation.records";
  private static final String NOT_FOUND = "NOT_FOUND";
  private static final String ABSENT = "ABSENT";

  private final LedgerAdapterRegistry ledgers;
  private final OfferStore offerStore;
  private final ConsignmentStore consignmentStore;
  private final QuoteStore quoteStore;
  private final ReconciliationWriter writer;
  private final ReconciliationReporter reporter;
  private final TransientRetryExecutor ledgerReads;
  private final ReconciliationProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public DealReconciliationService(
      LedgerAdapterRegistry ledgers,
      OfferStore offerStore,
      ConsignmentStore consignmentStore,
      QuoteStore quoteStore,
      ReconciliationWriter writer,
      ReconciliationReporter reporter,
      TransientRetryExecutor ledgerReads,
      ReconciliationProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.ledgers = ledgers;
    this.offerStore = offerStore;
    this.consignmentStore = consignmentStore;
    this.quoteStore = quoteStore;
    this.writer = writer;
    this.reporter = reporter;
    this.ledgerReads = ledgerReads;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  public ReconciliationOutcome reconcileOne(RecordRef ref) {
    ReconciliationOutcome outcome;
    if (ref.type() == RecordType.OFFER) {
      outcome = reconcileOffer(ref);
    } else if (ref.type() == RecordType.CONSIGNMENT) {
      outcome = reconcileConsignment(ref);
    } else {
      outcome = reconcileQuote(ref);
    }
    countRecord(ref, outcome.corrected() ? "corrected" : "unchanged");
    return outcome;
  }

  /** Reconciles every non-terminal offer, open consignment and pending quote. */
  public ReconciliationReport reconcileAllActive() {
    Instant startedAt = clock.instant();
    int batchSize = properties.getBatchSize();
    List<RecordRef> refs = new ArrayList<>();
    for (StoredOffer offer : offerStore.findActive(batchSize)) {
      refs.add(RecordRef.offer(offer.offer().chain(), offer.offer().id()));
    }
    for (StoredConsignment consignment : consignmentStore.findActive(batchSize)) {
      refs.add(
          RecordRef.consignment(consignment.consignment().chain(), consignment.consignment().id()));
    }
    for (StoredQuote quote : quoteStore.findPending(batchSize)) {
      refs.add(RecordRef.quote(quote.quote().quoteId()));
    }

    List<ReconciliationOutcome> outcomes = new ArrayList<>();
    int corrected = 0;
    int failed = 0;
    for (RecordRef ref : refs) {
      try {
        ReconciliationOutcome outcome = reconcileOne(ref);
        outcomes.add(outcome);
        if (outcome.corrected()) {
          corrected++;
        }
      } catch (RuntimeException ex) {
        failed++;
        countRecord(ref, "failed");
        log.warn("Record reconciliation failed record={} error={}", ref, ex.getMessage());
      }
    }
    ReconciliationReport report =
        new ReconciliationReport(
            startedAt, clock.instant(), refs.size(), corrected, failed, List.copyOf(outcomes));
    reporter.report(report);
    return report;
  }

  private ReconciliationOutcome reconcileOffer(RecordRef ref) {
    LedgerAdapter adapter = ledgers.forChain(ref.chain());
    adapter.validateRecordId(ref.id());
    for (int attempt = 1; attempt <= properties.getConflictRetries(); attempt++) {
      Optional<StoredOffer> local = offerStore.find(ref.chain(), ref.id());
      Optional<Offer> ledger = readLedger(() -> adapter.readOffer(ref.chain(), ref.id()));
      if (ledger.isEmpty()) {
        if (local.isEmpty()) {
          throw new DealNotFoundException("Offer", ref.chain().id() + ":" + ref.id());
        }
        log.warn("Offer missing on ledger chain={} offer_id={}", ref.chain().id(), ref.id());
        return new ReconciliationOutcome(
            ref, local.get().offer().status().name(), NOT_FOUND, false);
      }
      Offer ledgerOffer = ledger.get();
      if (local.isEmpty()) {
        StoredOffer imported = offerStore.insertIfAbsent(ledgerOffer, null);
        log.info(
            "Offer imported from ledger chain={} offer_id={} status={}",
            ref.chain().id(),
            ref.id(),
            imported.offer().status());
        return new ReconciliationOutcome(ref, ABSENT, ledgerOffer.status().name(), true);
      }

      StoredOffer stored = local.get();
      OfferFlags localFlags = stored.flags();
      OfferFlags ledgerFlags = ledgerOffer.flags();
      if (!localFlags.isCoveredBy(ledgerFlags)) {
        log.warn(
            "Ledger regression ignored chain={} offer_id={} local={} ledger={}",
            ref.chain().id(),
            ref.id(),
            localFlags.status(),
            ledgerFlags.status());
      }
      if (ledgerFlags.isCoveredBy(localFlags)) {
        return new ReconciliationOutcome(
            ref, localFlags.status().name(), ledgerFlags.status().name(), false);
      }

      OfferFlags merged = localFlags.union(ledgerFlags);
      ConditionalWrite write = writer.applyOfferFlags(stored, merged);
      if (!write.applied()) {
        log.debug(
            "Offer reconciliation conflict chain={} offer_id={} attempt={}",
            ref.chain().id(),
            ref.id(),
            attempt);
        continue;
      }
      log.info(
          "Offer reconciled chain={} offer_id={} before={} after={}",
          ref.chain().id(),
          ref.id(),
          localFlags.status(),
          merged.status());
      reconcileDependents(stored, localFlags, merged);
      return new ReconciliationOutcome(
          ref, localFlags.status().name(), ledgerFlags.status().name(), true);
    }
    return conflictsExhausted(ref);
  }

  private void reconcileDependents(StoredOffer stored, OfferFlags before, OfferFlags after) {
    Offer offer = stored.offer();
    if (after.paid() && !before.paid() && offer.hasConsignment()) {
      reconcileQuietly(RecordRef.consignment(offer.chain(), offer.consignmentId()));
    }
    if (stored.hasQuote() && (after.paid() || after.cancelled())) {
      reconcileQuietly(RecordRef.quote(stored.quoteId()));
    }
  }

  private void reconcileQuietly(RecordRef ref) {
    try {
      reconcileOne(ref);
    } catch (RuntimeException ex) {
      log.warn("Dependent reconciliation failed record={} error={}", ref, ex.getMessage());
    }
  }

  private ReconciliationOutcome reconcileConsignment(RecordRef ref) {
    LedgerAdapter adapter = ledgers.forChain(ref.chain());
    adapter.validateRecordId(ref.id());
    for (int attempt = 1; attempt <= properties.getConflictRetries(); attempt++) {
      Optional<StoredConsignment> local = consignmentStore.find(ref.chain(), ref.id());
      Optional<Consignment> ledger =
          readLedger(() -> adapter.readConsignment(ref.chain(), ref.id()));
      if (ledger.isEmpty()) {
        if (local.isEmpty()) {
          throw new DealNotFoundException("Consignment", ref.chain().id() + ":" + ref.id());
        }
        log.warn(
            "Consignment missing on ledger chain={} consignment_id={}", ref.chain().id(), ref.id());
        return new ReconciliationOutcome(
            ref, local.get().consignment().status().name(), NOT_FOUND, false);
      }
      Consignment ledgerConsignment = ledger.get();
      if (local.isEmpty()) {
        consignmentStore.insertIfAbsent(ledgerConsignment);
        log.info(
            "Consignment imported from ledger chain={} consignment_id={} status={}",
            ref.chain().id(),
            ref.id(),
            ledgerConsignment.status());
        return new ReconciliationOutcome(ref, ABSENT, ledgerConsignment.status().name(), true);
      }

      StoredConsignment stored = local.get();
      Consignment current = stored.consignment();
      ConsignmentStatus targetStatus = ledgerConsignment.status();
      if (targetStatus == ConsignmentStatus.ACTIVE
          && current.status() == ConsignmentStatus.PAUSED) {
        targetStatus = ConsignmentStatus.PAUSED;
      }
      boolean sameRemaining =
          current.remainingAmount().compareTo(ledgerConsignment.remainingAmount()) == 0;
      if (sameRemaining && current.status() == targetStatus) {
        return ReconciliationOutcome.unchanged(ref, current.status().name());
      }
      ConditionalWrite write =
          writer.applyConsignmentState(stored, ledgerConsignment.remainingAmount(), targetStatus);
      if (!write.applied()) {
        continue;
      }
      log.info(
          "Consignment reconciled chain={} consignment_id={} before={} after={}"
              + " remaining_before={} remaining_after={}",
          ref.chain().id(),
          ref.id(),
          current.status(),
          targetStatus,
          current.remainingAmount(),
          ledgerConsignment.remainingAmount());
      return new ReconciliationOutcome(
          ref, current.status().name(), ledgerConsignment.status().name(), true);
    }
    return conflictsExhausted(ref);
  }

  private ReconciliationOutcome reconcileQuote(RecordRef ref) {
    for (int attempt = 1; attempt <= properties.getConflictRetries(); attempt++) {
      StoredQuote stored =
          quoteStore.find(ref.id()).orElseThrow(() -> new DealNotFoundException("Quote", ref.id()));
      Quote quote = stored.quote();
      if (quote.status() != QuoteStatus.PENDING) {
        return ReconciliationOutcome.unchanged(ref, quote.status().name());
      }
      QuoteStatus target = targetQuoteStatus(quote);
      if (target == QuoteStatus.PENDING) {
        return ReconciliationOutcome.unchanged(ref, quote.status().name());
      }
      if (!writer.applyQuoteStatus(stored, target).applied()) {
        continue;
      }
      log.info(
          "Quote reconciled quote_id={} offer_id={} before={} after={}",
          quote.quoteId(),
          quote.offerId(),
          quote.status(),
          target);
      return new ReconciliationOutcome(ref, quote.status().name(), target.name(), true);
    }
    return conflictsExhausted(ref);
  }

  private QuoteStatus targetQuoteStatus(Quote quote) {
    if (!quote.isLinked()) {
      return quote.isExpiredAt(clock.instant()) ? QuoteStatus.EXPIRED : QuoteStatus.PENDING;
    }
    LedgerAdapter adapter = ledgers.forChain(quote.chain());
    Optional<OfferFlags> flags =
        readLedger(() -> adapter.readOffer(quote.chain(), quote.offerId())).map(Offer::flags);
    if (flags.isEmpty()) {
      flags = offerStore.find(quote.chain(), quote.offerId()).map(StoredOffer::flags);
    }
    if (flags.isEmpty()) {
      return QuoteStatus.PENDING;
    }
    if (flags.get().paid() || flags.get().fulfilled()) {
      return QuoteStatus.EXECUTED;
    }
    if (flags.get().cancelled()) {
      return QuoteStatus.EXPIRED;
    }
    return QuoteStatus.PENDING;
  }

  private ReconciliationOutcome conflictsExhausted(RecordRef ref) {
    log.warn(
        "Reconciliation gave up after conflicts record={} attempts={}",
        ref,
        properties.getConflictRetries());
    return new ReconciliationOutcome(ref, "CONFLICT", "CONFLICT", false);
  }

  private void countRecord(RecordRef ref, String result) {
    meterRegistry
        .counter(
            RECORDS_COUNTER, "type", ref.type().name().toLowerCase(Locale.ROOT), "result", result)
        .increment();
  }

  private <T> T readLedger(TransientRetryExecutor.Operation<T> read) {
    try {
      return ledgerReads.execute(read);
    } catch (ChainException ex) {
      if (ex.isTransient()) {
        throw new InfrastructureException("Ledger unavailable: " + ex.reason(), ex);
      }
      throw ex;
    }
  }
}
