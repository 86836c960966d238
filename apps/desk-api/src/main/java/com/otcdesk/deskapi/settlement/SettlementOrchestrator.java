package com.otcdesk.deskapi.settlement;

import com.otcdesk.deskapi.store.ClaimStage;
import com.otcdesk.deskapi.store.ConsignmentStore;
import com.otcdesk.deskapi.store.OfferStore;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.SettlementClaim;
import com.otcdesk.deskapi.store.StoredConsignment;
import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.deskapi.store.StoredQuote;
import com.otcdesk.deskapi.store.TokenRepository;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.DealNotFoundException;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.InfrastructureException;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.OfferStateMachine;
import com.otcdesk.domain.deals.PaymentCalculator;
import com.otcdesk.domain.deals.PaymentCalculator.PaymentAmount;
import com.otcdesk.domain.deals.PriceDivergenceException;
import com.otcdesk.domain.deals.QuoteStatus;
import com.otcdesk.domain.deals.SettlementWindowExpiredException;
import com.otcdesk.domain.deals.Token;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.ConfirmationStatus;
import com.otcdesk.integration.ledger.LedgerAdapter;
import com.otcdesk.integration.ledger.LedgerAdapterRegistry;
import com.otcdesk.integration.ledger.TxRef;
import com.otcdesk.integration.pricing.PriceCheckResult;
import com.otcdesk.integration.pricing.PriceProtectionService;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives an offer from created through approved and paid with the custodial signer, and cancels
 * offers on request. Local state only ever records what the ledger has confirmed.
 *
 * <p>Mutual exclusion between processes comes from a lease on the stored offer, taken and released
 * with conditional writes. A caller that loses the lease waits for the holder to finish and then
 * reports the stored outcome instead of submitting anything itself.
 */
public class SettlementOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SettlementOrchestrator.class);

  static final String REJECTION_PRICE_DIVERGENCE = "PRICE_DIVERGENCE";
  private static final String OUTCOMES_COUNTER = "desk.settlement.outcomes";
  private static final BigDecimal BPS_PER_PERCENT = BigDecimal.valueOf(100);

  private final LedgerAdapterRegistry ledgers;
  private final OfferStore offerStore;
  private final ConsignmentStore consignmentStore;
  private final QuoteStore quoteStore;
  private final TokenRepository tokenRepository;
  private final PriceProtectionService priceProtection;
  private final SettlementRecorder recorder;
  private final SubmissionSequencer sequencer;
  private final TransientRetryExecutor ledgerReads;
  private final TransientRetryExecutor submissions;
  private final SettlementProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public SettlementOrchestrator(
      LedgerAdapterRegistry ledgers,
      OfferStore offerStore,
      ConsignmentStore consignmentStore,
      QuoteStore quoteStore,
      TokenRepository tokenRepository,
      PriceProtectionService priceProtection,
      SettlementRecorder recorder,
      SubmissionSequencer sequencer,
      TransientRetryExecutor ledgerReads,
      TransientRetryExecutor submissions,
      SettlementProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.ledgers = ledgers;
    this.offerStore = offerStore;
    this.consignmentStore = consignmentStore;
    this.quoteStore = quoteStore;
    this.tokenRepository = tokenRepository;
    this.priceProtection = priceProtection;
    this.recorder = recorder;
    this.sequencer = sequencer;
    this.ledgerReads = ledgerReads;
    this.submissions = submissions;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** Approves the offer if needed, then pays it. Safe to call repeatedly and concurrently. */
  public SettlementOutcome approveAndSettle(Chain chain, String offerId, String quoteId) {
    LedgerAdapter adapter = ledgers.forChain(chain);
    adapter.validateRecordId(offerId);
    Offer ledgerOffer = readLedgerOffer(adapter, chain, offerId);
    StoredOffer stored = syncFromLedger(ledgerOffer, quoteId);
    if (isSettled(stored)) {
      record("already_settled");
      return SettlementOutcome.from(stored, false);
    }
    return underClaim(
        chain,
        offerId,
        ClaimStage.APPROVING,
        SettlementOrchestrator::isSettled,
        claim -> settle(adapter, chain, offerId, claim));
  }

  /** Cancels an offer that has not been fulfilled. */
  public SettlementOutcome cancel(Chain chain, String offerId) {
    LedgerAdapter adapter = ledgers.forChain(chain);
    adapter.validateRecordId(offerId);
    Offer ledgerOffer = readLedgerOffer(adapter, chain, offerId);
    StoredOffer stored = syncFromLedger(ledgerOffer, null);
    if (stored.flags().cancelled()) {
      return SettlementOutcome.from(stored, false);
    }
    requireCancellable(stored.offer());
    return underClaim(
        chain,
        offerId,
        ClaimStage.CANCELLING,
        current -> current.flags().isTerminal(),
        claim -> cancelUnderClaim(adapter, chain, offerId, claim));
  }

  private SettlementOutcome settle(
      LedgerAdapter adapter, Chain chain, String offerId, SettlementClaim claim) {
    Offer offer = readLedgerOffer(adapter, chain, offerId);
    StoredOffer stored = requireStored(chain, offerId);
    if (offer.flags().paid() || offer.flags().isTerminal()) {
      // Another path already reached the ledger; mirror it and stop.
      offerStore.completeClaim(chain, offerId, claim.token(), offer.flags(), null, null);
      record("already_settled");
      return SettlementOutcome.from(requireStored(chain, offerId), false);
    }

    Optional<Consignment> consignment = loadConsignment(adapter, offer);
    requireWithinWindow(offer, consignment, stored.quoteId());

    if (!offer.flags().approved()) {
      Optional<TxRef> approval =
          submitOnce(
              adapter,
              chain,
              offerId,
              OfferFlags::approved,
              () -> adapter.approveOffer(chain, offerId));
      String approvalHash = approval.map(TxRef::hash).orElse(null);
      if (approval.isPresent()) {
        offerStore.recordPendingTx(
            chain, offerId, claim.token(), ClaimStage.APPROVING, approvalHash);
        ConfirmationStatus status = adapter.waitForConfirmation(chain, approval.get());
        if (status == ConfirmationStatus.FAILED) {
          record("reverted");
          throw ChainException.reverted(chain, "approval transaction " + approvalHash + " failed");
        }
        if (status == ConfirmationStatus.PENDING) {
          return pendingOutcome(chain, offerId, "approval", approvalHash);
        }
      }
      recorder.recordApproval(offer, stored.quoteId(), claim.token(), approvalHash);
      log.info(
          "Offer approved chain={} offer_id={} tx_hash={}", chain.id(), offerId, approvalHash);
      offer = offer.withFlags(offer.flags().withApproved());
      requireWithinWindow(offer, consignment, stored.quoteId());
    }

    Offer priced = pricedOffer(offer, stored.quoteId());
    String tokenId = priced.tokenId();
    Token token =
        tokenRepository
            .find(chain, tokenId)
            .orElseThrow(() -> new DealNotFoundException("Token", chain.id() + ":" + tokenId));
    checkPrice(priced, token, consignment, claim);

    PaymentAmount payment =
        PaymentCalculator.requiredPayment(
            priced, token.decimals(), adapter.paymentDecimals(chain, priced.currency()));
    Optional<TxRef> paymentTx =
        submitOnce(
            adapter,
            chain,
            offerId,
            OfferFlags::paid,
            () -> requireWithinWindow(priced, consignment, stored.quoteId()),
            () -> adapter.payOffer(chain, offerId, payment.amount(), payment.currency()));
    String paymentHash = paymentTx.map(TxRef::hash).orElse(null);
    if (paymentTx.isPresent()) {
      offerStore.recordPendingTx(chain, offerId, claim.token(), ClaimStage.PAYING, paymentHash);
      ConfirmationStatus status = adapter.waitForConfirmation(chain, paymentTx.get());
      if (status == ConfirmationStatus.FAILED) {
        record("reverted");
        throw ChainException.reverted(chain, "payment transaction " + paymentHash + " failed");
      }
      if (status == ConfirmationStatus.PENDING) {
        return pendingOutcome(chain, offerId, "payment", paymentHash);
      }
    }
    Optional<Consignment> settledConsignment =
        priced.hasConsignment()
            ? readLedger(() -> adapter.readConsignment(chain, priced.consignmentId()))
            : Optional.empty();
    recorder.recordPayment(
        requireStored(chain, offerId), claim.token(), paymentHash, payment, settledConsignment);
    log.info(
        "Offer paid chain={} offer_id={} currency={} amount={} tx_hash={}",
        chain.id(),
        offerId,
        payment.currency(),
        payment.amount(),
        paymentHash);
    record("paid");
    return SettlementOutcome.from(requireStored(chain, offerId), false);
  }

  private SettlementOutcome cancelUnderClaim(
      LedgerAdapter adapter, Chain chain, String offerId, SettlementClaim claim) {
    Offer offer = readLedgerOffer(adapter, chain, offerId);
    if (!offer.flags().cancelled()) {
      requireCancellable(offer);
    }
    Optional<TxRef> cancellation = Optional.empty();
    if (!offer.flags().cancelled()) {
      cancellation =
          submitOnce(
              adapter,
              chain,
              offerId,
              OfferFlags::cancelled,
              () -> adapter.cancelOffer(chain, offerId));
    }
    String txHash = cancellation.map(TxRef::hash).orElse(null);
    if (cancellation.isPresent()) {
      offerStore.recordPendingTx(chain, offerId, claim.token(), ClaimStage.CANCELLING, txHash);
      ConfirmationStatus status = adapter.waitForConfirmation(chain, cancellation.get());
      if (status == ConfirmationStatus.FAILED) {
        record("reverted");
        throw ChainException.reverted(chain, "cancel transaction " + txHash + " failed");
      }
      if (status == ConfirmationStatus.PENDING) {
        return pendingOutcome(chain, offerId, "cancel", txHash);
      }
    }
    recorder.recordCancellation(requireStored(chain, offerId), claim.token(), txHash);
    log.info("Offer cancelled chain={} offer_id={} tx_hash={}", chain.id(), offerId, txHash);
    record("cancelled");
    return SettlementOutcome.from(requireStored(chain, offerId), false);
  }

  /**
   * Runs {@code work} while holding the offer's settlement lease. The lease is released afterwards
   * unless the work left a transaction unconfirmed, in which case it runs out on its own so nobody
   * resubmits before reconciliation has observed the outcome.
   */
  private SettlementOutcome underClaim(
      Chain chain,
      String offerId,
      ClaimStage stage,
      Predicate<StoredOffer> done,
      Function<SettlementClaim, SettlementOutcome> work) {
    Instant waitDeadline = clock.instant().plusMillis(properties.getClaimWaitTimeoutMs());
    boolean waited = false;
    while (true) {
      StoredOffer stored = requireStored(chain, offerId);
      Instant now = clock.instant();
      if (done.test(stored)) {
        return SettlementOutcome.from(stored, false);
      }
      if (!stored.isClaimedAt(now)) {
        if (waited && stored.claim() == null) {
          record("concurrent");
          return SettlementOutcome.from(stored, false);
        }
        SettlementClaim claim =
            new SettlementClaim(
                UUID.randomUUID(), stage, now.plusMillis(properties.getClaimLeaseMs()), null);
        if (offerStore.acquireClaim(chain, offerId, stored.version(), claim, now).applied()) {
          if (stored.claim() != null) {
            log.warn(
                "Took over expired settlement claim chain={} offer_id={} stage={} pending_tx={}",
                chain.id(),
                offerId,
                stored.claim().stage(),
                stored.claim().pendingTxHash());
          }
          return runClaimed(chain, offerId, claim, work);
        }
        continue;
      }
      if (!now.isBefore(waitDeadline)) {
        record("pending");
        return SettlementOutcome.from(stored, true);
      }
      waited = true;
      pause(Duration.ofMillis(properties.getClaimPollIntervalMs()));
    }
  }

  private SettlementOutcome runClaimed(
      Chain chain,
      String offerId,
      SettlementClaim claim,
      Function<SettlementClaim, SettlementOutcome> work) {
    boolean keepClaim = false;
    try {
      SettlementOutcome outcome = work.apply(claim);
      keepClaim = outcome.pending();
      return outcome;
    } finally {
      if (!keepClaim) {
        offerStore.releaseClaim(chain, offerId, claim.token());
      }
    }
  }

  private Optional<TxRef> submitOnce(
      LedgerAdapter adapter,
      Chain chain,
      String offerId,
      Predicate<OfferFlags> reached,
      Supplier<TxRef> write) {
    return submitOnce(adapter, chain, offerId, reached, () -> {}, write);
  }

  /**
   * Submits a ledger write. A transient failure leaves the outcome unknown, so before every retry
   * the ledger is re-read; if the target flag is already set the write is not repeated and no
   * transaction reference is returned. {@code precondition} runs before each attempt that is about
   * to submit, outside the submission lock.
   */
  private Optional<TxRef> submitOnce(
      LedgerAdapter adapter,
      Chain chain,
      String offerId,
      Predicate<OfferFlags> reached,
      Runnable precondition,
      Supplier<TxRef> write) {
    String signer = adapter.signerIdentity(chain);
    boolean[] firstAttempt = {true};
    try {
      return submissions.execute(
          () -> {
            if (!firstAttempt[0]) {
              Offer current = readLedgerOffer(adapter, chain, offerId);
              if (reached.test(current.flags())) {
                log.info(
                    "Ledger already reflects submission chain={} offer_id={}", chain.id(), offerId);
                return Optional.empty();
              }
            }
            firstAttempt[0] = false;
            precondition.run();
            return Optional.of(sequencer.submit(chain, signer, write));
          });
    } catch (ChainException ex) {
      if (ex.isTransient()) {
        record("infrastructure");
        throw new InfrastructureException(
            "Ledger submission for offer " + offerId + " failed after retries: " + ex.reason(), ex);
      }
      record("reverted");
      throw ex;
    }
  }

  private void checkPrice(
      Offer offer, Token token, Optional<Consignment> consignment, SettlementClaim claim) {
    BigDecimal candidate = offer.priceUsdPerToken();
    BigDecimal threshold = thresholdPercent(consignment);
    PriceCheckResult result =
        priceProtection.checkPriceDivergence(
            token.contractAddress(), offer.chain(), candidate, threshold);
    if (result.valid()) {
      return;
    }
    String warning =
        result.warning() == null ? "Price protection rejected settlement" : result.warning();
    recorder.recordRejection(
        offer,
        claim.token(),
        REJECTION_PRICE_DIVERGENCE,
        warning,
        candidate,
        result.aggregatedPrice(),
        result.divergencePercent());
    log.warn(
        "Settlement rejected chain={} offer_id={} reason={} detail={}",
        offer.chain().id(),
        offer.id(),
        REJECTION_PRICE_DIVERGENCE,
        warning);
    record("rejected");
    throw new PriceDivergenceException(
        warning, candidate, result.aggregatedPrice(), result.divergencePercent());
  }

  private BigDecimal thresholdPercent(Optional<Consignment> consignment) {
    return consignment
        .map(Consignment::terms)
        .filter(terms -> terms.maxPriceVolatilityBps() > 0)
        .map(
            terms ->
                BigDecimal.valueOf(terms.maxPriceVolatilityBps())
                    .divide(BPS_PER_PERCENT, 2, RoundingMode.HALF_UP))
        .orElse(properties.getDefaultThresholdPercent());
  }

  /** Uses the quote price when the ledger carries no price snapshot. */
  private Offer pricedOffer(Offer offer, String quoteId) {
    if (offer.priceUsdPerToken8d().signum() > 0 || quoteId == null) {
      return offer;
    }
    BigDecimal quotePrice =
        quoteStore
            .find(quoteId)
            .map(StoredQuote::quote)
            .orElseThrow(() -> new DealNotFoundException("Quote", quoteId))
            .priceAtQuote();
    BigInteger price8d =
        quotePrice
            .movePointRight(Offer.PRICE_DECIMALS)
            .setScale(0, RoundingMode.HALF_UP)
            .toBigIntegerExact();
    return offer.withPriceUsdPerToken8d(price8d);
  }

  private void requireWithinWindow(
      Offer offer, Optional<Consignment> consignment, String quoteId) {
    if (offer.flags().paid()) {
      return;
    }
    long windowSeconds =
        consignment
            .map(c -> c.terms().maxTimeToExecuteSeconds())
            .filter(seconds -> seconds > 0)
            .orElse(properties.getDefaultMaxTimeToExecuteSeconds());
    Instant expiresAt = offer.createdAt().plusSeconds(windowSeconds);
    if (!clock.instant().isAfter(expiresAt)) {
      return;
    }
    if (quoteId != null) {
      quoteStore.closePending(quoteId, QuoteStatus.EXPIRED);
    }
    log.warn(
        "Settlement window expired chain={} offer_id={} expired_at={}",
        offer.chain().id(),
        offer.id(),
        expiresAt);
    record("expired");
    throw new SettlementWindowExpiredException(offer.id(), expiresAt);
  }

  private static void requireCancellable(Offer offer) {
    if (!OfferStateMachine.canCancel(offer.status())) {
      throw new DealValidationException(
          "Offer " + offer.id() + " is " + offer.status() + " and cannot be cancelled");
    }
  }

  /** Stores the ledger snapshot on first sight, links the quote and merges newer ledger flags. */
  private StoredOffer syncFromLedger(Offer ledgerOffer, String quoteId) {
    Chain chain = ledgerOffer.chain();
    String offerId = ledgerOffer.id();
    StoredOffer stored = offerStore.insertIfAbsent(ledgerOffer, quoteId);
    if (quoteId != null && !quoteId.equals(stored.quoteId())) {
      if (stored.hasQuote()) {
        throw new DealValidationException(
            "Offer " + offerId + " is already linked to quote " + stored.quoteId());
      }
      StoredQuote quote =
          quoteStore.find(quoteId).orElseThrow(() -> new DealNotFoundException("Quote", quoteId));
      if (quote.quote().isLinked() && !offerId.equals(quote.quote().offerId())) {
        throw new DealValidationException(
            "Quote " + quoteId + " is already linked to offer " + quote.quote().offerId());
      }
      offerStore.linkQuote(chain, offerId, stored.version(), quoteId);
      quoteStore.linkOffer(quoteId, offerId);
      stored = requireStored(chain, offerId);
    } else if (quoteId != null) {
      quoteStore.linkOffer(quoteId, offerId);
    }
    if (!ledgerOffer.flags().isCoveredBy(stored.flags())) {
      OfferFlags merged = stored.flags().union(ledgerOffer.flags());
      offerStore.mergeFlags(chain, offerId, stored.version(), merged);
      stored = requireStored(chain, offerId);
    }
    return stored;
  }

  private Optional<Consignment> loadConsignment(LedgerAdapter adapter, Offer offer) {
    if (!offer.hasConsignment()) {
      return Optional.empty();
    }
    Optional<Consignment> local =
        consignmentStore
            .find(offer.chain(), offer.consignmentId())
            .map(StoredConsignment::consignment);
    if (local.isPresent()) {
      return local;
    }
    Optional<Consignment> ledgerConsignment =
        readLedger(() -> adapter.readConsignment(offer.chain(), offer.consignmentId()));
    if (ledgerConsignment.isEmpty()) {
      log.warn(
          "Consignment missing on ledger chain={} consignment_id={} offer_id={}",
          offer.chain().id(),
          offer.consignmentId(),
          offer.id());
      return Optional.empty();
    }
    return Optional.of(consignmentStore.insertIfAbsent(ledgerConsignment.get()).consignment());
  }

  private Offer readLedgerOffer(LedgerAdapter adapter, Chain chain, String offerId) {
    return readLedger(() -> adapter.readOffer(chain, offerId))
        .orElseThrow(() -> new DealNotFoundException("Offer", chain.id() + ":" + offerId));
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

  private StoredOffer requireStored(Chain chain, String offerId) {
    return offerStore
        .find(chain, offerId)
        .orElseThrow(() -> new DealNotFoundException("Offer", chain.id() + ":" + offerId));
  }

  private SettlementOutcome pendingOutcome(
      Chain chain, String offerId, String step, String txHash) {
    log.warn(
        "Confirmation not observed in time chain={} offer_id={} step={} tx_hash={}",
        chain.id(),
        offerId,
        step,
        txHash);
    record("pending");
    return SettlementOutcome.from(requireStored(chain, offerId), true);
  }

  private static boolean isSettled(StoredOffer stored) {
    return stored.flags().paid() || stored.flags().isTerminal();
  }

  private void pause(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new InfrastructureException("Interrupted while waiting for settlement claim");
    }
  }

  private void record(String outcome) {
    meterRegistry.counter(OUTCOMES_COUNTER, "outcome", outcome).increment();
  }
}
