package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.OfferStatus;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Local cache of offer records. Status flags are only ever OR-merged, so no write through this
 * interface can clear a flag that is already set.
 */
public interface OfferStore {
  Optional<StoredOffer> find(Chain chain, String offerId);

  /** Inserts the ledger snapshot unless a record already exists, then returns the stored record. */
  StoredOffer insertIfAbsent(Offer offer, String quoteId);

  List<StoredOffer> findByFilter(Chain chain, OfferStatus status, String beneficiary, int limit);

  /** Offers that are neither fulfilled nor cancelled, oldest first. */
  List<StoredOffer> findActive(int limit);

  ConditionalWrite mergeFlags(Chain chain, String offerId, long expectedVersion, OfferFlags flags);

  ConditionalWrite linkQuote(Chain chain, String offerId, long expectedVersion, String quoteId);

  /** Takes the settlement lease when the record is unclaimed or its previous lease has expired. */
  ConditionalWrite acquireClaim(
      Chain chain, String offerId, long expectedVersion, SettlementClaim claim, Instant now);

  ConditionalWrite recordPendingTx(
      Chain chain, String offerId, UUID claimToken, ClaimStage stage, String txHash);

  /** Merges ledger-confirmed flags and moves the held lease on to {@code nextStage}. */
  ConditionalWrite advanceClaim(
      Chain chain,
      String offerId,
      UUID claimToken,
      OfferFlags confirmedFlags,
      String txHash,
      ClaimStage nextStage);

  /**
   * Sets the paid flag while the lease is held. Applies only to the unpaid-to-paid transition, so
   * the caller learns whether this write was the first to record the payment.
   */
  ConditionalWrite markPaid(Chain chain, String offerId, UUID claimToken);

  /** Merges ledger-confirmed flags and releases the lease in one write. */
  ConditionalWrite completeClaim(
      Chain chain,
      String offerId,
      UUID claimToken,
      OfferFlags confirmedFlags,
      String txHash,
      BigInteger paymentAmount);

  ConditionalWrite recordRejection(
      Chain chain, String offerId, UUID claimToken, String reason, String detail, Instant at);

  ConditionalWrite releaseClaim(Chain chain, String offerId, UUID claimToken);
}
