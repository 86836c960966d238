package com.otcdesk.deskapi.settlement;

import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.OfferStatus;
import com.otcdesk.domain.deals.PaymentCurrency;
import java.math.BigInteger;

/**
 * Result of a settlement request, derived only from the stored record so that concurrent callers
 * for the same offer observe the same values. {@code pending} marks a submitted transaction whose
 * confirmation was not observed in time.
 */
public record SettlementOutcome(
    Chain chain,
    String offerId,
    OfferStatus status,
    OfferFlags flags,
    PaymentCurrency currency,
    BigInteger paymentAmount,
    String lastTxHash,
    String quoteId,
    String lastRejection,
    boolean pending) {

  public static SettlementOutcome from(StoredOffer stored, boolean pending) {
    return new SettlementOutcome(
        stored.offer().chain(),
        stored.offer().id(),
        stored.offer().status(),
        stored.flags(),
        stored.offer().currency(),
        stored.paymentAmount(),
        stored.lastTxHash(),
        stored.quoteId(),
        stored.lastRejection(),
        pending);
  }
}
