package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

public record StoredOffer(
    Offer offer,
    String quoteId,
    BigInteger paymentAmount,
    String lastTxHash,
    SettlementClaim claim,
    String lastRejection,
    String lastRejectionDetail,
    long version,
    Instant updatedAt) {
  public StoredOffer {
    Objects.requireNonNull(offer, "offer must not be null");
  }

  public OfferFlags flags() {
    return offer.flags();
  }

  public boolean isClaimedAt(Instant now) {
    return claim != null && claim.isActiveAt(now);
  }

  public boolean hasQuote() {
    return quoteId != null && !quoteId.isBlank();
  }

  public String key() {
    return offer.chain().id() + ":" + offer.id();
  }
}
