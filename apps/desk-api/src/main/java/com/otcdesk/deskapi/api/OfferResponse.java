package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.domain.deals.Offer;
import java.math.BigDecimal;
import java.time.Instant;

public record OfferResponse(
    String chain,
    String offerId,
    String consignmentId,
    String tokenId,
    String beneficiary,
    String tokenAmount,
    int discountBps,
    long lockupSeconds,
    String currency,
    BigDecimal priceUsdPerToken,
    String status,
    boolean approved,
    boolean paid,
    boolean fulfilled,
    boolean cancelled,
    String quoteId,
    String paymentAmount,
    String lastTxHash,
    String lastRejection,
    String lastRejectionDetail,
    Instant createdAt,
    Instant updatedAt) {

  public static OfferResponse from(StoredOffer stored) {
    Offer offer = stored.offer();
    return new OfferResponse(
        offer.chain().id(),
        offer.id(),
        offer.consignmentId(),
        offer.tokenId(),
        offer.beneficiary(),
        offer.tokenAmount().toString(),
        offer.discountBps(),
        offer.lockupSeconds(),
        offer.currency().name(),
        offer.priceUsdPerToken(),
        offer.status().name(),
        offer.flags().approved(),
        offer.flags().paid(),
        offer.flags().fulfilled(),
        offer.flags().cancelled(),
        stored.quoteId(),
        stored.paymentAmount() != null ? stored.paymentAmount().toString() : null,
        stored.lastTxHash(),
        stored.lastRejection(),
        stored.lastRejectionDetail(),
        offer.createdAt(),
        stored.updatedAt());
  }
}
