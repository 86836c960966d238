package com.otcdesk.domain.deals;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

public record Offer(
    Chain chain,
    String id,
    String consignmentId,
    String tokenId,
    String beneficiary,
    BigInteger tokenAmount,
    int discountBps,
    long lockupSeconds,
    PaymentCurrency currency,
    BigInteger priceUsdPerToken8d,
    BigInteger nativeUsdPrice8d,
    Instant createdAt,
    OfferFlags flags) {
  public static final int PRICE_DECIMALS = 8;

  public Offer {
    Objects.requireNonNull(chain, "chain must not be null");
    requireNonBlank(id, "id");
    requireNonBlank(tokenId, "tokenId");
    requireNonBlank(beneficiary, "beneficiary");
    Objects.requireNonNull(tokenAmount, "tokenAmount must not be null");
    if (tokenAmount.signum() <= 0) {
      throw new DealValidationException("tokenAmount must be > 0");
    }
    if (discountBps < 0 || discountBps > 10_000) {
      throw new DealValidationException("discountBps must be between 0 and 10000");
    }
    if (lockupSeconds < 0) {
      throw new DealValidationException("lockupSeconds must be >= 0");
    }
    Objects.requireNonNull(currency, "currency must not be null");
    Objects.requireNonNull(priceUsdPerToken8d, "priceUsdPerToken8d must not be null");
    Objects.requireNonNull(nativeUsdPrice8d, "nativeUsdPrice8d must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(flags, "flags must not be null");
  }

  public OfferStatus status() {
    return flags.status();
  }

  public BigDecimal priceUsdPerToken() {
    return new BigDecimal(priceUsdPerToken8d, PRICE_DECIMALS);
  }

  public boolean hasConsignment() {
    return consignmentId != null && !consignmentId.isBlank() && !"0".equals(consignmentId);
  }

  public Offer withFlags(OfferFlags nextFlags) {
    return new Offer(
        chain,
        id,
        consignmentId,
        tokenId,
        beneficiary,
        tokenAmount,
        discountBps,
        lockupSeconds,
        currency,
        priceUsdPerToken8d,
        nativeUsdPrice8d,
        createdAt,
        nextFlags);
  }

  /** Copy carrying a substitute USD price, used when the ledger snapshot is missing. */
  public Offer withPriceUsdPerToken8d(BigInteger price8d) {
    return new Offer(
        chain,
        id,
        consignmentId,
        tokenId,
        beneficiary,
        tokenAmount,
        discountBps,
        lockupSeconds,
        currency,
        price8d,
        nativeUsdPrice8d,
        createdAt,
        flags);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new DealValidationException(fieldName + " must not be blank");
    }
  }
}
