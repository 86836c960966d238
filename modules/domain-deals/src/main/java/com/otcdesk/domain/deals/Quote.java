package com.otcdesk.domain.deals;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record Quote(
    String quoteId,
    Chain chain,
    String beneficiary,
    String tokenId,
    int discountBps,
    int lockupDays,
    BigDecimal priceAtQuote,
    Instant expiresAt,
    QuoteStatus status,
    String offerId,
    Instant createdAt) {
  public Quote {
    requireNonBlank(quoteId, "quoteId");
    Objects.requireNonNull(chain, "chain must not be null");
    requireNonBlank(beneficiary, "beneficiary");
    requireNonBlank(tokenId, "tokenId");
    if (discountBps < 0 || discountBps > 10_000) {
      throw new DealValidationException("discountBps must be between 0 and 10000");
    }
    if (lockupDays < 0) {
      throw new DealValidationException("lockupDays must be >= 0");
    }
    Objects.requireNonNull(priceAtQuote, "priceAtQuote must not be null");
    if (priceAtQuote.signum() <= 0) {
      throw new DealValidationException("priceAtQuote must be > 0");
    }
    Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean isLinked() {
    return offerId != null && !offerId.isBlank();
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new DealValidationException(fieldName + " must not be blank");
    }
  }
}
