package com.otcdesk.domain.deals;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

public record Consignment(
    Chain chain,
    String id,
    String tokenId,
    String consigner,
    BigInteger totalAmount,
    BigInteger remainingAmount,
    DealTerms terms,
    boolean fractionalized,
    boolean privateListing,
    ConsignmentStatus status,
    Instant createdAt) {
  public Consignment {
    Objects.requireNonNull(chain, "chain must not be null");
    requireNonBlank(id, "id");
    requireNonBlank(tokenId, "tokenId");
    requireNonBlank(consigner, "consigner");
    Objects.requireNonNull(totalAmount, "totalAmount must not be null");
    Objects.requireNonNull(remainingAmount, "remainingAmount must not be null");
    if (remainingAmount.signum() < 0 || remainingAmount.compareTo(totalAmount) > 0) {
      throw new DealValidationException("remainingAmount must be between 0 and totalAmount");
    }
    Objects.requireNonNull(terms, "terms must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public Consignment withLedgerState(BigInteger nextRemaining, ConsignmentStatus nextStatus) {
    return new Consignment(
        chain,
        id,
        tokenId,
        consigner,
        totalAmount,
        nextRemaining,
        terms,
        fractionalized,
        privateListing,
        nextStatus,
        createdAt);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new DealValidationException(fieldName + " must not be blank");
    }
  }
}
