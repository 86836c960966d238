package com.otcdesk.domain.deals;

import java.util.Objects;

public record Token(
    Chain chain, String ledgerTokenId, String contractAddress, String symbol, int decimals) {
  public Token {
    Objects.requireNonNull(chain, "chain must not be null");
    if (ledgerTokenId == null || ledgerTokenId.isBlank()) {
      throw new DealValidationException("ledgerTokenId must not be blank");
    }
    if (contractAddress == null || contractAddress.isBlank()) {
      throw new DealValidationException("contractAddress must not be blank");
    }
    if (decimals < 0 || decimals > 36) {
      throw new DealValidationException("decimals must be between 0 and 36");
    }
  }
}
