package com.otcdesk.domain.deals;

import java.util.Locale;

public enum Chain {
  ETHEREUM("ethereum", LedgerFamily.EVM),
  BASE("base", LedgerFamily.EVM),
  BSC("bsc", LedgerFamily.EVM),
  SOLANA("solana", LedgerFamily.ALT_LEDGER);

  private final String id;
  private final LedgerFamily family;

  Chain(String id, LedgerFamily family) {
    this.id = id;
    this.family = family;
  }

  public String id() {
    return id;
  }

  public LedgerFamily family() {
    return family;
  }

  public static Chain fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new DealValidationException("chain must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Chain chain : values()) {
      if (chain.id.equals(normalized) || chain.name().equalsIgnoreCase(normalized)) {
        return chain;
      }
    }
    throw new DealValidationException("Unknown chain: " + value);
  }
}
