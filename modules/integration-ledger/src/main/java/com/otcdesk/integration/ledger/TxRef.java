package com.otcdesk.integration.ledger;

import com.otcdesk.domain.deals.Chain;
import java.util.Objects;

public record TxRef(Chain chain, String hash) {
  public TxRef {
    Objects.requireNonNull(chain, "chain must not be null");
    if (hash == null || hash.isBlank()) {
      throw new IllegalArgumentException("hash must not be blank");
    }
  }
}
