package com.otcdesk.deskapi.store;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Lease a settlement attempt holds on an offer record while it talks to the ledger. */
public record SettlementClaim(
    UUID token, ClaimStage stage, Instant expiresAt, String pendingTxHash) {
  public SettlementClaim {
    Objects.requireNonNull(token, "token must not be null");
    Objects.requireNonNull(stage, "stage must not be null");
    Objects.requireNonNull(expiresAt, "expiresAt must not be null");
  }

  public boolean isActiveAt(Instant now) {
    return expiresAt.isAfter(now);
  }
}
