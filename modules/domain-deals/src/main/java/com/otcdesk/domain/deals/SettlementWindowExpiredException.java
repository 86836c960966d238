package com.otcdesk.domain.deals;

import java.time.Instant;

public class SettlementWindowExpiredException extends DealDomainException {
  private final Instant expiredAt;

  public SettlementWindowExpiredException(String offerId, Instant expiredAt) {
    super("Settlement window for offer " + offerId + " expired at " + expiredAt);
    this.expiredAt = expiredAt;
  }

  public Instant expiredAt() {
    return expiredAt;
  }
}
