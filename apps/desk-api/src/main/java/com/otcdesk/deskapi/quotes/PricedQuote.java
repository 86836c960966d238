package com.otcdesk.deskapi.quotes;

import com.otcdesk.domain.deals.Quote;
import com.otcdesk.integration.pricing.pool.PoolCandidate;

/** A registered quote and where its price came from; {@code pool} is null for oracle prices. */
public record PricedQuote(Quote quote, PriceSource source, PoolCandidate pool) {
  public enum PriceSource {
    POOL,
    ORACLE
  }
}
