package com.otcdesk.integration.pricing.pool;

import java.math.BigDecimal;
import java.util.Objects;

/** A liquidity venue holding the token, with the USD price it implies. */
public record PoolCandidate(
    String protocol,
    String poolAddress,
    String quoteAsset,
    BigDecimal tvlUsd,
    BigDecimal priceUsd) {
  public PoolCandidate {
    Objects.requireNonNull(protocol, "protocol must not be null");
    Objects.requireNonNull(poolAddress, "poolAddress must not be null");
    Objects.requireNonNull(tvlUsd, "tvlUsd must not be null");
    Objects.requireNonNull(priceUsd, "priceUsd must not be null");
  }
}
