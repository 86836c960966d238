package com.otcdesk.deskapi.api;

import com.otcdesk.integration.pricing.pool.PoolCandidate;
import java.math.BigDecimal;

public record PoolPriceResponse(
    String chain,
    String token,
    String protocol,
    String poolAddress,
    String quoteAsset,
    BigDecimal tvlUsd,
    BigDecimal priceUsd) {

  public static PoolPriceResponse from(String chain, String token, PoolCandidate pool) {
    return new PoolPriceResponse(
        chain,
        token,
        pool.protocol(),
        pool.poolAddress(),
        pool.quoteAsset(),
        pool.tvlUsd(),
        pool.priceUsd());
  }
}
