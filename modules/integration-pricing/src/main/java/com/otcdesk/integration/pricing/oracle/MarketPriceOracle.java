package com.otcdesk.integration.pricing.oracle;

import com.otcdesk.domain.deals.Chain;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Independent market-aggregated USD prices. An empty result means the aggregator does not track the
 * asset; an unreachable aggregator is an exception.
 */
public interface MarketPriceOracle {
  Optional<BigDecimal> usdPrice(Chain chain, String tokenAddress);

  Optional<BigDecimal> nativeUsdPrice(Chain chain);
}
