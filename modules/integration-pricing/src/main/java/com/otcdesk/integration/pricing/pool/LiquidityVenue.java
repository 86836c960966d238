package com.otcdesk.integration.pricing.pool;

import com.otcdesk.domain.deals.Chain;
import java.util.List;

public interface LiquidityVenue {
  String name();

  boolean supports(Chain chain);

  /** Every pool this venue has for {@code tokenAddress}; TVL filtering is left to the caller. */
  List<PoolCandidate> findPools(Chain chain, String tokenAddress);
}
