package com.otcdesk.integration.pricing.pool;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.pricing.PricingProperties;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the most liquid pool for a token across every configured venue. No qualifying pool is an
 * empty result, never an error; a venue that fails is skipped.
 */
public class PoolPriceDiscovery {
  private static final Logger log = LoggerFactory.getLogger(PoolPriceDiscovery.class);

  private final List<LiquidityVenue> venues;
  private final BigDecimal minTvlUsd;
  private final Cache<String, Optional<PoolCandidate>> cache;

  public PoolPriceDiscovery(List<LiquidityVenue> venues, PricingProperties properties) {
    this.venues = List.copyOf(Objects.requireNonNull(venues, "venues must not be null"));
    this.minTvlUsd = properties.getPools().getMinTvlUsd();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(5_000)
            .expireAfterWrite(
                Duration.ofMillis(Math.max(0L, properties.getPools().getCacheTtlMs())))
            .build();
  }

  public Optional<PoolCandidate> findBestPool(String tokenAddress, Chain chain) {
    if (tokenAddress == null || tokenAddress.isBlank()) {
      return Optional.empty();
    }
    String key = chain.id() + ":" + tokenAddress.toLowerCase(Locale.ROOT);
    return cache.get(key, ignored -> discover(tokenAddress, chain));
  }

  private Optional<PoolCandidate> discover(String tokenAddress, Chain chain) {
    PoolCandidate best = null;
    int examined = 0;
    for (LiquidityVenue venue : venues) {
      if (!venue.supports(chain)) {
        continue;
      }
      List<PoolCandidate> pools;
      try {
        pools = venue.findPools(chain, tokenAddress);
      } catch (RuntimeException ex) {
        log.warn(
            "Liquidity venue skipped venue={} chain={} token={} error={}",
            venue.name(),
            chain.id(),
            tokenAddress,
            ex.getMessage());
        continue;
      }
      examined += pools.size();
      Optional<PoolCandidate> venueBest =
          pools.stream()
              .filter(pool -> pool.priceUsd().signum() > 0)
              .filter(pool -> pool.tvlUsd().compareTo(minTvlUsd) >= 0)
              .max(Comparator.comparing(PoolCandidate::tvlUsd));
      if (venueBest.isPresent()
          && (best == null || venueBest.get().tvlUsd().compareTo(best.tvlUsd()) > 0)) {
        best = venueBest.get();
      }
    }
    log.debug(
        "Pool discovery finished chain={} token={} pools_examined={} best_pool={}",
        chain.id(),
        tokenAddress,
        examined,
        best == null ? "none" : best.poolAddress());
    return Optional.ofNullable(best);
  }
}
