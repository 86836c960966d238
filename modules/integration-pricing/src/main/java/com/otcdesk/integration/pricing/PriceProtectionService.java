package com.otcdesk.integration.pricing;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares a candidate USD price with the market aggregate. Used to sanity-check discovered pool
 * prices before quoting and again right before an offer is paid.
 */
public class PriceProtectionService {
  private static final Logger log = LoggerFactory.getLogger(PriceProtectionService.class);

  private static final String CHECKS_COUNTER = "desk.price.checks";
  private static final int PERCENT_SCALE = 4;
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final MarketPriceOracle oracle;
  private final BigDecimal defaultThresholdPercent;
  private final PriceProtectionPolicy policy;
  private final MeterRegistry meterRegistry;

  public PriceProtectionService(
      MarketPriceOracle oracle, PricingProperties properties, MeterRegistry meterRegistry) {
    this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
    this.defaultThresholdPercent = properties.getProtection().getDefaultThresholdPercent();
    this.policy = properties.getProtection().getPolicy();
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public PriceCheckResult checkPriceDivergence(
      String tokenAddress, Chain chain, BigDecimal candidatePriceUsd) {
    return checkPriceDivergence(tokenAddress, chain, candidatePriceUsd, defaultThresholdPercent);
  }

  public PriceCheckResult checkPriceDivergence(
      String tokenAddress, Chain chain, BigDecimal candidatePriceUsd, BigDecimal thresholdPercent) {
    Objects.requireNonNull(chain, "chain must not be null");
    if (candidatePriceUsd == null || candidatePriceUsd.signum() <= 0) {
      record("invalid_candidate");
      return PriceCheckResult.unchecked(false, "Invalid candidate price (zero or negative)");
    }
    BigDecimal threshold = thresholdPercent == null ? defaultThresholdPercent : thresholdPercent;

    Optional<BigDecimal> aggregated = oracle.usdPrice(chain, tokenAddress);
    if (aggregated.isEmpty()) {
      record("unavailable");
      if (policy == PriceProtectionPolicy.FAIL_CLOSED) {
        log.warn(
            "Price unverifiable, rejecting chain={} token={} candidate={}",
            chain.id(),
            tokenAddress,
            candidatePriceUsd);
        return PriceCheckResult.unchecked(
            false, "Token not tracked by price aggregator; price cannot be verified");
      }
      log.info(
          "Price unverifiable, allowing chain={} token={} candidate={}",
          chain.id(),
          tokenAddress,
          candidatePriceUsd);
      return PriceCheckResult.unchecked(true, null);
    }

    BigDecimal aggregatedPrice = aggregated.get();
    BigDecimal divergencePercent =
        candidatePriceUsd
            .subtract(aggregatedPrice)
            .abs()
            .multiply(HUNDRED)
            .divide(aggregatedPrice, PERCENT_SCALE, RoundingMode.HALF_UP);
    if (divergencePercent.compareTo(threshold) < 0) {
      record("valid");
      return new PriceCheckResult(true, aggregatedPrice, divergencePercent, null);
    }

    record("diverged");
    String direction = candidatePriceUsd.compareTo(aggregatedPrice) > 0 ? "above" : "below";
    String warning =
        "Price diverges "
            + divergencePercent.setScale(1, RoundingMode.HALF_UP).toPlainString()
            + "% "
            + direction
            + " market ($"
            + candidatePriceUsd.setScale(4, RoundingMode.HALF_UP).toPlainString()
            + " vs $"
            + aggregatedPrice.setScale(4, RoundingMode.HALF_UP).toPlainString()
            + ")";
    log.warn(
        "Price divergence detected chain={} token={} candidate={} aggregated={}"
            + " divergence_pct={} threshold_pct={}",
        chain.id(),
        tokenAddress,
        candidatePriceUsd,
        aggregatedPrice,
        divergencePercent,
        threshold);
    return new PriceCheckResult(false, aggregatedPrice, divergencePercent, warning);
  }

  private void record(String outcome) {
    meterRegistry.counter(CHECKS_COUNTER, "outcome", outcome).increment();
  }
}
