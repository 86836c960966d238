package com.otcdesk.integration.pricing;

import java.math.BigDecimal;

/**
 * Outcome of a divergence check. {@code aggregatedPrice} and {@code divergencePercent} are null
 * when the oracle had no price; {@code warning} is null for a clean pass.
 */
public record PriceCheckResult(
    boolean valid, BigDecimal aggregatedPrice, BigDecimal divergencePercent, String warning) {

  public static PriceCheckResult unchecked(boolean valid, String warning) {
    return new PriceCheckResult(valid, null, null, warning);
  }

  public boolean hasAggregatedPrice() {
    return aggregatedPrice != null;
  }
}
