package com.otcdesk.deskapi.api;

import com.otcdesk.integration.pricing.PriceCheckResult;
import java.math.BigDecimal;

public record PriceCheckResponse(
    String chain,
    String token,
    BigDecimal candidatePrice,
    boolean valid,
    BigDecimal aggregatedPrice,
    BigDecimal divergencePercent,
    String warning) {

  public static PriceCheckResponse from(
      String chain, String token, BigDecimal candidatePrice, PriceCheckResult result) {
    return new PriceCheckResponse(
        chain,
        token,
        candidatePrice,
        result.valid(),
        result.aggregatedPrice(),
        result.divergencePercent(),
        result.warning());
  }
}
