package com.otcdesk.domain.deals;

import java.math.BigDecimal;

public class PriceDivergenceException extends DealDomainException {
  private final BigDecimal candidatePrice;
  private final BigDecimal aggregatedPrice;
  private final BigDecimal divergencePercent;

  public PriceDivergenceException(
      String warning,
      BigDecimal candidatePrice,
      BigDecimal aggregatedPrice,
      BigDecimal divergencePercent) {
    super(warning);
    this.candidatePrice = candidatePrice;
    this.aggregatedPrice = aggregatedPrice;
    this.divergencePercent = divergencePercent;
  }

  public BigDecimal candidatePrice() {
    return candidatePrice;
  }

  public BigDecimal aggregatedPrice() {
    return aggregatedPrice;
  }

  public BigDecimal divergencePercent() {
    return divergencePercent;
  }
}
