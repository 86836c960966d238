package com.otcdesk.domain.deals;

import java.math.BigInteger;
import java.util.Objects;

public record DealTerms(
    boolean negotiable,
    int fixedDiscountBps,
    int fixedLockupDays,
    int minDiscountBps,
    int maxDiscountBps,
    int minLockupDays,
    int maxLockupDays,
    BigInteger minDealAmount,
    BigInteger maxDealAmount,
    int maxPriceVolatilityBps,
    long maxTimeToExecuteSeconds) {
  public DealTerms {
    Objects.requireNonNull(minDealAmount, "minDealAmount must not be null");
    Objects.requireNonNull(maxDealAmount, "maxDealAmount must not be null");
    requireBps(fixedDiscountBps, "fixedDiscountBps");
    requireBps(minDiscountBps, "minDiscountBps");
    requireBps(maxDiscountBps, "maxDiscountBps");
    requireBps(maxPriceVolatilityBps, "maxPriceVolatilityBps");
    if (negotiable && minDiscountBps > maxDiscountBps) {
      throw new DealValidationException("minDiscountBps must not exceed maxDiscountBps");
    }
    if (negotiable && minLockupDays > maxLockupDays) {
      throw new DealValidationException("minLockupDays must not exceed maxLockupDays");
    }
    if (maxTimeToExecuteSeconds < 0) {
      throw new DealValidationException("maxTimeToExecuteSeconds must be >= 0");
    }
  }

  public static DealTerms fixed(
      int discountBps, int lockupDays, int maxPriceVolatilityBps, long maxTimeToExecuteSeconds) {
    return new DealTerms(
        false,
        discountBps,
        lockupDays,
        0,
        0,
        0,
        0,
        BigInteger.ZERO,
        BigInteger.ZERO,
        maxPriceVolatilityBps,
        maxTimeToExecuteSeconds);
  }

  private static void requireBps(int value, String fieldName) {
    if (value < 0 || value > 10_000) {
      throw new DealValidationException(fieldName + " must be between 0 and 10000");
    }
  }
}
