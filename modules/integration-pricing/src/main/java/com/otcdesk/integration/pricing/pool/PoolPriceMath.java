package com.otcdesk.integration.pricing.pool;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/** Price and reserve arithmetic for constant-product and concentrated-liquidity pools. */
public final class PoolPriceMath {
  static final MathContext MATH = MathContext.DECIMAL128;
  private static final BigInteger Q96 = BigInteger.ONE.shiftLeft(96);
  private static final BigDecimal Q96_DECIMAL = new BigDecimal(Q96);
  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  private PoolPriceMath() {}

  /** Price of one whole token0 expressed in whole token1, from {@code sqrtPriceX96}. */
  public static BigDecimal sqrtPriceToPrice0In1(
      BigInteger sqrtPriceX96, int decimals0, int decimals1) {
    BigDecimal ratio = new BigDecimal(sqrtPriceX96).divide(Q96_DECIMAL, MATH);
    BigDecimal decimalShift = BigDecimal.TEN.pow(decimals0 - decimals1, MATH);
    return ratio.multiply(ratio, MATH).multiply(decimalShift, MATH);
  }

  /** Virtual token0 reserve {@code L * 2^96 / sqrtP}, in whole tokens. */
  public static BigDecimal virtualReserve0(
      BigInteger liquidity, BigInteger sqrtPriceX96, int decimals0) {
    BigInteger raw = liquidity.multiply(Q96).divide(sqrtPriceX96);
    return new BigDecimal(raw).movePointLeft(decimals0);
  }

  /** Virtual token1 reserve {@code L * sqrtP / 2^96}, in whole tokens. */
  public static BigDecimal virtualReserve1(
      BigInteger liquidity, BigInteger sqrtPriceX96, int decimals1) {
    BigInteger raw = liquidity.multiply(sqrtPriceX96).divide(Q96);
    return new BigDecimal(raw).movePointLeft(decimals1);
  }

  /** Whole-unit amount of a raw integer reserve. */
  public static BigDecimal toUnits(BigInteger raw, int decimals) {
    return new BigDecimal(raw).movePointLeft(decimals);
  }

  /** Price of one whole base token given both reserves in whole units. */
  public static BigDecimal reservePrice(BigDecimal baseReserve, BigDecimal quoteReserve) {
    if (baseReserve.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return quoteReserve.divide(baseReserve, MATH);
  }

  /** Two-sided TVL estimated from one side of a balanced pool. */
  public static BigDecimal twoSidedTvl(BigDecimal quoteReserve, BigDecimal quoteUsdPrice) {
    return quoteReserve.multiply(quoteUsdPrice, MATH).multiply(TWO, MATH);
  }

  public static BigDecimal inverse(BigDecimal value) {
    if (value.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return BigDecimal.ONE.divide(value, MATH);
  }
}
