package com.otcdesk.integration.pricing.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class PoolPriceMathTest {
  private static final BigInteger Q96 = BigInteger.ONE.shiftLeft(96);

  @Test
  void shouldAdjustUnitPriceForDecimals() {
    BigDecimal price = PoolPriceMath.sqrtPriceToPrice0In1(Q96, 18, 6);

    assertEquals(0, new BigDecimal("1000000000000").compareTo(price));
  }

  @Test
  void shouldSquareSqrtPrice() {
    BigDecimal price = PoolPriceMath.sqrtPriceToPrice0In1(Q96.shiftLeft(1), 6, 6);

    assertEquals(0, BigDecimal.valueOf(4).compareTo(price));
  }

  @Test
  void shouldDeriveVirtualReserves() {
    BigInteger liquidity = new BigInteger("2000000000000000000");

    BigDecimal reserve0 = PoolPriceMath.virtualReserve0(liquidity, Q96, 18);
    BigDecimal reserve1 = PoolPriceMath.virtualReserve1(liquidity, Q96.shiftLeft(1), 18);

    assertEquals(0, new BigDecimal("2").compareTo(reserve0));
    assertEquals(0, new BigDecimal("4").compareTo(reserve1));
  }

  @Test
  void shouldPriceConstantProductReserves() {
    BigDecimal price =
        PoolPriceMath.reservePrice(new BigDecimal("200000"), new BigDecimal("100000"));

    assertEquals(0, new BigDecimal("0.5").compareTo(price));
    assertEquals(
        0,
        new BigDecimal("200000")
            .compareTo(PoolPriceMath.twoSidedTvl(new BigDecimal("100000"), BigDecimal.ONE)));
    assertTrue(PoolPriceMath.inverse(BigDecimal.ZERO).signum() == 0);
  }
}
