package com.otcdesk.integration.pricing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PriceProtectionServiceTest {
  private static final String TOKEN = "0x4200000000000000000000000000000000000042";

  private MarketPriceOracle oracle;
  private PricingProperties properties;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    oracle = mock(MarketPriceOracle.class);
    properties = new PricingProperties();
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  void shouldPassWithZeroDivergenceOnExactMatch() {
    when(oracle.usdPrice(Chain.BASE, TOKEN)).thenReturn(Optional.of(new BigDecimal("1.25")));

    PriceCheckResult result =
        service().checkPriceDivergence(TOKEN, Chain.BASE, new BigDecimal("1.25"));

    assertTrue(result.valid());
    assertEquals(0, result.divergencePercent().signum());
    assertEquals(new BigDecimal("1.25"), result.aggregatedPrice());
    assertNull(result.warning());
  }

  @Test
  void shouldRejectCandidateFiftyPercentBelowMarket() {
    when(oracle.usdPrice(Chain.BASE, TOKEN)).thenReturn(Optional.of(new BigDecimal("100")));

    PriceCheckResult result =
        service().checkPriceDivergence(TOKEN, Chain.BASE, new BigDecimal("50"));

    assertFalse(result.valid());
    assertEquals(0, new BigDecimal("50").compareTo(result.divergencePercent()));
    assertEquals("Price diverges 50.0% below market ($50.0000 vs $100.0000)", result.warning());
    assertEquals(
        1.0, meterRegistry.get("desk.price.checks").tag("outcome", "diverged").counter().count());
  }

  @Test
  void shouldDescribeUpwardDivergence() {
    when(oracle.usdPrice(Chain.SOLANA, "mint")).thenReturn(Optional.of(new BigDecimal("2.00")));

    PriceCheckResult result =
        service().checkPriceDivergence("mint", Chain.SOLANA, new BigDecimal("2.50"));

    assertFalse(result.valid());
    assertTrue(result.warning().contains("25.0% above market"));
  }

  @Test
  void shouldApplyCallerThreshold() {
    when(oracle.usdPrice(Chain.BASE, TOKEN)).thenReturn(Optional.of(new BigDecimal("1.00")));

    PriceCheckResult loose =
        service()
            .checkPriceDivergence(TOKEN, Chain.BASE, new BigDecimal("1.04"), new BigDecimal("5"));
    PriceCheckResult strict =
        service()
            .checkPriceDivergence(TOKEN, Chain.BASE, new BigDecimal("1.04"), new BigDecimal("3"));

    assertTrue(loose.valid());
    assertFalse(strict.valid());
  }

  @Test
  void shouldTreatDivergenceEqualToThresholdAsInvalid() {
    when(oracle.usdPrice(Chain.BASE, TOKEN)).thenReturn(Optional.of(new BigDecimal("1.00")));

    PriceCheckResult result =
        service().checkPriceDivergence(TOKEN, Chain.BASE, new BigDecimal("1.10"));

    assertFalse(result.valid());
  }

  @Test
  void shouldFailOpenWhenOracleHasNoPrice() {
    when(oracle.usdPrice(Chain.BASE, TOKEN)).thenReturn(Optional.empty());

    PriceCheckResult result =
        service().checkPriceDivergence(TOKEN, Chain.BASE, new BigDecimal("123456"));

    assertTrue(result.valid());
    assertFalse(result.hasAggregatedPrice());
    assertNull(result.divergencePercent());
    assertNull(result.warning());
  }

  @Test
  void shouldFailClosedWhenConfigured() {
    properties.getProtection().setPolicy(PriceProtectionPolicy.FAIL_CLOSED);
    when(oracle.usdPrice(Chain.BASE, TOKEN)).thenReturn(Optional.empty());

    PriceCheckResult result = service().checkPriceDivergence(TOKEN, Chain.BASE, BigDecimal.ONE);

    assertFalse(result.valid());
    assertNotNull(result.warning());
  }

  @Test
  void shouldRejectNonPositiveCandidateWithoutCallingOracle() {
    PriceCheckResult result = service().checkPriceDivergence(TOKEN, Chain.BASE, BigDecimal.ZERO);

    assertFalse(result.valid());
    assertFalse(result.hasAggregatedPrice());
  }

  private PriceProtectionService service() {
    return new PriceProtectionService(oracle, properties, meterRegistry);
  }
}
