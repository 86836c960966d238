package com.otcdesk.deskapi.quotes;

import static com.otcdesk.deskapi.support.DealFixtures.CHAIN;
import static com.otcdesk.deskapi.support.DealFixtures.TOKEN_ADDRESS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.otcdesk.deskapi.settlement.SettlementProperties;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.StoredQuote;
import com.otcdesk.deskapi.store.TokenRepository;
import com.otcdesk.deskapi.support.DealFixtures;
import com.otcdesk.domain.deals.DealNotFoundException;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.PriceDivergenceException;
import com.otcdesk.domain.deals.Quote;
import com.otcdesk.domain.deals.QuoteStatus;
import com.otcdesk.integration.pricing.PriceCheckResult;
import com.otcdesk.integration.pricing.PriceProtectionService;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import com.otcdesk.integration.pricing.pool.PoolCandidate;
import com.otcdesk.integration.pricing.pool.PoolPriceDiscovery;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class QuotePricingServiceTest {
  private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

  private TokenRepository tokenRepository;
  private QuoteStore quoteStore;
  private PoolPriceDiscovery poolPriceDiscovery;
  private PriceProtectionService priceProtection;
  private MarketPriceOracle oracle;
  private QuotePricingService service;

  @BeforeEach
  void setUp() {
    tokenRepository = mock(TokenRepository.class);
    quoteStore = mock(QuoteStore.class);
    poolPriceDiscovery = mock(PoolPriceDiscovery.class);
    priceProtection = mock(PriceProtectionService.class);
    oracle = mock(MarketPriceOracle.class);
    SettlementProperties properties = new SettlementProperties();
    properties.setQuoteTtlSeconds(900);
    service =
        new QuotePricingService(
            tokenRepository,
            quoteStore,
            poolPriceDiscovery,
            priceProtection,
            oracle,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
    when(tokenRepository.find(CHAIN, DealFixtures.TOKEN_ID))
        .thenReturn(Optional.of(DealFixtures.token()));
    when(quoteStore.find(any())).thenReturn(Optional.empty());
  }

  @Test
  void shouldPriceFromPoolWhenItAgreesWithAggregate() {
    PoolCandidate pool =
        new PoolCandidate(
            "uniswap-v3", "0xpool", "STABLE", new BigDecimal("250000"), new BigDecimal("0.051"));
    when(poolPriceDiscovery.findBestPool(TOKEN_ADDRESS, CHAIN)).thenReturn(Optional.of(pool));
    when(priceProtection.checkPriceDivergence(TOKEN_ADDRESS, CHAIN, new BigDecimal("0.051")))
        .thenReturn(new PriceCheckResult(true, new BigDecimal("0.05"), new BigDecimal("2"), null));

    PricedQuote priced = service.registerQuote(command("q-1"));

    assertEquals(PricedQuote.PriceSource.POOL, priced.source());
    assertEquals(new BigDecimal("0.051"), priced.quote().priceAtQuote());
    assertEquals(QuoteStatus.PENDING, priced.quote().status());
    assertEquals(NOW.plusSeconds(900), priced.quote().expiresAt());
    ArgumentCaptor<Quote> stored = ArgumentCaptor.forClass(Quote.class);
    verify(quoteStore).insert(stored.capture());
    assertEquals("q-1", stored.getValue().quoteId());
  }

  @Test
  void shouldFallBackToAggregateWithoutQualifyingPool() {
    when(poolPriceDiscovery.findBestPool(TOKEN_ADDRESS, CHAIN)).thenReturn(Optional.empty());
    when(oracle.usdPrice(CHAIN, TOKEN_ADDRESS)).thenReturn(Optional.of(new BigDecimal("0.049")));

    PricedQuote priced = service.registerQuote(command("q-2"));

    assertEquals(PricedQuote.PriceSource.ORACLE, priced.source());
    assertEquals(new BigDecimal("0.049"), priced.quote().priceAtQuote());
  }

  @Test
  void shouldRejectPoolPriceThatDivergesFromAggregate() {
    PoolCandidate pool =
        new PoolCandidate(
            "uniswap-v2", "0xpair", "NATIVE", new BigDecimal("90000"), new BigDecimal("0.09"));
    when(poolPriceDiscovery.findBestPool(TOKEN_ADDRESS, CHAIN)).thenReturn(Optional.of(pool));
    when(priceProtection.checkPriceDivergence(TOKEN_ADDRESS, CHAIN, new BigDecimal("0.09")))
        .thenReturn(
            new PriceCheckResult(
                false, new BigDecimal("0.05"), new BigDecimal("80"), "Price is 80.0% above"));

    assertThrows(PriceDivergenceException.class, () -> service.registerQuote(command("q-3")));
    verify(quoteStore, never()).insert(any());
  }

  @Test
  void shouldRequireRegisteredToken() {
    when(tokenRepository.find(CHAIN, DealFixtures.TOKEN_ID)).thenReturn(Optional.empty());

    assertThrows(DealNotFoundException.class, () -> service.registerQuote(command("q-4")));
  }

  @Test
  void shouldRejectDuplicateQuoteId() {
    Quote existing =
        new Quote(
            "q-5",
            CHAIN,
            DealFixtures.BENEFICIARY,
            DealFixtures.TOKEN_ID,
            1_000,
            30,
            new BigDecimal("0.05"),
            NOW.plusSeconds(60),
            QuoteStatus.PENDING,
            null,
            NOW);
    when(quoteStore.find("q-5")).thenReturn(Optional.of(new StoredQuote(existing, 0)));

    assertThrows(DealValidationException.class, () -> service.registerQuote(command("q-5")));
  }

  @Test
  void shouldFailWhenNoPriceSourceKnowsToken() {
    when(poolPriceDiscovery.findBestPool(TOKEN_ADDRESS, CHAIN)).thenReturn(Optional.empty());
    when(oracle.usdPrice(CHAIN, TOKEN_ADDRESS)).thenReturn(Optional.empty());

    assertThrows(DealValidationException.class, () -> service.registerQuote(command("q-6")));
  }

  private static RegisterQuoteCommand command(String quoteId) {
    return new RegisterQuoteCommand(
        quoteId, CHAIN, DealFixtures.BENEFICIARY, DealFixtures.TOKEN_ID, 1_000, 30);
  }
}
