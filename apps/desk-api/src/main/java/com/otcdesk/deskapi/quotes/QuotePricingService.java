package com.otcdesk.deskapi.quotes;

import com.otcdesk.deskapi.settlement.SettlementProperties;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.StoredQuote;
import com.otcdesk.deskapi.store.TokenRepository;
import com.otcdesk.domain.deals.DealNotFoundException;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.PriceDivergenceException;
import com.otcdesk.domain.deals.Quote;
import com.otcdesk.domain.deals.QuoteStatus;
import com.otcdesk.domain.deals.Token;
import com.otcdesk.integration.pricing.PriceCheckResult;
import com.otcdesk.integration.pricing.PriceProtectionService;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import com.otcdesk.integration.pricing.pool.PoolCandidate;
import com.otcdesk.integration.pricing.pool.PoolPriceDiscovery;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Prices a negotiated quote. The most liquid pool supplies the price after a sanity check against
 * the market aggregate; without a qualifying pool the aggregate price is used directly.
 */
@Service
public class QuotePricingService {
  private static final Logger log = LoggerFactory.getLogger(QuotePricingService.class);

  private final TokenRepository tokenRepository;
  private final QuoteStore quoteStore;
  private final PoolPriceDiscovery poolPriceDiscovery;
  private final PriceProtectionService priceProtection;
  private final MarketPriceOracle oracle;
  private final SettlementProperties properties;
  private final Clock clock;

  public QuotePricingService(
      TokenRepository tokenRepository,
      QuoteStore quoteStore,
      PoolPriceDiscovery poolPriceDiscovery,
      PriceProtectionService priceProtection,
      MarketPriceOracle oracle,
      SettlementProperties properties,
      Clock clock) {
    this.tokenRepository = tokenRepository;
    this.quoteStore = quoteStore;
    this.poolPriceDiscovery = poolPriceDiscovery;
    this.priceProtection = priceProtection;
    this.oracle = oracle;
    this.properties = properties;
    this.clock = clock;
  }

  public PricedQuote registerQuote(RegisterQuoteCommand command) {
    if (command.chain() == null) {
      throw new DealValidationException("chain must not be null");
    }
    Token token =
        tokenRepository
            .find(command.chain(), command.tokenId())
            .orElseThrow(
                () ->
                    new DealNotFoundException(
                        "Token", command.chain().id() + ":" + command.tokenId()));
    String quoteId =
        command.quoteId() == null || command.quoteId().isBlank()
            ? UUID.randomUUID().toString()
            : command.quoteId();
    if (quoteStore.find(quoteId).isPresent()) {
      throw new DealValidationException("Quote already exists: " + quoteId);
    }

    PricedQuote.PriceSource source;
    BigDecimal price;
    Optional<PoolCandidate> pool =
        poolPriceDiscovery.findBestPool(token.contractAddress(), command.chain());
    if (pool.isPresent()) {
      PriceCheckResult check =
          priceProtection.checkPriceDivergence(
              token.contractAddress(), command.chain(), pool.get().priceUsd());
      if (!check.valid()) {
        log.warn(
            "Quote rejected chain={} token={} pool={} warning={}",
            command.chain().id(),
            token.contractAddress(),
            pool.get().poolAddress(),
            check.warning());
        throw new PriceDivergenceException(
            check.warning(),
            pool.get().priceUsd(),
            check.aggregatedPrice(),
            check.divergencePercent());
      }
      source = PricedQuote.PriceSource.POOL;
      price = pool.get().priceUsd();
    } else {
      price =
          oracle
              .usdPrice(command.chain(), token.contractAddress())
              .orElseThrow(
                  () ->
                      new DealValidationException(
                          "No price available for token " + token.contractAddress()));
      source = PricedQuote.PriceSource.ORACLE;
    }

    Instant now = clock.instant();
    Quote quote =
        new Quote(
            quoteId,
            command.chain(),
            command.beneficiary(),
            command.tokenId(),
            command.discountBps(),
            command.lockupDays(),
            price,
            now.plusSeconds(properties.getQuoteTtlSeconds()),
            QuoteStatus.PENDING,
            null,
            now);
    quoteStore.insert(quote);
    log.info(
        "Quote registered quote_id={} chain={} token={} price_usd={} source={}",
        quoteId,
        command.chain().id(),
        token.contractAddress(),
        price,
        source);
    return new PricedQuote(quote, source, pool.orElse(null));
  }

  public StoredQuote findQuote(String quoteId) {
    return quoteStore.find(quoteId).orElseThrow(() -> new DealNotFoundException("Quote", quoteId));
  }
}
