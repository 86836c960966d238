package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.quotes.PricedQuote;
import com.otcdesk.domain.deals.Quote;
import java.math.BigDecimal;
import java.time.Instant;

/** {@code priceSource} and {@code poolAddress} are only set on the registration response. */
public record QuoteResponse(
    String quoteId,
    String chain,
    String beneficiary,
    String tokenId,
    int discountBps,
    int lockupDays,
    BigDecimal priceAtQuote,
    String status,
    String offerId,
    Instant expiresAt,
    Instant createdAt,
    String priceSource,
    String poolAddress) {

  public static QuoteResponse from(Quote quote) {
    return of(quote, null, null);
  }

  public static QuoteResponse from(PricedQuote priced) {
    return of(
        priced.quote(),
        priced.source().name(),
        priced.pool() != null ? priced.pool().poolAddress() : null);
  }

  private static QuoteResponse of(Quote quote, String priceSource, String poolAddress) {
    return new QuoteResponse(
        quote.quoteId(),
        quote.chain().id(),
        quote.beneficiary(),
        quote.tokenId(),
        quote.discountBps(),
        quote.lockupDays(),
        quote.priceAtQuote(),
        quote.status().name(),
        quote.offerId(),
        quote.expiresAt(),
        quote.createdAt(),
        priceSource,
        poolAddress);
  }
}
