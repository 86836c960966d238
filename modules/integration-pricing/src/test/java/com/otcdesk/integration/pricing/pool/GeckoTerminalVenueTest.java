package com.otcdesk.integration.pricing.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.pricing.PriceSourceException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class GeckoTerminalVenueTest {
  private static final String BASE_URL = "https://gecko.test/api/v2";
  private static final String MINT = "9BB6NFEcjBCtnNLFko2FqVQBq8HHM13kCyYcdQbgpump";

  private MockRestServiceServer server;
  private GeckoTerminalVenue venue;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    venue = new GeckoTerminalVenue(builder.build(), new ObjectMapper());
  }

  @Test
  void shouldReadPoolsWhereTokenIsBaseOrQuote() {
    server
        .expect(requestTo(BASE_URL + "/networks/solana/tokens/" + MINT + "/pools"))
        .andRespond(
            withSuccess(
                """
                {
                  "data": [
                    {
                      "attributes": {
                        "address": "PoolA",
                        "reserve_in_usd": "250000.50",
                        "base_token_price_usd": "0.0123",
                        "quote_token_price_usd": "150.1"
                      },
                      "relationships": {
                        "base_token": {"data": {"id": "solana_%s"}},
                        "quote_token": {"data": {"id": "solana_WSOL"}},
                        "dex": {"data": {"id": "raydium"}}
                      }
                    },
                    {
                      "attributes": {
                        "address": "PoolB",
                        "reserve_in_usd": "9000",
                        "base_token_price_usd": "150.2",
                        "quote_token_price_usd": "0.0124"
                      },
                      "relationships": {
                        "base_token": {"data": {"id": "solana_WSOL"}},
                        "quote_token": {"data": {"id": "solana_%s"}},
                        "dex": {"data": {"id": "orca"}}
                      }
                    },
                    {
                      "attributes": {
                        "address": "PoolC",
                        "reserve_in_usd": "1000000",
                        "base_token_price_usd": "1"
                      },
                      "relationships": {
                        "base_token": {"data": {"id": "solana_other"}},
                        "quote_token": {"data": {"id": "solana_another"}}
                      }
                    }
                  ]
                }
                """
                    .formatted(MINT, MINT),
                MediaType.APPLICATION_JSON));

    List<PoolCandidate> pools = venue.findPools(Chain.SOLANA, MINT);

    assertEquals(2, pools.size());
    assertEquals("raydium", pools.get(0).protocol());
    assertEquals(0, new BigDecimal("0.0123").compareTo(pools.get(0).priceUsd()));
    assertEquals(0, new BigDecimal("250000.50").compareTo(pools.get(0).tvlUsd()));
    assertEquals("orca", pools.get(1).protocol());
    assertEquals(0, new BigDecimal("0.0124").compareTo(pools.get(1).priceUsd()));
  }

  @Test
  void shouldMarkRateLimitAsTransient() {
    server
        .expect(requestTo(BASE_URL + "/networks/base/tokens/0xabc/pools"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    PriceSourceException ex =
        assertThrows(PriceSourceException.class, () -> venue.findPools(Chain.BASE, "0xabc"));

    assertTrue(ex.isTransient());
  }
}
