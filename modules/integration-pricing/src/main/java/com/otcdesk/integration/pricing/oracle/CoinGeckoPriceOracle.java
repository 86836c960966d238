package com.otcdesk.integration.pricing.oracle;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.InfrastructureException;
import com.otcdesk.domain.deals.LedgerFamily;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.pricing.PriceSourceException;
import com.otcdesk.integration.pricing.PricingProperties;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

public class CoinGeckoPriceOracle implements MarketPriceOracle {
  private static final Logger log = LoggerFactory.getLogger(CoinGeckoPriceOracle.class);

  private static final String SOURCE = "coingecko";
  private static final String API_KEY_HEADER = "x-cg-pro-api-key";
  private static final Map<Chain, String> PLATFORMS = new EnumMap<>(Chain.class);
  private static final Map<Chain, String> NATIVE_ASSETS = new EnumMap<>(Chain.class);

  static {
    PLATFORMS.put(Chain.ETHEREUM, "ethereum");
    PLATFORMS.put(Chain.BASE, "base");
    PLATFORMS.put(Chain.BSC, "binance-smart-chain");
    PLATFORMS.put(Chain.SOLANA, "solana");
    NATIVE_ASSETS.put(Chain.ETHEREUM, "ethereum");
    NATIVE_ASSETS.put(Chain.BASE, "ethereum");
    NATIVE_ASSETS.put(Chain.BSC, "binancecoin");
    NATIVE_ASSETS.put(Chain.SOLANA, "solana");
  }

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final String apiKey;
  private final TransientRetryExecutor retryExecutor;
  private final Cache<String, Optional<BigDecimal>> cache;

  public CoinGeckoPriceOracle(
      RestClient restClient,
      ObjectMapper objectMapper,
      PricingProperties properties,
      String apiKey,
      TransientRetryExecutor retryExecutor) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.apiKey = Objects.requireNonNullElse(apiKey, "");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(
                Duration.ofMillis(Math.max(0L, properties.getOracle().getCacheTtlMs())))
            .build();
  }

  @Override
  public Optional<BigDecimal> usdPrice(Chain chain, String tokenAddress) {
    if (tokenAddress == null || tokenAddress.isBlank()) {
      return Optional.empty();
    }
    String platform = PLATFORMS.get(chain);
    if (platform == null) {
      return Optional.empty();
    }
    // EVM addresses are case-insensitive, alt-ledger mints are not.
    String key =
        chain.family() == LedgerFamily.EVM ? tokenAddress.toLowerCase(Locale.ROOT) : tokenAddress;
    String uri =
        "/simple/token_price/" + platform + "?contract_addresses=" + key + "&vs_currencies=usd";
    return cache.get("token:" + platform + ":" + key, ignored -> fetch(uri, key));
  }

  @Override
  public Optional<BigDecimal> nativeUsdPrice(Chain chain) {
    String assetId = NATIVE_ASSETS.get(chain);
    if (assetId == null) {
      return Optional.empty();
    }
    return cache.get(
        "native:" + assetId,
        ignored -> fetch("/simple/price?ids=" + assetId + "&vs_currencies=usd", assetId));
  }

  private Optional<BigDecimal> fetch(String uri, String responseKey) {
    try {
      return retryExecutor.execute(() -> request(uri, responseKey));
    } catch (PriceSourceException ex) {
      log.warn(
          "Market price lookup failed source={} uri={} error={}", SOURCE, uri, ex.getMessage());
      throw new InfrastructureException("Market price oracle unavailable", ex);
    }
  }

  private Optional<BigDecimal> request(String uri, String responseKey) {
    String body;
    try {
      body =
          restClient
              .get()
              .uri(uri)
              .accept(MediaType.APPLICATION_JSON)
              .headers(
                  headers -> {
                    if (!apiKey.isBlank()) {
                      headers.set(API_KEY_HEADER, apiKey);
                    }
                  })
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  (request, response) -> {
                    int status = response.getStatusCode().value();
                    String errorBody =
                        StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                    boolean retryable =
                        status == 429 || response.getStatusCode().is5xxServerError();
                    throw new PriceSourceException(
                        SOURCE, "status=" + status + " body=" + errorBody, retryable, null);
                  })
              .body(String.class);
    } catch (ResourceAccessException ex) {
      throw new PriceSourceException(SOURCE, "I/O failure: " + ex.getMessage(), true, ex);
    }
    JsonNode root = parse(body);
    JsonNode entry = root.path(responseKey);
    if (entry.isMissingNode()) {
      entry = root.path(responseKey.toLowerCase(Locale.ROOT));
    }
    JsonNode price = entry.path("usd");
    if (!price.isNumber() || price.decimalValue().signum() <= 0) {
      return Optional.empty();
    }
    return Optional.of(price.decimalValue());
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      throw new PriceSourceException(SOURCE, "empty response body", true, null);
    }
    try {
      return objectMapper
          .reader()
          .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
          .readTree(body);
    } catch (IOException ex) {
      throw new PriceSourceException(SOURCE, "malformed JSON response", false, ex);
    }
  }
}
