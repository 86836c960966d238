package com.otcdesk.integration.pricing.pool;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.LedgerFamily;
import com.otcdesk.integration.pricing.PriceSourceException;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Pools indexed by GeckoTerminal. Covers venues the on-chain readers do not know about, and is the
 * only source of pool prices for the alternate ledger.
 */
public class GeckoTerminalVenue implements LiquidityVenue {
  private static final String SOURCE = "geckoterminal";
  private static final Map<Chain, String> NETWORKS = new EnumMap<>(Chain.class);

  static {
    NETWORKS.put(Chain.ETHEREUM, "eth");
    NETWORKS.put(Chain.BASE, "base");
    NETWORKS.put(Chain.BSC, "bsc");
    NETWORKS.put(Chain.SOLANA, "solana");
  }

  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public GeckoTerminalVenue(RestClient restClient, ObjectMapper objectMapper) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  @Override
  public String name() {
    return SOURCE;
  }

  @Override
  public boolean supports(Chain chain) {
    return NETWORKS.containsKey(chain);
  }

  @Override
  public List<PoolCandidate> findPools(Chain chain, String tokenAddress) {
    String network = NETWORKS.get(chain);
    JsonNode root = parse(fetch(network, tokenAddress));
    String tokenRef = network + "_" + normalize(chain, tokenAddress);
    List<PoolCandidate> pools = new ArrayList<>();
    for (JsonNode pool : root.path("data")) {
      JsonNode attributes = pool.path("attributes");
      JsonNode relationships = pool.path("relationships");
      String baseRef = normalize(chain, relationshipId(relationships, "base_token"));
      String quoteRef = normalize(chain, relationshipId(relationships, "quote_token"));
      BigDecimal priceUsd;
      if (tokenRef.equals(baseRef)) {
        priceUsd = decimal(attributes.path("base_token_price_usd"));
      } else if (tokenRef.equals(quoteRef)) {
        priceUsd = decimal(attributes.path("quote_token_price_usd"));
      } else {
        continue;
      }
      BigDecimal tvlUsd = decimal(attributes.path("reserve_in_usd"));
      if (priceUsd.signum() <= 0 || tvlUsd.signum() <= 0) {
        continue;
      }
      String dex = relationships.path("dex").path("data").path("id").asText(SOURCE);
      pools.add(
          new PoolCandidate(
              dex, attributes.path("address").asText(""), quoteRef, tvlUsd, priceUsd));
    }
    return pools;
  }

  private String fetch(String network, String tokenAddress) {
    try {
      return restClient
          .get()
          .uri("/networks/{network}/tokens/{address}/pools", network, tokenAddress)
          .accept(MediaType.APPLICATION_JSON)
          .retrieve()
          .onStatus(
              HttpStatusCode::isError,
              (request, response) -> {
                int status = response.getStatusCode().value();
                String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                throw new PriceSourceException(
                    SOURCE,
                    "status=" + status + " body=" + body,
                    status == 429 || response.getStatusCode().is5xxServerError(),
                    null);
              })
          .body(String.class);
    } catch (ResourceAccessException ex) {
      throw new PriceSourceException(SOURCE, "I/O failure: " + ex.getMessage(), true, ex);
    }
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

  private static String relationshipId(JsonNode relationships, String name) {
    return relationships.path(name).path("data").path("id").asText("");
  }

  private static String normalize(Chain chain, String value) {
    return chain.family() == LedgerFamily.EVM ? value.toLowerCase(Locale.ROOT) : value;
  }

  private static BigDecimal decimal(JsonNode node) {
    if (node.isNumber()) {
      return node.decimalValue();
    }
    String text = node.asText("");
    if (text.isBlank()) {
      return BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException ex) {
      return BigDecimal.ZERO;
    }
  }
}
