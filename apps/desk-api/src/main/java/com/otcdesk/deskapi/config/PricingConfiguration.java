package com.otcdesk.deskapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.infra.retry.RetryPolicy;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.pricing.PriceProtectionService;
import com.otcdesk.integration.pricing.PriceSourceException;
import com.otcdesk.integration.pricing.PricingProperties;
import com.otcdesk.integration.pricing.oracle.CoinGeckoPriceOracle;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import com.otcdesk.integration.pricing.pool.GeckoTerminalVenue;
import com.otcdesk.integration.pricing.pool.LiquidityVenue;
import com.otcdesk.integration.pricing.pool.PoolPriceDiscovery;
import com.otcdesk.integration.pricing.pool.UniswapV3Venue;
import com.otcdesk.integration.pricing.pool.V2PairVenue;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "oracleRestClient")
  public RestClient oracleRestClient(PricingProperties properties) {
    return RestClient.builder()
        .baseUrl(properties.getOracle().getBaseUrl())
        .requestFactory(LedgerConfiguration.requestFactory(properties.getOracle().getTimeoutMs()))
        .build();
  }

  @Bean
  public TransientRetryExecutor oracleRetryExecutor(
      PricingProperties properties, MeterRegistry meterRegistry) {
    PricingProperties.Retry retry = properties.getOracle().getRetry();
    return new TransientRetryExecutor(
        "price-oracle",
        RetryPolicy.of(
            retry.getMaxAttempts(),
            retry.getBaseBackoffMs(),
            retry.getMaxBackoffMs(),
            retry.isJitterEnabled()),
        PriceSourceException::isTransient,
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public MarketPriceOracle marketPriceOracle(
      RestClient oracleRestClient,
      ObjectMapper objectMapper,
      PricingProperties properties,
      TransientRetryExecutor oracleRetryExecutor) {
    String apiKey =
        SecretResolver.resolveOptionalSecret(
            properties.getOracle().getApiKey(),
            properties.getOracle().getApiKeyFile(),
            "desk.pricing.oracle.api-key-file");
    return new CoinGeckoPriceOracle(
        oracleRestClient, objectMapper, properties, apiKey, oracleRetryExecutor);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "desk.pricing.pools.gecko-terminal",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public GeckoTerminalVenue geckoTerminalVenue(
      PricingProperties properties, ObjectMapper objectMapper) {
    PricingProperties.GeckoTerminal geckoTerminal = properties.getPools().getGeckoTerminal();
    RestClient restClient =
        RestClient.builder()
            .baseUrl(geckoTerminal.getBaseUrl())
            .requestFactory(LedgerConfiguration.requestFactory(geckoTerminal.getTimeoutMs()))
            .build();
    return new GeckoTerminalVenue(restClient, objectMapper);
  }

  @Bean
  public UniswapV3Venue uniswapV3Venue(
      JsonRpcClient jsonRpcClient,
      LedgerProperties ledgerProperties,
      PricingProperties pricingProperties,
      MarketPriceOracle marketPriceOracle) {
    return new UniswapV3Venue(
        jsonRpcClient, ledgerProperties, pricingProperties, marketPriceOracle);
  }

  @Bean
  public V2PairVenue v2PairVenue(
      JsonRpcClient jsonRpcClient,
      LedgerProperties ledgerProperties,
      PricingProperties pricingProperties,
      MarketPriceOracle marketPriceOracle) {
    return new V2PairVenue(jsonRpcClient, ledgerProperties, pricingProperties, marketPriceOracle);
  }

  @Bean
  @ConditionalOnMissingBean
  public PoolPriceDiscovery poolPriceDiscovery(
      List<LiquidityVenue> venues, PricingProperties properties) {
    return new PoolPriceDiscovery(venues, properties);
  }

  @Bean
  @ConditionalOnMissingBean
  public PriceProtectionService priceProtectionService(
      MarketPriceOracle marketPriceOracle,
      PricingProperties properties,
      MeterRegistry meterRegistry) {
    return new PriceProtectionService(marketPriceOracle, properties, meterRegistry);
  }
}
