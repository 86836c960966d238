package com.otcdesk.deskapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.deskapi.settlement.SettlementProperties;
import com.otcdesk.infra.retry.RetryPolicy;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.ConfirmationPoller;
import com.otcdesk.integration.ledger.LedgerAdapter;
import com.otcdesk.integration.ledger.LedgerAdapterRegistry;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.alt.AltLedgerAdapter;
import com.otcdesk.integration.ledger.evm.EvmLedgerAdapter;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.ledger.signer.RelayRequestSigner;
import com.otcdesk.integration.ledger.signer.RestSignerRelayClient;
import com.otcdesk.integration.ledger.signer.SignerRelayClient;
import com.otcdesk.integration.ledger.signer.SignerRelayProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({LedgerProperties.class, SignerRelayProperties.class})
public class LedgerConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock deskClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(name = "ledgerRpcRestClient")
  public RestClient ledgerRpcRestClient(LedgerProperties properties) {
    return RestClient.builder().requestFactory(requestFactory(properties.getTimeoutMs())).build();
  }

  @Bean
  @ConditionalOnMissingBean
  public JsonRpcClient jsonRpcClient(RestClient ledgerRpcRestClient, ObjectMapper objectMapper) {
    return new JsonRpcClient(ledgerRpcRestClient, objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean(name = "signerRelayRestClient")
  public RestClient signerRelayRestClient(SignerRelayProperties properties) {
    return RestClient.builder()
        .baseUrl(properties.getBaseUrl())
        .requestFactory(requestFactory(properties.getTimeoutMs()))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RelayRequestSigner relayRequestSigner(SignerRelayProperties properties, Clock deskClock) {
    String apiSecret =
        SecretResolver.resolveOptionalSecret(
            properties.getApiSecret(),
            properties.getApiSecretFile(),
            "desk.signer.api-secret-file");
    return new RelayRequestSigner(apiSecret, properties.getRecvWindowMs(), deskClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SignerRelayClient signerRelayClient(
      RestClient signerRelayRestClient,
      ObjectMapper objectMapper,
      SignerRelayProperties properties,
      RelayRequestSigner relayRequestSigner) {
    properties.setApiKey(
        SecretResolver.resolveOptionalSecret(
            properties.getApiKey(), properties.getApiKeyFile(), "desk.signer.api-key-file"));
    return new RestSignerRelayClient(
        signerRelayRestClient, objectMapper, properties, relayRequestSigner);
  }

  @Bean
  @ConditionalOnMissingBean
  public ConfirmationPoller confirmationPoller(LedgerProperties properties, Clock deskClock) {
    return ConfirmationPoller.from(properties, deskClock);
  }

  @Bean
  public EvmLedgerAdapter evmLedgerAdapter(
      LedgerProperties properties,
      JsonRpcClient jsonRpcClient,
      SignerRelayClient signerRelayClient,
      ConfirmationPoller confirmationPoller) {
    return new EvmLedgerAdapter(properties, jsonRpcClient, signerRelayClient, confirmationPoller);
  }

  @Bean
  @ConditionalOnProperty(prefix = "desk.ledger.alt", name = "enabled", havingValue = "true")
  public AltLedgerAdapter altLedgerAdapter(
      LedgerProperties properties,
      JsonRpcClient jsonRpcClient,
      SignerRelayClient signerRelayClient,
      ConfirmationPoller confirmationPoller) {
    return new AltLedgerAdapter(properties, jsonRpcClient, signerRelayClient, confirmationPoller);
  }

  @Bean
  @ConditionalOnMissingBean
  public LedgerAdapterRegistry ledgerAdapterRegistry(List<LedgerAdapter> adapters) {
    return new LedgerAdapterRegistry(adapters);
  }

  @Bean
  public TransientRetryExecutor ledgerReadRetryExecutor(
      SettlementProperties settlementProperties, MeterRegistry meterRegistry) {
    return new TransientRetryExecutor(
        "ledger-read",
        retryPolicy(settlementProperties),
        ChainException::isTransient,
        meterRegistry);
  }

  @Bean
  public TransientRetryExecutor ledgerSubmitRetryExecutor(
      SettlementProperties settlementProperties, MeterRegistry meterRegistry) {
    return new TransientRetryExecutor(
        "ledger-submit",
        retryPolicy(settlementProperties),
        ChainException::isTransient,
        meterRegistry);
  }

  static RetryPolicy retryPolicy(SettlementProperties settlementProperties) {
    SettlementProperties.Retry retry = settlementProperties.getRetry();
    return RetryPolicy.of(
        retry.getMaxAttempts(),
        retry.getBaseBackoffMs(),
        retry.getMaxBackoffMs(),
        retry.isJitterEnabled());
  }

  static SimpleClientHttpRequestFactory requestFactory(long timeoutMs) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    int timeout = (int) Math.min(Integer.MAX_VALUE, Math.max(100L, timeoutMs));
    requestFactory.setConnectTimeout(timeout);
    requestFactory.setReadTimeout(timeout);
    return requestFactory;
  }
}
