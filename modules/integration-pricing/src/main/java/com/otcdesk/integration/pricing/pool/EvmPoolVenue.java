package com.otcdesk.integration.pricing.pool;

import com.fasterxml.jackson.databind.JsonNode;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.LedgerFamily;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.evm.AbiWords;
import com.otcdesk.integration.ledger.evm.EvmSelectors;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.pricing.PricingProperties;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Shared plumbing for venues read straight from EVM contracts. */
abstract class EvmPoolVenue implements LiquidityVenue {
  private static final int WRAPPED_NATIVE_DECIMALS = 18;

  private final JsonRpcClient rpcClient;
  private final LedgerProperties ledgerProperties;
  private final PricingProperties pricingProperties;
  private final MarketPriceOracle oracle;

  EvmPoolVenue(
      JsonRpcClient rpcClient,
      LedgerProperties ledgerProperties,
      PricingProperties pricingProperties,
      MarketPriceOracle oracle) {
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    this.ledgerProperties =
        Objects.requireNonNull(ledgerProperties, "ledgerProperties must not be null");
    this.pricingProperties =
        Objects.requireNonNull(pricingProperties, "pricingProperties must not be null");
    this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
  }

  @Override
  public boolean supports(Chain chain) {
    return chain.family() == LedgerFamily.EVM
        && venues(chain).isPresent()
        && ledgerProperties.getEvm().containsKey(chain.id());
  }

  Optional<PricingProperties.EvmVenues> venues(Chain chain) {
    return Optional.ofNullable(pricingProperties.getPools().getEvm().get(chain.id()));
  }

  /** Assets the token is quoted against, with their current USD value. */
  List<QuoteAsset> quoteAssets(Chain chain, String tokenAddress) {
    PricingProperties.EvmVenues config = venues(chain).orElseThrow();
    List<QuoteAsset> assets = new ArrayList<>(2);
    if (!config.getStableToken().isBlank() && !sameAddress(config.getStableToken(), tokenAddress)) {
      assets.add(
          new QuoteAsset(
              "STABLE", config.getStableToken(), config.getStableDecimals(), BigDecimal.ONE));
    }
    if (!config.getWrappedNative().isBlank()
        && !sameAddress(config.getWrappedNative(), tokenAddress)) {
      String wrappedNative = config.getWrappedNative();
      oracle
          .nativeUsdPrice(chain)
          .map(usd -> new QuoteAsset("WRAPPED_NATIVE", wrappedNative, WRAPPED_NATIVE_DECIMALS, usd))
          .ifPresent(assets::add);
    }
    return assets;
  }

  AbiWords call(Chain chain, String contract, String calldata) {
    String rpcUrl = ledgerProperties.getEvm().get(chain.id()).getRpcUrl();
    Map<String, String> callObject = Map.of("to", contract, "data", calldata);
    JsonNode result = rpcClient.call(chain, rpcUrl, "eth_call", callObject, "latest");
    return AbiWords.decode(result.asText(""));
  }

  int decimals(Chain chain, String token) {
    return call(chain, token, AbiWords.encodeCall(EvmSelectors.DECIMALS)).uintAsInt(0);
  }

  static boolean sameAddress(String left, String right) {
    return left.toLowerCase(Locale.ROOT).equals(right.toLowerCase(Locale.ROOT));
  }

  record QuoteAsset(String label, String address, int decimals, BigDecimal usdPrice) {}
}
