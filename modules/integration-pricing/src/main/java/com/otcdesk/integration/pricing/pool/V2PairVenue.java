package com.otcdesk.integration.pricing.pool;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.evm.AbiWords;
import com.otcdesk.integration.ledger.evm.EvmSelectors;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.pricing.PricingProperties;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Constant-product pairs from a V2-style factory. */
public class V2PairVenue extends EvmPoolVenue {
  public V2PairVenue(
      JsonRpcClient rpcClient,
      LedgerProperties ledgerProperties,
      PricingProperties pricingProperties,
      MarketPriceOracle oracle) {
    super(rpcClient, ledgerProperties, pricingProperties, oracle);
  }

  @Override
  public String name() {
    return "v2-pair";
  }

  @Override
  public boolean supports(Chain chain) {
    return super.supports(chain) && !venues(chain).orElseThrow().getV2Factory().isBlank();
  }

  @Override
  public List<PoolCandidate> findPools(Chain chain, String tokenAddress) {
    PricingProperties.EvmVenues config = venues(chain).orElseThrow();
    List<QuoteAsset> quoteAssets = quoteAssets(chain, tokenAddress);
    if (quoteAssets.isEmpty()) {
      return List.of();
    }
    int tokenDecimals = decimals(chain, tokenAddress);
    List<PoolCandidate> pools = new ArrayList<>();
    for (QuoteAsset quote : quoteAssets) {
      String pair =
          call(
                  chain,
                  config.getV2Factory(),
                  AbiWords.encodeCall(EvmSelectors.GET_PAIR, tokenAddress, quote.address()))
              .address(0);
      if (AbiWords.isZeroAddress(pair)) {
        continue;
      }
      AbiWords reserves = call(chain, pair, AbiWords.encodeCall(EvmSelectors.GET_RESERVES));
      String token0 = call(chain, pair, AbiWords.encodeCall(EvmSelectors.TOKEN0)).address(0);
      boolean tokenIsToken0 = sameAddress(token0, tokenAddress);
      BigDecimal tokenReserve =
          PoolPriceMath.toUnits(reserves.uint(tokenIsToken0 ? 0 : 1), tokenDecimals);
      BigDecimal quoteReserve =
          PoolPriceMath.toUnits(reserves.uint(tokenIsToken0 ? 1 : 0), quote.decimals());
      if (tokenReserve.signum() == 0 || quoteReserve.signum() == 0) {
        continue;
      }
      BigDecimal priceUsd =
          PoolPriceMath.reservePrice(tokenReserve, quoteReserve)
              .multiply(quote.usdPrice(), PoolPriceMath.MATH);
      pools.add(
          new PoolCandidate(
              name(),
              pair,
              quote.label(),
              PoolPriceMath.twoSidedTvl(quoteReserve, quote.usdPrice()),
              priceUsd));
    }
    return pools;
  }
}
