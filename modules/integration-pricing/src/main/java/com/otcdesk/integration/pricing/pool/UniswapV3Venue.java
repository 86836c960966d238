package com.otcdesk.integration.pricing.pool;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.evm.AbiWords;
import com.otcdesk.integration.ledger.evm.EvmSelectors;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.pricing.PricingProperties;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Concentrated-liquidity pools from a V3 factory. TVL is twice the quote-side virtual reserve at
 * the current price, which ignores out-of-range positions.
 */
public class UniswapV3Venue extends EvmPoolVenue {
  public UniswapV3Venue(
      JsonRpcClient rpcClient,
      LedgerProperties ledgerProperties,
      PricingProperties pricingProperties,
      MarketPriceOracle oracle) {
    super(rpcClient, ledgerProperties, pricingProperties, oracle);
  }

  @Override
  public String name() {
    return "uniswap-v3";
  }

  @Override
  public boolean supports(Chain chain) {
    return super.supports(chain) && !venues(chain).orElseThrow().getV3Factory().isBlank();
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
      for (Integer fee : config.getV3FeeTiers()) {
        String calldata =
            AbiWords.encodeCall(
                EvmSelectors.GET_POOL, tokenAddress, quote.address(), BigInteger.valueOf(fee));
        String pool = call(chain, config.getV3Factory(), calldata).address(0);
        if (AbiWords.isZeroAddress(pool)) {
          continue;
        }
        candidate(chain, pool, tokenAddress, tokenDecimals, quote).ifPresent(pools::add);
      }
    }
    return pools;
  }

  private Optional<PoolCandidate> candidate(
      Chain chain, String pool, String tokenAddress, int tokenDecimals, QuoteAsset quote) {
    BigInteger sqrtPriceX96 = call(chain, pool, AbiWords.encodeCall(EvmSelectors.SLOT0)).uint(0);
    BigInteger liquidity = call(chain, pool, AbiWords.encodeCall(EvmSelectors.LIQUIDITY)).uint(0);
    if (sqrtPriceX96.signum() == 0 || liquidity.signum() == 0) {
      return Optional.empty();
    }
    String token0 = call(chain, pool, AbiWords.encodeCall(EvmSelectors.TOKEN0)).address(0);
    boolean tokenIsToken0 = sameAddress(token0, tokenAddress);
    int decimals0 = tokenIsToken0 ? tokenDecimals : quote.decimals();
    int decimals1 = tokenIsToken0 ? quote.decimals() : tokenDecimals;

    BigDecimal price0In1 = PoolPriceMath.sqrtPriceToPrice0In1(sqrtPriceX96, decimals0, decimals1);
    BigDecimal priceInQuote = tokenIsToken0 ? price0In1 : PoolPriceMath.inverse(price0In1);
    BigDecimal quoteReserve =
        tokenIsToken0
            ? PoolPriceMath.virtualReserve1(liquidity, sqrtPriceX96, decimals1)
            : PoolPriceMath.virtualReserve0(liquidity, sqrtPriceX96, decimals0);
    return Optional.of(
        new PoolCandidate(
            name(),
            pool,
            quote.label(),
            PoolPriceMath.twoSidedTvl(quoteReserve, quote.usdPrice()),
            priceInQuote.multiply(quote.usdPrice(), PoolPriceMath.MATH)));
  }
}
