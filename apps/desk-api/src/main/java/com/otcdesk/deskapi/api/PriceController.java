package com.otcdesk.deskapi.api;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.DealNotFoundException;
import com.otcdesk.integration.pricing.PriceCheckResult;
import com.otcdesk.integration.pricing.PriceProtectionService;
import com.otcdesk.integration.pricing.pool.PoolCandidate;
import com.otcdesk.integration.pricing.pool.PoolPriceDiscovery;
import java.math.BigDecimal;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Pricing diagnostics. {@code token} is the token's contract address on the given chain. */
@RestController
@RequestMapping("/v1/prices")
public class PriceController {
  private final PoolPriceDiscovery poolPriceDiscovery;
  private final PriceProtectionService priceProtectionService;

  public PriceController(
      PoolPriceDiscovery poolPriceDiscovery, PriceProtectionService priceProtectionService) {
    this.poolPriceDiscovery = poolPriceDiscovery;
    this.priceProtectionService = priceProtectionService;
  }

  @GetMapping("/pool")
  public ResponseEntity<PoolPriceResponse> bestPool(
      @RequestParam("chain") String chain, @RequestParam("token") String token) {
    Chain resolved = Chain.fromId(chain);
    PoolCandidate pool =
        poolPriceDiscovery
            .findBestPool(token, resolved)
            .orElseThrow(() -> new DealNotFoundException("Pool", resolved.id() + ":" + token));
    return ResponseEntity.ok(PoolPriceResponse.from(resolved.id(), token, pool));
  }

  @GetMapping("/check")
  public ResponseEntity<PriceCheckResponse> checkPrice(
      @RequestParam("chain") String chain,
      @RequestParam("token") String token,
      @RequestParam("price") BigDecimal price,
      @RequestParam(name = "thresholdPercent", required = false) BigDecimal thresholdPercent) {
    Chain resolved = Chain.fromId(chain);
    PriceCheckResult result =
        priceProtectionService.checkPriceDivergence(token, resolved, price, thresholdPercent);
    return ResponseEntity.ok(PriceCheckResponse.from(resolved.id(), token, price, result));
  }
}
