package com.otcdesk.deskapi.health;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.ledger.LedgerAdapterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports the latest block or slot height per configured chain. Any unreachable chain is DOWN. */
@Component("ledger")
public class LedgerHealthIndicator implements HealthIndicator {
  private static final Logger log = LoggerFactory.getLogger(LedgerHealthIndicator.class);

  private final LedgerAdapterRegistry ledgerAdapterRegistry;
  private final ConfiguredChains configuredChains;

  public LedgerHealthIndicator(
      LedgerAdapterRegistry ledgerAdapterRegistry, ConfiguredChains configuredChains) {
    this.ledgerAdapterRegistry = ledgerAdapterRegistry;
    this.configuredChains = configuredChains;
  }

  @Override
  public Health health() {
    Map<String, Object> details = new LinkedHashMap<>();
    boolean allReachable = true;
    for (Chain chain : configuredChains.chains()) {
      if (!ledgerAdapterRegistry.supports(chain)) {
        details.put(chain.id(), "no adapter");
        allReachable = false;
        continue;
      }
      try {
        details.put(chain.id(), ledgerAdapterRegistry.forChain(chain).latestHeight(chain));
      } catch (RuntimeException ex) {
        log.warn("Ledger health check failed chain={} error={}", chain.id(), ex.getMessage());
        details.put(chain.id(), "unreachable: " + ex.getMessage());
        allReachable = false;
      }
    }
    Health.Builder builder = allReachable ? Health.up() : Health.down();
    return builder.withDetails(details).build();
  }
}
