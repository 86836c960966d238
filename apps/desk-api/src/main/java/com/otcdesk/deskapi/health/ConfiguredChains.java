package com.otcdesk.deskapi.health;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.integration.ledger.LedgerProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Chains with ledger connectivity configured: every EVM key plus the alt ledger when enabled. */
@Component
public class ConfiguredChains {
  private static final Logger log = LoggerFactory.getLogger(ConfiguredChains.class);

  private final List<Chain> chains;

  public ConfiguredChains(LedgerProperties ledgerProperties) {
    List<Chain> resolved = new ArrayList<>();
    for (String key : ledgerProperties.getEvm().keySet()) {
      try {
        resolved.add(Chain.fromId(key));
      } catch (DealValidationException ex) {
        log.warn("Ignoring unknown EVM chain key={}", key);
      }
    }
    if (ledgerProperties.getAlt().isEnabled()) {
      resolved.add(Chain.SOLANA);
    }
    this.chains = Collections.unmodifiableList(resolved);
  }

  public List<Chain> chains() {
    return chains;
  }
}
