package com.otcdesk.integration.ledger;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.LedgerFamily;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public class LedgerAdapterRegistry {
  private final Map<LedgerFamily, LedgerAdapter> adapters = new EnumMap<>(LedgerFamily.class);

  public LedgerAdapterRegistry(Collection<? extends LedgerAdapter> adapters) {
    for (LedgerAdapter adapter : adapters) {
      LedgerAdapter previous = this.adapters.put(adapter.family(), adapter);
      if (previous != null) {
        throw new IllegalStateException("Duplicate ledger adapter for family " + adapter.family());
      }
    }
  }

  public LedgerAdapter forChain(Chain chain) {
    if (chain == null) {
      throw new DealValidationException("chain must not be null");
    }
    LedgerAdapter adapter = adapters.get(chain.family());
    if (adapter == null) {
      throw new DealValidationException("No ledger adapter configured for chain " + chain.id());
    }
    return adapter;
  }

  public boolean supports(Chain chain) {
    return chain != null && adapters.containsKey(chain.family());
  }
}
