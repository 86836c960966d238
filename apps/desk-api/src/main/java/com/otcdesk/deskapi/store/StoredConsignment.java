package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Consignment;
import java.util.Objects;

public record StoredConsignment(Consignment consignment, long version) {
  public StoredConsignment {
    Objects.requireNonNull(consignment, "consignment must not be null");
  }
}
