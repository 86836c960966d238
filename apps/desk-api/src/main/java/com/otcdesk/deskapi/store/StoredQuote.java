package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Quote;
import java.util.Objects;

public record StoredQuote(Quote quote, long version) {
  public StoredQuote {
    Objects.requireNonNull(quote, "quote must not be null");
  }
}
