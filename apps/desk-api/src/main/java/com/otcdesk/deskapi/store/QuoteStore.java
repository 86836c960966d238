package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Quote;
import com.otcdesk.domain.deals.QuoteStatus;
import java.util.List;
import java.util.Optional;

public interface QuoteStore {
  void insert(Quote quote);

  Optional<StoredQuote> find(String quoteId);

  List<StoredQuote> findPending(int limit);

  ConditionalWrite updateStatus(String quoteId, long expectedVersion, QuoteStatus status);

  /** Moves a pending quote to a terminal status; a quote that already left PENDING is kept. */
  ConditionalWrite closePending(String quoteId, QuoteStatus status);

  ConditionalWrite linkOffer(String quoteId, String offerId);
}
