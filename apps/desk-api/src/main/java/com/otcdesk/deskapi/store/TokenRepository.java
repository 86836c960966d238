package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Token;
import java.util.List;
import java.util.Optional;

public interface TokenRepository {
  void upsert(Token token);

  Optional<Token> find(Chain chain, String ledgerTokenId);

  List<Token> findByChain(Chain chain);
}
