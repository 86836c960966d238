package com.otcdesk.deskapi.api;

import com.otcdesk.domain.deals.Token;

public record TokenResponse(
    String chain, String tokenId, String contractAddress, String symbol, int decimals) {

  public static TokenResponse from(Token token) {
    return new TokenResponse(
        token.chain().id(),
        token.ledgerTokenId(),
        token.contractAddress(),
        token.symbol(),
        token.decimals());
  }
}
