package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.queries.DealQueryService;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Token;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Token registry used to resolve ledger token ids to contract addresses and decimals. */
@RestController
@RequestMapping("/v1/tokens")
public class TokenController {
  private final DealQueryService dealQueryService;

  public TokenController(DealQueryService dealQueryService) {
    this.dealQueryService = dealQueryService;
  }

  @PutMapping("/{chain}/{tokenId}")
  public ResponseEntity<TokenResponse> upsertToken(
      @PathVariable("chain") String chain,
      @PathVariable("tokenId") String tokenId,
      @Valid @RequestBody UpsertTokenRequest request) {
    Token token =
        new Token(
            Chain.fromId(chain),
            tokenId,
            request.contractAddress(),
            request.symbol(),
            request.decimals());
    return ResponseEntity.ok(TokenResponse.from(dealQueryService.registerToken(token)));
  }

  @GetMapping("/{chain}/{tokenId}")
  public ResponseEntity<TokenResponse> getToken(
      @PathVariable("chain") String chain, @PathVariable("tokenId") String tokenId) {
    return ResponseEntity.ok(
        TokenResponse.from(dealQueryService.findToken(Chain.fromId(chain), tokenId)));
  }

  @GetMapping("/{chain}")
  public ResponseEntity<List<TokenResponse>> listTokens(@PathVariable("chain") String chain) {
    return ResponseEntity.ok(
        dealQueryService.listTokens(Chain.fromId(chain)).stream()
            .map(TokenResponse::from)
            .toList());
  }
}
