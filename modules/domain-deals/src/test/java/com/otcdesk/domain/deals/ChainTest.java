package com.otcdesk.domain.deals;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ChainTest {
  @Test
  void shouldResolveChainsCaseInsensitively() {
    assertEquals(Chain.BASE, Chain.fromId("base"));
    assertEquals(Chain.SOLANA, Chain.fromId(" SOLANA "));
    assertEquals(LedgerFamily.ALT_LEDGER, Chain.SOLANA.family());
    assertEquals(LedgerFamily.EVM, Chain.BSC.family());
  }

  @Test
  void shouldRejectUnknownChain() {
    assertThrows(DealValidationException.class, () -> Chain.fromId("dogechain"));
    assertThrows(DealValidationException.class, () -> Chain.fromId(" "));
  }
}
