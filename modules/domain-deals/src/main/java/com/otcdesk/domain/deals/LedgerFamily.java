package com.otcdesk.domain.deals;

public enum LedgerFamily {
  EVM,
  ALT_LEDGER
}
