package com.otcdesk.integration.pricing;

/** What a price check reports when the oracle has no price for the token. */
public enum PriceProtectionPolicy {
  /** Allow the price unchecked. */
  FAIL_OPEN,
  /** Report the price as invalid. */
  FAIL_CLOSED
}
