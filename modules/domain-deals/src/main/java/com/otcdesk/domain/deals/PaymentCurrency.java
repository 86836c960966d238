package com.otcdesk.domain.deals;

public enum PaymentCurrency {
  NATIVE(0),
  STABLE(1);

  private final int ledgerCode;

  PaymentCurrency(int ledgerCode) {
    this.ledgerCode = ledgerCode;
  }

  public int ledgerCode() {
    return ledgerCode;
  }

  public static PaymentCurrency fromLedgerCode(int code) {
    for (PaymentCurrency currency : values()) {
      if (currency.ledgerCode == code) {
        return currency;
      }
    }
    throw new DealValidationException("Unknown payment currency code: " + code);
  }
}
