package com.otcdesk.domain.deals;

/** A store, oracle or ledger dependency stayed unavailable after retries. */
public class InfrastructureException extends DealDomainException {
  public InfrastructureException(String message) {
    super(message);
  }

  public InfrastructureException(String message, Throwable cause) {
    super(message, cause);
  }
}
