package com.otcdesk.domain.deals;

public class DealDomainException extends RuntimeException {
  public DealDomainException(String message) {
    super(message);
  }

  public DealDomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
