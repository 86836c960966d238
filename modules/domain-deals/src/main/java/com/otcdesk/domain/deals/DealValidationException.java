package com.otcdesk.domain.deals;

public class DealValidationException extends DealDomainException {
  public DealValidationException(String message) {
    super(message);
  }
}
