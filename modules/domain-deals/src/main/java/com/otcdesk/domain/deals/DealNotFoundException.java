package com.otcdesk.domain.deals;

public class DealNotFoundException extends DealDomainException {
  private final String recordType;
  private final String recordId;

  public DealNotFoundException(String recordType, String recordId) {
    super(recordType + " not found: " + recordId);
    this.recordType = recordType;
    this.recordId = recordId;
  }

  public String recordType() {
    return recordType;
  }

  public String recordId() {
    return recordId;
  }
}
