package com.otcdesk.deskapi.reconciliation;

public enum RecordType {
  OFFER,
  CONSIGNMENT,
  QUOTE
}
