package com.otcdesk.deskapi.reconciliation;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.DealValidationException;
import java.util.Objects;

/** Identifies one reconcilable record. Quotes are keyed by id alone, so {@code chain} is null. */
public record RecordRef(RecordType type, Chain chain, String id) {
  public RecordRef {
    Objects.requireNonNull(type, "type must not be null");
    if (id == null || id.isBlank()) {
      throw new DealValidationException("record id must not be blank");
    }
    if (type != RecordType.QUOTE && chain == null) {
      throw new DealValidationException(type + " reference requires a chain");
    }
  }

  public static RecordRef offer(Chain chain, String offerId) {
    return new RecordRef(RecordType.OFFER, chain, offerId);
  }

  public static RecordRef consignment(Chain chain, String consignmentId) {
    return new RecordRef(RecordType.CONSIGNMENT, chain, consignmentId);
  }

  public static RecordRef quote(String quoteId) {
    return new RecordRef(RecordType.QUOTE, null, quoteId);
  }

  @Override
  public String toString() {
    return chain == null ? type + ":" + id : type + ":" + chain.id() + ":" + id;
  }
}
