package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.store.StoredConsignment;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.DealTerms;
import java.time.Instant;

public record ConsignmentResponse(
    String chain,
    String consignmentId,
    String tokenId,
    String consigner,
    String totalAmount,
    String remainingAmount,
    String status,
    boolean negotiable,
    boolean fractionalized,
    boolean privateListing,
    int maxPriceVolatilityBps,
    long maxTimeToExecuteSeconds,
    Instant createdAt) {

  public static ConsignmentResponse from(StoredConsignment stored) {
    Consignment consignment = stored.consignment();
    DealTerms terms = consignment.terms();
    return new ConsignmentResponse(
        consignment.chain().id(),
        consignment.id(),
        consignment.tokenId(),
        consignment.consigner(),
        consignment.totalAmount().toString(),
        consignment.remainingAmount().toString(),
        consignment.status().name(),
        terms.negotiable(),
        consignment.fractionalized(),
        consignment.privateListing(),
        terms.maxPriceVolatilityBps(),
        terms.maxTimeToExecuteSeconds(),
        consignment.createdAt());
  }
}
