package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.reconciliation.DealReconciliationService;
import com.otcdesk.deskapi.reconciliation.RecordRef;
import com.otcdesk.domain.deals.Chain;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reconciliation")
public class ReconciliationController {
  private final DealReconciliationService dealReconciliationService;

  public ReconciliationController(DealReconciliationService dealReconciliationService) {
    this.dealReconciliationService = dealReconciliationService;
  }

  @PostMapping("/offers/{chain}/{offerId}")
  public ResponseEntity<ReconciliationOutcomeResponse> reconcileOffer(
      @PathVariable("chain") String chain, @PathVariable("offerId") String offerId) {
    return reconcile(RecordRef.offer(Chain.fromId(chain), offerId));
  }

  @PostMapping("/consignments/{chain}/{consignmentId}")
  public ResponseEntity<ReconciliationOutcomeResponse> reconcileConsignment(
      @PathVariable("chain") String chain, @PathVariable("consignmentId") String consignmentId) {
    return reconcile(RecordRef.consignment(Chain.fromId(chain), consignmentId));
  }

  @PostMapping("/quotes/{quoteId}")
  public ResponseEntity<ReconciliationOutcomeResponse> reconcileQuote(
      @PathVariable("quoteId") String quoteId) {
    return reconcile(RecordRef.quote(quoteId));
  }

  @PostMapping("/active")
  public ResponseEntity<ReconciliationReportResponse> reconcileActive() {
    return ResponseEntity.ok(
        ReconciliationReportResponse.from(dealReconciliationService.reconcileAllActive()));
  }

  private ResponseEntity<ReconciliationOutcomeResponse> reconcile(RecordRef ref) {
    return ResponseEntity.ok(
        ReconciliationOutcomeResponse.from(dealReconciliationService.reconcileOne(ref)));
  }
}
