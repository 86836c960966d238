package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.queries.DealQueryService;
import com.otcdesk.deskapi.settlement.SettlementOrchestrator;
import com.otcdesk.deskapi.settlement.SettlementOutcome;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.OfferStatus;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/offers")
public class OfferController {
  private final SettlementOrchestrator settlementOrchestrator;
  private final DealQueryService dealQueryService;

  public OfferController(
      SettlementOrchestrator settlementOrchestrator, DealQueryService dealQueryService) {
    this.settlementOrchestrator = settlementOrchestrator;
    this.dealQueryService = dealQueryService;
  }

  @PostMapping("/{chain}/{offerId}/approve")
  public ResponseEntity<SettlementResponse> approve(
      @PathVariable("chain") String chain,
      @PathVariable("offerId") String offerId,
      @Valid @RequestBody(required = false) ApproveOfferRequest request) {
    String quoteId = request != null ? request.quoteId() : null;
    SettlementOutcome outcome =
        settlementOrchestrator.approveAndSettle(Chain.fromId(chain), offerId, quoteId);
    return respond(outcome);
  }

  @PostMapping("/{chain}/{offerId}/cancel")
  public ResponseEntity<SettlementResponse> cancel(
      @PathVariable("chain") String chain, @PathVariable("offerId") String offerId) {
    return respond(settlementOrchestrator.cancel(Chain.fromId(chain), offerId));
  }

  @GetMapping("/{chain}/{offerId}")
  public ResponseEntity<OfferResponse> getOffer(
      @PathVariable("chain") String chain, @PathVariable("offerId") String offerId) {
    return ResponseEntity.ok(
        OfferResponse.from(dealQueryService.findOffer(Chain.fromId(chain), offerId)));
  }

  @GetMapping
  public ResponseEntity<OffersResponse> listOffers(
      @RequestParam(name = "chain", required = false) String chain,
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "beneficiary", required = false) String beneficiary,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    int clampedLimit = Math.min(Math.max(limit, 1), 100);
    List<OfferResponse> offers =
        dealQueryService
            .listOffers(
                chain != null ? Chain.fromId(chain) : null,
                status != null ? OfferStatus.valueOf(status.toUpperCase(Locale.ROOT)) : null,
                beneficiary,
                clampedLimit)
            .stream()
            .map(OfferResponse::from)
            .toList();
    return ResponseEntity.ok(new OffersResponse(offers, clampedLimit));
  }

  // A submitted but unconfirmed transaction is reported as 202 so callers poll the offer.
  private static ResponseEntity<SettlementResponse> respond(SettlementOutcome outcome) {
    HttpStatus status = outcome.pending() ? HttpStatus.ACCEPTED : HttpStatus.OK;
    return ResponseEntity.status(status).body(SettlementResponse.from(outcome));
  }
}
