package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.queries.DealQueryService;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.ConsignmentStatus;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/consignments")
public class ConsignmentController {
  private final DealQueryService dealQueryService;

  public ConsignmentController(DealQueryService dealQueryService) {
    this.dealQueryService = dealQueryService;
  }

  @GetMapping("/{chain}/{consignmentId}")
  public ResponseEntity<ConsignmentResponse> getConsignment(
      @PathVariable("chain") String chain, @PathVariable("consignmentId") String consignmentId) {
    return ResponseEntity.ok(
        ConsignmentResponse.from(
            dealQueryService.findConsignment(Chain.fromId(chain), consignmentId)));
  }

  @GetMapping
  public ResponseEntity<ConsignmentsResponse> listConsignments(
      @RequestParam(name = "chain", required = false) String chain,
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "consigner", required = false) String consigner,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    int clampedLimit = Math.min(Math.max(limit, 1), 100);
    List<ConsignmentResponse> consignments =
        dealQueryService
            .listConsignments(
                chain != null ? Chain.fromId(chain) : null,
                status != null ? ConsignmentStatus.valueOf(status.toUpperCase(Locale.ROOT)) : null,
                consigner,
                clampedLimit)
            .stream()
            .map(ConsignmentResponse::from)
            .toList();
    return ResponseEntity.ok(new ConsignmentsResponse(consignments, clampedLimit));
  }
}
