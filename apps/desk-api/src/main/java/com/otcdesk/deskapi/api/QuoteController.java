package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.quotes.PricedQuote;
import com.otcdesk.deskapi.quotes.QuotePricingService;
import com.otcdesk.deskapi.quotes.RegisterQuoteCommand;
import com.otcdesk.domain.deals.Chain;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/quotes")
public class QuoteController {
  private final QuotePricingService quotePricingService;

  public QuoteController(QuotePricingService quotePricingService) {
    this.quotePricingService = quotePricingService;
  }

  @PostMapping
  public ResponseEntity<QuoteResponse> registerQuote(
      @Valid @RequestBody RegisterQuoteRequest request) {
    String quoteId =
        request.quoteId() == null || request.quoteId().isBlank()
            ? UUID.randomUUID().toString()
            : request.quoteId();

    PricedQuote priced =
        quotePricingService.registerQuote(
            new RegisterQuoteCommand(
                quoteId,
                Chain.fromId(request.chain()),
                request.beneficiary(),
                request.tokenId(),
                request.discountBps(),
                request.lockupDays()));

    return ResponseEntity.status(HttpStatus.CREATED).body(QuoteResponse.from(priced));
  }

  @GetMapping("/{quoteId}")
  public ResponseEntity<QuoteResponse> getQuote(@PathVariable("quoteId") String quoteId) {
    return ResponseEntity.ok(QuoteResponse.from(quotePricingService.findQuote(quoteId).quote()));
  }
}
