package com.otcdesk.deskapi.config;

import com.otcdesk.deskapi.reconciliation.DealReconciliationService;
import com.otcdesk.deskapi.reconciliation.ReconciliationProperties;
import com.otcdesk.deskapi.reconciliation.ReconciliationReporter;
import com.otcdesk.deskapi.reconciliation.ReconciliationWriter;
import com.otcdesk.deskapi.settlement.SettlementOrchestrator;
import com.otcdesk.deskapi.settlement.SettlementProperties;
import com.otcdesk.deskapi.settlement.SettlementRecorder;
import com.otcdesk.deskapi.settlement.SubmissionSequencer;
import com.otcdesk.deskapi.store.ConsignmentStore;
import com.otcdesk.deskapi.store.OfferStore;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.TokenRepository;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.ledger.LedgerAdapterRegistry;
import com.otcdesk.integration.pricing.PriceProtectionService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SettlementConfiguration {

  @Bean
  public SettlementOrchestrator settlementOrchestrator(
      LedgerAdapterRegistry ledgerAdapterRegistry,
      OfferStore offerStore,
      ConsignmentStore consignmentStore,
      QuoteStore quoteStore,
      TokenRepository tokenRepository,
      PriceProtectionService priceProtectionService,
      SettlementRecorder settlementRecorder,
      SubmissionSequencer submissionSequencer,
      TransientRetryExecutor ledgerReadRetryExecutor,
      TransientRetryExecutor ledgerSubmitRetryExecutor,
      SettlementProperties settlementProperties,
      Clock deskClock,
      MeterRegistry meterRegistry) {
    return new SettlementOrchestrator(
        ledgerAdapterRegistry,
        offerStore,
        consignmentStore,
        quoteStore,
        tokenRepository,
        priceProtectionService,
        settlementRecorder,
        submissionSequencer,
        ledgerReadRetryExecutor,
        ledgerSubmitRetryExecutor,
        settlementProperties,
        deskClock,
        meterRegistry);
  }

  @Bean
  public DealReconciliationService dealReconciliationService(
      LedgerAdapterRegistry ledgerAdapterRegistry,
      OfferStore offerStore,
      ConsignmentStore consignmentStore,
      QuoteStore quoteStore,
      ReconciliationWriter reconciliationWriter,
      ReconciliationReporter reconciliationReporter,
      TransientRetryExecutor ledgerReadRetryExecutor,
      ReconciliationProperties reconciliationProperties,
      Clock deskClock,
      MeterRegistry meterRegistry) {
    return new DealReconciliationService(
        ledgerAdapterRegistry,
        offerStore,
        consignmentStore,
        quoteStore,
        reconciliationWriter,
        reconciliationReporter,
        ledgerReadRetryExecutor,
        reconciliationProperties,
        deskClock,
        meterRegistry);
  }
}
