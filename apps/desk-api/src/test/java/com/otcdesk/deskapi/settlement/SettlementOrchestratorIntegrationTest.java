package com.otcdesk.deskapi.settlement;

import static com.otcdesk.deskapi.support.DealFixtures.CHAIN;
import static com.otcdesk.deskapi.support.DealFixtures.TOKEN_ADDRESS;
import static com.otcdesk.deskapi.support.DealFixtures.tokens;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.deskapi.store.JdbcConsignmentStore;
import com.otcdesk.deskapi.store.JdbcOfferStore;
import com.otcdesk.deskapi.store.JdbcOutboxAppendRepository;
import com.otcdesk.deskapi.store.JdbcQuoteStore;
import com.otcdesk.deskapi.store.JdbcTokenRepository;
import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.deskapi.support.DealFixtures;
import com.otcdesk.deskapi.support.FakeLedgerAdapter;
import com.otcdesk.domain.deals.InfrastructureException;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.OfferStatus;
import com.otcdesk.domain.deals.PriceDivergenceException;
import com.otcdesk.domain.deals.Quote;
import com.otcdesk.domain.deals.QuoteStatus;
import com.otcdesk.domain.deals.SettlementWindowExpiredException;
import com.otcdesk.infra.retry.RetryPolicy;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.ConfirmationStatus;
import com.otcdesk.integration.ledger.LedgerAdapterRegistry;
import com.otcdesk.integration.pricing.PriceProtectionService;
import com.otcdesk.integration.pricing.PricingProperties;
import com.otcdesk.integration.pricing.oracle.MarketPriceOracle;
import com.otcdesk.testsupport.containers.PostgresContainerBase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class SettlementOrchestratorIntegrationTest extends PostgresContainerBase {
  /** 10000 tokens at $0.05 less 10%, in six-decimal stable units. */
  private static final BigInteger EXPECTED_PAYMENT = BigInteger.valueOf(450_000_000L);

  private JdbcTemplate jdbcTemplate;
  private JdbcOfferStore offerStore;
  private JdbcConsignmentStore consignmentStore;
  private JdbcQuoteStore quoteStore;
  private FakeLedgerAdapter ledger;
  private MarketPriceOracle oracle;
  private SimpleMeterRegistry meterRegistry;
  private SettlementOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    DataSource dataSource = migratedDataSource();
    jdbcTemplate = new JdbcTemplate(dataSource);
    offerStore = new JdbcOfferStore(jdbcTemplate);
    consignmentStore = new JdbcConsignmentStore(jdbcTemplate);
    quoteStore = new JdbcQuoteStore(jdbcTemplate);
    JdbcTokenRepository tokenRepository = new JdbcTokenRepository(jdbcTemplate);
    tokenRepository.upsert(DealFixtures.token());

    Clock clock = Clock.systemUTC();
    meterRegistry = new SimpleMeterRegistry();
    ledger = new FakeLedgerAdapter();
    ledger.putConsignment(DealFixtures.consignment(50_000, 50_000, 1_000, 3_600));

    oracle = mock(MarketPriceOracle.class);
    when(oracle.usdPrice(CHAIN, TOKEN_ADDRESS)).thenReturn(Optional.of(new BigDecimal("0.05")));

    SettlementProperties properties = new SettlementProperties();
    properties.setClaimPollIntervalMs(10);
    properties.setClaimWaitTimeoutMs(10_000);

    JdbcOutboxAppendRepository outbox =
        new JdbcOutboxAppendRepository(jdbcTemplate, new ObjectMapper().findAndRegisterModules());
    SettlementRecorder recorder =
        new SettlementRecorder(offerStore, consignmentStore, quoteStore, outbox, clock);
    AdvisoryLockSubmissionSequencer sequencer =
        new AdvisoryLockSubmissionSequencer(
            jdbcTemplate, new TransactionTemplate(new DataSourceTransactionManager(dataSource)));

    orchestrator =
        new SettlementOrchestrator(
            new LedgerAdapterRegistry(List.of(ledger)),
            offerStore,
            consignmentStore,
            quoteStore,
            tokenRepository,
            new PriceProtectionService(oracle, new PricingProperties(), meterRegistry),
            recorder,
            sequencer,
            retryExecutor("ledger-read"),
            retryExecutor("ledger-submit"),
            properties,
            clock,
            meterRegistry);
  }

  @Test
  void shouldApproveThenPayAndMirrorLedgerConsignment() {
    ledger.createOffer(DealFixtures.offer("1", 10_000, Instant.now().minusSeconds(60)));

    SettlementOutcome outcome = orchestrator.approveAndSettle(CHAIN, "1", null);

    assertEquals(OfferStatus.PAID, outcome.status());
    assertFalse(outcome.pending());
    assertEquals(EXPECTED_PAYMENT, outcome.paymentAmount());
    assertEquals(List.of(EXPECTED_PAYMENT), ledger.paidAmounts());
    assertEquals(1, ledger.approveCalls());
    assertEquals(1, ledger.payCalls());

    assertEquals(
        tokens(40_000),
        consignmentStore.find(CHAIN, "11").orElseThrow().consignment().remainingAmount());
    StoredOffer stored = offerStore.find(CHAIN, "1").orElseThrow();
    assertNull(stored.claim());
    assertEquals(1, outboxCount("OfferApproved"));
    assertEquals(1, outboxCount("OfferPaid"));
  }

  @Test
  void shouldTakeLedgerBalanceWhenLocalConsignmentPredatesOffer() {
    consignmentStore.insertIfAbsent(ledger.consignment("11"));
    ledger.createOffer(DealFixtures.offer("13", 10_000, Instant.now().minusSeconds(60)));

    orchestrator.approveAndSettle(CHAIN, "13", null);

    assertEquals(tokens(40_000), ledger.consignment("11").remainingAmount());
    assertEquals(
        tokens(40_000),
        consignmentStore.find(CHAIN, "11").orElseThrow().consignment().remainingAmount());
  }

  @Test
  void shouldReturnStoredOutcomeWhenAlreadySettled() {
    ledger.createOffer(DealFixtures.offer("2", 10_000, Instant.now().minusSeconds(60)));
    SettlementOutcome first = orchestrator.approveAndSettle(CHAIN, "2", null);

    SettlementOutcome second = orchestrator.approveAndSettle(CHAIN, "2", null);

    assertEquals(first.status(), second.status());
    assertEquals(first.paymentAmount(), second.paymentAmount());
    assertEquals(first.lastTxHash(), second.lastTxHash());
    assertEquals(1, ledger.payCalls());
    assertEquals(
        tokens(40_000),
        consignmentStore.find(CHAIN, "11").orElseThrow().consignment().remainingAmount());
    assertEquals(1, outboxCount("OfferPaid"));
  }

  @Test
  void shouldSubmitPaymentOnceForConcurrentRequests() throws Exception {
    ledger.createOffer(DealFixtures.offer("3", 10_000, Instant.now().minusSeconds(60)));
    ledger.delayWrites(150);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      Future<SettlementOutcome> first =
          executor.submit(
              () -> {
                start.await();
                return orchestrator.approveAndSettle(CHAIN, "3", null);
              });
      Future<SettlementOutcome> second =
          executor.submit(
              () -> {
                start.await();
                return orchestrator.approveAndSettle(CHAIN, "3", null);
              });
      start.countDown();

      SettlementOutcome a = first.get(30, TimeUnit.SECONDS);
      SettlementOutcome b = second.get(30, TimeUnit.SECONDS);

      assertEquals(OfferStatus.PAID, a.status());
      assertEquals(OfferStatus.PAID, b.status());
      assertEquals(a.lastTxHash(), b.lastTxHash());
      assertEquals(EXPECTED_PAYMENT, b.paymentAmount());
    } finally {
      executor.shutdownNow();
    }
    assertEquals(1, ledger.approveCalls());
    assertEquals(1, ledger.payCalls());
    assertEquals(
        tokens(40_000),
        consignmentStore.find(CHAIN, "11").orElseThrow().consignment().remainingAmount());
  }

  @Test
  void shouldRejectAndRecordReasonWhenPriceDiverges() {
    ledger.putOffer(DealFixtures.offer("4", 10_000, Instant.now().minusSeconds(60)));
    when(oracle.usdPrice(CHAIN, TOKEN_ADDRESS)).thenReturn(Optional.of(new BigDecimal("0.10")));

    PriceDivergenceException ex =
        assertThrows(
            PriceDivergenceException.class,
            () -> orchestrator.approveAndSettle(CHAIN, "4", null));

    assertEquals(0, new BigDecimal("0.10").compareTo(ex.aggregatedPrice()));
    assertEquals(0, ledger.payCalls());
    StoredOffer stored = offerStore.find(CHAIN, "4").orElseThrow();
    assertEquals(SettlementOrchestrator.REJECTION_PRICE_DIVERGENCE, stored.lastRejection());
    assertNotNull(stored.lastRejectionDetail());
    assertNull(stored.claim());
    assertFalse(stored.flags().paid());
    assertEquals(1, outboxCount("SettlementRejected"));
    assertEquals(
        tokens(50_000),
        consignmentStore.find(CHAIN, "11").orElseThrow().consignment().remainingAmount());
  }

  @Test
  void shouldRefuseSettlementAfterWindowExpires() {
    ledger.putOffer(DealFixtures.offer("5", 10_000, Instant.now().minusSeconds(7_200)));

    assertThrows(
        SettlementWindowExpiredException.class,
        () -> orchestrator.approveAndSettle(CHAIN, "5", null));

    assertEquals(0, ledger.approveCalls());
    assertEquals(0, ledger.payCalls());
    assertNull(offerStore.find(CHAIN, "5").orElseThrow().claim());
  }

  @Test
  void shouldSurfaceRevertWithoutRecordingApproval() {
    ledger.putOffer(DealFixtures.offer("6", 10_000, Instant.now().minusSeconds(60)));
    ledger.confirmWith(ConfirmationStatus.FAILED);

    ChainException ex =
        assertThrows(
            ChainException.class, () -> orchestrator.approveAndSettle(CHAIN, "6", null));

    assertFalse(ex.isTransient());
    StoredOffer stored = offerStore.find(CHAIN, "6").orElseThrow();
    assertFalse(stored.flags().approved());
    assertNull(stored.claim());
    assertEquals(0, outboxCount("OfferApproved"));
  }

  @Test
  void shouldReportInfrastructureFailureWhenRetriesRunOut() {
    ledger.putOffer(DealFixtures.offer("7", 10_000, Instant.now().minusSeconds(60)));
    ledger.failWritesTransiently(10);

    assertThrows(
        InfrastructureException.class, () -> orchestrator.approveAndSettle(CHAIN, "7", null));

    assertEquals(3, ledger.approveCalls());
    StoredOffer stored = offerStore.find(CHAIN, "7").orElseThrow();
    assertEquals(OfferStatus.CREATED, stored.offer().status());
    assertNull(stored.claim());
  }

  @Test
  void shouldNotResubmitWhenLedgerAlreadyReflectsLostWrite() {
    ledger.putOffer(DealFixtures.offer("8", 10_000, Instant.now().minusSeconds(60)));
    ledger.loseNextWriteResponse();

    SettlementOutcome outcome = orchestrator.approveAndSettle(CHAIN, "8", null);

    assertEquals(OfferStatus.PAID, outcome.status());
    assertEquals(1, ledger.approveCalls());
    assertEquals(1, ledger.payCalls());
  }

  @Test
  void shouldKeepClaimWhileConfirmationIsPending() {
    ledger.putOffer(DealFixtures.offer("9", 10_000, Instant.now().minusSeconds(60)));
    ledger.confirmWith(ConfirmationStatus.PENDING);

    SettlementOutcome outcome = orchestrator.approveAndSettle(CHAIN, "9", null);

    assertTrue(outcome.pending());
    StoredOffer stored = offerStore.find(CHAIN, "9").orElseThrow();
    assertNotNull(stored.claim());
    assertNotNull(stored.claim().pendingTxHash());
    assertEquals(0, ledger.payCalls());
  }

  @Test
  void shouldPriceFromQuoteWhenLedgerHasNoSnapshot() {
    Instant now = Instant.now();
    quoteStore.insert(
        new Quote(
            "q-1",
            CHAIN,
            DealFixtures.BENEFICIARY,
            DealFixtures.TOKEN_ID,
            1_000,
            0,
            new BigDecimal("0.05"),
            now.plusSeconds(600),
            QuoteStatus.PENDING,
            null,
            now));
    ledger.putOffer(
        DealFixtures.offer("10", 10_000, now.minusSeconds(60), BigInteger.ZERO, OfferFlags.NONE));

    SettlementOutcome outcome = orchestrator.approveAndSettle(CHAIN, "10", "q-1");

    assertEquals(OfferStatus.PAID, outcome.status());
    assertEquals("q-1", outcome.quoteId());
    assertEquals(EXPECTED_PAYMENT, outcome.paymentAmount());
    Quote quote = quoteStore.find("q-1").orElseThrow().quote();
    assertEquals(QuoteStatus.EXECUTED, quote.status());
    assertEquals("10", quote.offerId());
  }

  @Test
  void shouldCancelOnlyOnce() {
    ledger.putOffer(DealFixtures.offer("12", 10_000, Instant.now().minusSeconds(60)));

    SettlementOutcome first = orchestrator.cancel(CHAIN, "12");
    SettlementOutcome second = orchestrator.cancel(CHAIN, "12");

    assertEquals(OfferStatus.CANCELLED, first.status());
    assertEquals(OfferStatus.CANCELLED, second.status());
    assertEquals(1, ledger.cancelCalls());
    assertEquals(1, outboxCount("OfferCancelled"));
    assertTrue(offerStore.find(CHAIN, "12").orElseThrow().flags().cancelled());
    assertEquals(0, ledger.payCalls());
  }

  private TransientRetryExecutor retryExecutor(String name) {
    return new TransientRetryExecutor(
        name, RetryPolicy.of(3, 0, 0, false), ChainException::isTransient, meterRegistry);
  }

  private int outboxCount(String eventType) {
    Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE event_type = ?", Integer.class, eventType);
    return count == null ? 0 : count;
  }
}
