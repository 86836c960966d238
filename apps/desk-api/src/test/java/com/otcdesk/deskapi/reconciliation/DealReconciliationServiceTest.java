package com.otcdesk.deskapi.reconciliation;

import static com.otcdesk.deskapi.support.DealFixtures.CHAIN;
import static com.otcdesk.deskapi.support.DealFixtures.CONSIGNMENT_ID;
import static com.otcdesk.deskapi.support.DealFixtures.tokens;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.otcdesk.deskapi.store.ConditionalWrite;
import com.otcdesk.deskapi.store.ConsignmentStore;
import com.otcdesk.deskapi.store.OfferStore;
import com.otcdesk.deskapi.store.QuoteStore;
import com.otcdesk.deskapi.store.StoredConsignment;
import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.deskapi.support.DealFixtures;
import com.otcdesk.deskapi.support.FakeLedgerAdapter;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.infra.retry.RetryPolicy;
import com.otcdesk.infra.retry.TransientRetryExecutor;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.LedgerAdapterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DealReconciliationServiceTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final OfferFlags APPROVED = new OfferFlags(true, false, false, false);
  private static final OfferFlags PAID = new OfferFlags(true, true, false, false);

  private OfferStore offerStore;
  private ConsignmentStore consignmentStore;
  private ReconciliationWriter writer;
  private ReconciliationReporter reporter;
  private FakeLedgerAdapter ledger;
  private SimpleMeterRegistry meterRegistry;
  private DealReconciliationService service;

  @BeforeEach
  void setUp() {
    offerStore = mock(OfferStore.class);
    consignmentStore = mock(ConsignmentStore.class);
    writer = mock(ReconciliationWriter.class);
    reporter = mock(ReconciliationReporter.class);
    ledger = new FakeLedgerAdapter();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DealReconciliationService(
            new LedgerAdapterRegistry(List.of(ledger)),
            offerStore,
            consignmentStore,
            mock(QuoteStore.class),
            writer,
            reporter,
            new TransientRetryExecutor(
                "ledger-read", RetryPolicy.noRetry(), ChainException::isTransient, meterRegistry),
            new ReconciliationProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC),
            meterRegistry);
  }

  @Test
  void shouldMakeNoCorrectionOnSecondPass() {
    StoredOffer created = stored(offer("1", OfferFlags.NONE), 1L);
    StoredOffer approved = stored(offer("1", APPROVED), 2L);
    ledger.putOffer(offer("1", APPROVED));
    when(offerStore.find(CHAIN, "1"))
        .thenReturn(Optional.of(created))
        .thenReturn(Optional.of(approved));
    when(writer.applyOfferFlags(created, APPROVED)).thenReturn(ConditionalWrite.APPLIED);

    ReconciliationOutcome first = service.reconcileOne(RecordRef.offer(CHAIN, "1"));
    ReconciliationOutcome second = service.reconcileOne(RecordRef.offer(CHAIN, "1"));

    assertTrue(first.corrected());
    assertFalse(second.corrected());
    assertEquals("APPROVED", second.localStatus());
    verify(writer, times(1)).applyOfferFlags(any(), any());
  }

  @Test
  void shouldNotClearLocalFlagWhenLedgerLags() {
    ledger.putOffer(offer("2", APPROVED));
    when(offerStore.find(CHAIN, "2")).thenReturn(Optional.of(stored(offer("2", PAID), 5L)));

    ReconciliationOutcome outcome = service.reconcileOne(RecordRef.offer(CHAIN, "2"));

    assertFalse(outcome.corrected());
    assertEquals("PAID", outcome.localStatus());
    assertEquals("APPROVED", outcome.ledgerStatus());
    verify(writer, never()).applyOfferFlags(any(), any());
  }

  @Test
  void shouldOverwriteConsignmentBalanceOnceFromLedger() {
    StoredConsignment local =
        new StoredConsignment(DealFixtures.consignment(50_000, 50_000, 0, 0), 1L);
    StoredConsignment refreshed =
        new StoredConsignment(DealFixtures.consignment(50_000, 40_000, 0, 0), 2L);
    ledger.putConsignment(DealFixtures.consignment(50_000, 40_000, 0, 0));
    when(consignmentStore.find(CHAIN, CONSIGNMENT_ID))
        .thenReturn(Optional.of(local))
        .thenReturn(Optional.of(refreshed));
    when(writer.applyConsignmentState(local, tokens(40_000), ConsignmentStatus.ACTIVE))
        .thenReturn(ConditionalWrite.APPLIED);

    RecordRef ref = RecordRef.consignment(CHAIN, CONSIGNMENT_ID);
    assertTrue(service.reconcileOne(ref).corrected());
    assertFalse(service.reconcileOne(ref).corrected());

    verify(writer, times(1)).applyConsignmentState(any(), any(), any());
  }

  @Test
  void shouldContinueBatchAfterFailingRecord() {
    StoredOffer broken = stored(offer("3", OfferFlags.NONE), 1L);
    StoredOffer healthy = stored(offer("4", OfferFlags.NONE), 1L);
    when(offerStore.findActive(500)).thenReturn(List.of(broken, healthy));
    when(offerStore.find(CHAIN, "3")).thenThrow(new IllegalStateException("connection reset"));
    when(offerStore.find(CHAIN, "4")).thenReturn(Optional.of(healthy));
    ledger.putOffer(offer("4", APPROVED));
    when(writer.applyOfferFlags(healthy, APPROVED)).thenReturn(ConditionalWrite.APPLIED);

    ReconciliationReport report = service.reconcileAllActive();

    assertEquals(2, report.total());
    assertEquals(1, report.failed());
    assertEquals(1, report.corrected());
    verify(reporter).report(report);
    verify(writer).applyOfferFlags(eq(healthy), eq(APPROVED));
    assertEquals(
        1.0d,
        meterRegistry
            .get("desk.reconciliation.records")
            .tag("type", "offer")
            .tag("result", "failed")
            .counter()
            .count());
  }

  private static Offer offer(String offerId, OfferFlags flags) {
    return DealFixtures.offer(offerId, 100, NOW.minusSeconds(60), DealFixtures.PRICE_8D, flags);
  }

  private static StoredOffer stored(Offer offer, long version) {
    return new StoredOffer(offer, null, null, null, null, null, null, version, NOW);
  }
}
