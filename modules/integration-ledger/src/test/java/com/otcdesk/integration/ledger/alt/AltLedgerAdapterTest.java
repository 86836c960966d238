package com.otcdesk.integration.ledger.alt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferStatus;
import com.otcdesk.domain.deals.PaymentCurrency;
import com.otcdesk.integration.ledger.ConfirmationPoller;
import com.otcdesk.integration.ledger.ConfirmationStatus;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.TxRef;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.ledger.signer.RelayTransaction;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class AltLedgerAdapterTest {
  private static final String RPC_URL = "https://alt-rpc.test";
  private static final String PROGRAM_ID = key(1);
  private static final String DESK = key(2);
  private static final String MINT = key(3);
  private static final String BENEFICIARY = key(4);
  private static final String OFFER_ACCOUNT = key(5);

  private MockRestServiceServer server;
  private AltLedgerAdapter adapter;
  private final List<RelayTransaction> submitted = new ArrayList<>();

  @BeforeEach
  void setUp() {
    LedgerProperties properties = new LedgerProperties();
    properties.getAlt().setEnabled(true);
    properties.getAlt().setRpcUrl(RPC_URL);
    properties.getAlt().setProgramId(PROGRAM_ID);
    properties.getAlt().setDeskAddress(DESK);
    properties.getAlt().setSignerAddress(key(6));

    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
    adapter =
        new AltLedgerAdapter(
            properties,
            new JsonRpcClient(builder.build(), new ObjectMapper()),
            transaction -> {
              submitted.add(transaction);
              return new TxRef(transaction.chain(), "5sig");
            },
            new ConfirmationPoller(
                Duration.ofMillis(10), Duration.ofSeconds(5), clock, duration -> {}));
  }

  @Test
  void shouldResolveNumericOfferIdWithProgramAccountScan() {
    server
        .expect(requestTo(RPC_URL))
        .andExpect(jsonPath("$.method").value("getProgramAccounts"))
        .andExpect(jsonPath("$.params[0]").value(PROGRAM_ID))
        .andExpect(jsonPath("$.params[1].filters[1].memcmp.bytes").value(DESK))
        .andExpect(jsonPath("$.params[1].filters[2].memcmp.offset").value(80))
        .andRespond(
            withSuccess(programAccounts(offerAccount(12L, true)), MediaType.APPLICATION_JSON));

    Offer offer = adapter.readOffer(Chain.SOLANA, "12").orElseThrow();

    assertEquals("12", offer.id());
    assertEquals("4", offer.consignmentId());
    assertEquals(MINT, offer.tokenId());
    assertEquals(BENEFICIARY, offer.beneficiary());
    assertEquals(BigInteger.valueOf(1_000_000_000_000L), offer.tokenAmount());
    assertEquals(250, offer.discountBps());
    assertEquals(3_600L, offer.lockupSeconds());
    assertEquals(PaymentCurrency.NATIVE, offer.currency());
    assertEquals(OfferStatus.APPROVED, offer.status());
    server.verify();
  }

  @Test
  void shouldReadOfferByAccountAddress() {
    server
        .expect(jsonPath("$.method").value("getAccountInfo"))
        .andExpect(jsonPath("$.params[0]").value(OFFER_ACCOUNT))
        .andRespond(
            withSuccess(
                accountInfo(PROGRAM_ID, offerAccount(12L, false)), MediaType.APPLICATION_JSON));

    Offer offer = adapter.readOffer(Chain.SOLANA, OFFER_ACCOUNT).orElseThrow();

    assertEquals("12", offer.id());
    assertEquals(OfferStatus.CREATED, offer.status());
  }

  @Test
  void shouldIgnoreAccountsOwnedByAnotherProgram() {
    server
        .expect(jsonPath("$.method").value("getAccountInfo"))
        .andRespond(
            withSuccess(
                accountInfo(key(9), offerAccount(12L, false)), MediaType.APPLICATION_JSON));

    assertFalse(adapter.readOffer(Chain.SOLANA, OFFER_ACCOUNT).isPresent());
  }

  @Test
  void shouldReturnEmptyWhenNoAccountMatches() {
    server
        .expect(jsonPath("$.method").value("getProgramAccounts"))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[]}", MediaType.APPLICATION_JSON));

    assertFalse(adapter.readOffer(Chain.SOLANA, "77").isPresent());
  }

  @Test
  void shouldDecodeConsignmentAccount() {
    server
        .expect(jsonPath("$.method").value("getProgramAccounts"))
        .andExpect(jsonPath("$.params[1].filters[2].memcmp.offset").value(40))
        .andRespond(withSuccess(programAccounts(consignmentAccount()), MediaType.APPLICATION_JSON));

    Consignment consignment = adapter.readConsignment(Chain.SOLANA, "4").orElseThrow();

    assertEquals("4", consignment.id());
    assertEquals(ConsignmentStatus.WITHDRAWN, consignment.status());
    assertEquals(BigInteger.valueOf(400L), consignment.remainingAmount());
    assertEquals(1000, consignment.terms().maxPriceVolatilityBps());
    assertEquals(900L, consignment.terms().maxTimeToExecuteSeconds());
  }

  @Test
  void shouldSubmitInstructionWithResolvedOfferAccount() {
    server
        .expect(jsonPath("$.method").value("getProgramAccounts"))
        .andRespond(
            withSuccess(programAccounts(offerAccount(12L, true)), MediaType.APPLICATION_JSON));

    TxRef ref =
        adapter.payOffer(
            Chain.SOLANA, "12", BigInteger.valueOf(642_857_142_858L), PaymentCurrency.NATIVE);

    assertEquals("5sig", ref.hash());
    RelayTransaction transaction = submitted.get(0);
    assertEquals(PROGRAM_ID, transaction.target());
    assertEquals("fulfill_offer_sol", transaction.payload());
    assertEquals(OFFER_ACCOUNT, transaction.arguments().get("offer"));
    assertEquals("12", transaction.arguments().get("offerId"));
    assertEquals(DESK, transaction.arguments().get("desk"));
  }

  @Test
  void shouldMapSignatureStatuses() {
    server
        .expect(jsonPath("$.method").value("getSignatureStatuses"))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":[null]}}",
                MediaType.APPLICATION_JSON));
    server
        .expect(jsonPath("$.method").value("getSignatureStatuses"))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"value\":[{\"err\":null,"
                    + "\"confirmationStatus\":\"confirmed\"}]}}",
                MediaType.APPLICATION_JSON));

    ConfirmationStatus status =
        adapter.waitForConfirmation(Chain.SOLANA, new TxRef(Chain.SOLANA, "5sig"));

    assertEquals(ConfirmationStatus.CONFIRMED, status);
    server.verify();
  }

  @Test
  void shouldReportFailedSignature() {
    server
        .expect(jsonPath("$.method").value("getSignatureStatuses"))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":[{\"err\":"
                    + "{\"InstructionError\":[0,{\"Custom\":6001}]},"
                    + "\"confirmationStatus\":\"confirmed\"}]}}",
                MediaType.APPLICATION_JSON));

    assertEquals(
        ConfirmationStatus.FAILED,
        adapter.waitForConfirmation(Chain.SOLANA, new TxRef(Chain.SOLANA, "5sig")));
  }

  @Test
  void shouldValidateRecordIds() {
    adapter.validateRecordId("18446744073709551615");
    adapter.validateRecordId(OFFER_ACCOUNT);
    assertThrows(
        DealValidationException.class, () -> adapter.validateRecordId("18446744073709551616"));
    assertThrows(DealValidationException.class, () -> adapter.validateRecordId("0OIl"));
    assertThrows(DealValidationException.class, () -> adapter.validateRecordId("abc"));
  }

  @Test
  void shouldExposeLedgerPaymentDecimals() {
    assertEquals(9, adapter.paymentDecimals(Chain.SOLANA, PaymentCurrency.NATIVE));
    assertEquals(6, adapter.paymentDecimals(Chain.SOLANA, PaymentCurrency.STABLE));
    assertTrue(Base58.isPublicKey(DESK));
  }

  private static byte[] offerAccount(long id, boolean approved) {
    ByteBuffer buffer =
        ByteBuffer.allocate(AltLedgerAdapter.OFFER_ACCOUNT_SIZE).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(AltLedgerAdapter.OFFER_DISCRIMINATOR);
    buffer.put(Base58.decode(DESK));
    buffer.putLong(4L);
    buffer.put(Base58.decode(MINT));
    buffer.putLong(id);
    buffer.put(Base58.decode(BENEFICIARY));
    buffer.putLong(1_000_000_000_000L);
    buffer.putShort((short) 250);
    buffer.putLong(1_700_000_000L);
    buffer.putLong(1_700_003_600L);
    buffer.putLong(50_000_000L);
    buffer.putShort((short) 500);
    buffer.putLong(700_000_000L);
    buffer.put((byte) 0);
    buffer.put((byte) (approved ? 1 : 0));
    buffer.put((byte) 0);
    buffer.put((byte) 0);
    buffer.put((byte) 0);
    return buffer.array();
  }

  private static byte[] consignmentAccount() {
    ByteBuffer buffer =
        ByteBuffer.allocate(AltLedgerAdapter.CONSIGNMENT_ACCOUNT_SIZE)
            .order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(AltLedgerAdapter.CONSIGNMENT_DISCRIMINATOR);
    buffer.put(Base58.decode(DESK));
    buffer.putLong(4L);
    buffer.put(Base58.decode(MINT));
    buffer.put(Base58.decode(key(7)));
    buffer.putLong(1_000L);
    buffer.putLong(400L);
    buffer.put((byte) 0);
    buffer.putShort((short) 500);
    buffer.putInt(30);
    buffer.putShort((short) 0);
    buffer.putShort((short) 0);
    buffer.putInt(0);
    buffer.putInt(0);
    buffer.putLong(0L);
    buffer.putLong(0L);
    buffer.put((byte) 1);
    buffer.put((byte) 0);
    buffer.putShort((short) 1000);
    buffer.putLong(900L);
    buffer.put((byte) 0);
    buffer.putLong(1_700_000_000L);
    return buffer.array();
  }

  private static String programAccounts(byte[] data) {
    return "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[{\"pubkey\":\""
        + OFFER_ACCOUNT
        + "\",\"account\":{\"data\":[\""
        + Base64.getEncoder().encodeToString(data)
        + "\",\"base64\"],\"owner\":\""
        + PROGRAM_ID
        + "\"}}]}";
  }

  private static String accountInfo(String owner, byte[] data) {
    return "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"context\":{\"slot\":1},"
        + "\"value\":{\"data\":[\""
        + Base64.getEncoder().encodeToString(data)
        + "\",\"base64\"],\"owner\":\""
        + owner
        + "\"}}}";
  }

  private static String key(int fill) {
    byte[] bytes = new byte[32];
    Arrays.fill(bytes, (byte) fill);
    return Base58.encode(bytes);
  }
}
