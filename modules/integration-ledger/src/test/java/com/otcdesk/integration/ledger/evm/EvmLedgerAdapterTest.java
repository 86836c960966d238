package com.otcdesk.integration.ledger.evm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferStatus;
import com.otcdesk.domain.deals.PaymentCurrency;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.ConfirmationPoller;
import com.otcdesk.integration.ledger.ConfirmationStatus;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.TxRef;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.ledger.signer.RelayTransaction;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class EvmLedgerAdapterTest {
  private static final String RPC_URL = "https://rpc.base.test";
  private static final String DESK = "0x1111111111111111111111111111111111111111";
  private static final String BENEFICIARY = "0x2222222222222222222222222222222222222222";
  private static final String TOKEN_ID =
      "0xabcdef0000000000000000000000000000000000000000000000000000000001";

  private MockRestServiceServer server;
  private EvmLedgerAdapter adapter;
  private final List<RelayTransaction> submitted = new ArrayList<>();

  @BeforeEach
  void setUp() {
    LedgerProperties properties = new LedgerProperties();
    LedgerProperties.EvmChain base = new LedgerProperties.EvmChain();
    base.setRpcUrl(RPC_URL);
    base.setDeskContract(DESK);
    base.setSignerAddress("0x3333333333333333333333333333333333333333");
    properties.getEvm().put("base", base);

    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    JsonRpcClient rpcClient = new JsonRpcClient(builder.build(), new ObjectMapper());
    Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
    ConfirmationPoller poller =
        new ConfirmationPoller(Duration.ofMillis(10), Duration.ofSeconds(5), clock, duration -> {});
    adapter =
        new EvmLedgerAdapter(
            properties,
            rpcClient,
            transaction -> {
              submitted.add(transaction);
              return new TxRef(transaction.chain(), "0xfeed");
            },
            poller);
  }

  @Test
  void shouldDecodeOfferTupleFromEthCall() {
    server
        .expect(requestTo(RPC_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.method").value("eth_call"))
        .andExpect(jsonPath("$.params[0].to").value(DESK))
        .andExpect(jsonPath("$.params[1]").value("latest"))
        .andRespond(withSuccess(rpcResult(offerTuple()), MediaType.APPLICATION_JSON));

    Optional<Offer> offer = adapter.readOffer(Chain.BASE, "7");

    assertTrue(offer.isPresent());
    assertEquals("7", offer.get().id());
    assertEquals("3", offer.get().consignmentId());
    assertEquals(TOKEN_ID, offer.get().tokenId());
    assertEquals(BENEFICIARY, offer.get().beneficiary());
    assertEquals(new BigInteger("10000000000000000000000"), offer.get().tokenAmount());
    assertEquals(1000, offer.get().discountBps());
    assertEquals(86_400L * 30, offer.get().lockupSeconds());
    assertEquals(PaymentCurrency.STABLE, offer.get().currency());
    assertEquals(BigInteger.valueOf(50_000_000L), offer.get().priceUsdPerToken8d());
    assertEquals(OfferStatus.APPROVED, offer.get().status());
    server.verify();
  }

  @Test
  void shouldTreatZeroBeneficiaryAsMissingOffer() {
    String empty = "0x" + "0".repeat(64 * 17);
    server
        .expect(requestTo(RPC_URL))
        .andRespond(withSuccess(rpcResult(empty), MediaType.APPLICATION_JSON));

    assertFalse(adapter.readOffer(Chain.BASE, "99").isPresent());
  }

  @Test
  void shouldDecodeConsignmentAndDeriveStatus() {
    StringBuilder tuple = new StringBuilder("0x");
    tuple.append(TOKEN_ID.substring(2));
    tuple.append(address(BENEFICIARY));
    tuple.append(word(BigInteger.valueOf(1_000_000)));
    tuple.append(word(BigInteger.ZERO));
    tuple.append(word(1)); // negotiable
    tuple.append(word(0));
    tuple.append(word(0));
    tuple.append(word(500));
    tuple.append(word(2500));
    tuple.append(word(7));
    tuple.append(word(365));
    tuple.append(word(BigInteger.valueOf(100)));
    tuple.append(word(BigInteger.valueOf(500_000)));
    tuple.append(word(1));
    tuple.append(word(0));
    tuple.append(word(300));
    tuple.append(word(1800));
    tuple.append(word(0)); // inactive
    tuple.append(word(1_700_000_000L));
    server
        .expect(requestTo(RPC_URL))
        .andExpect(
            jsonPath("$.params[0].data")
                .value(AbiWords.encodeCall(EvmSelectors.CONSIGNMENTS, BigInteger.valueOf(3))))
        .andRespond(withSuccess(rpcResult(tuple.toString()), MediaType.APPLICATION_JSON));

    Consignment consignment = adapter.readConsignment(Chain.BASE, "3").orElseThrow();

    assertEquals(ConsignmentStatus.EXHAUSTED, consignment.status());
    assertEquals(300, consignment.terms().maxPriceVolatilityBps());
    assertEquals(1800L, consignment.terms().maxTimeToExecuteSeconds());
    assertTrue(consignment.terms().negotiable());
    assertTrue(consignment.fractionalized());
  }

  @Test
  void shouldRejectMalformedIdsWithoutCallingTheNode() {
    assertThrows(DealValidationException.class, () -> adapter.readOffer(Chain.BASE, "0x12"));
    assertThrows(DealValidationException.class, () -> adapter.readOffer(Chain.BASE, "-1"));
    assertThrows(DealValidationException.class, () -> adapter.approveOffer(Chain.BASE, ""));
    server.verify();
  }

  @Test
  void shouldRejectUnconfiguredChain() {
    assertThrows(DealValidationException.class, () -> adapter.readOffer(Chain.ETHEREUM, "1"));
  }

  @Test
  void shouldSendNativeValueWithFulfillCalldata() {
    TxRef ref =
        adapter.payOffer(
            Chain.BASE, "7", new BigInteger("1500000000000000000"), PaymentCurrency.NATIVE);

    assertEquals("0xfeed", ref.hash());
    RelayTransaction transaction = submitted.get(0);
    assertEquals(DESK, transaction.target());
    assertEquals(
        AbiWords.encodeCall(EvmSelectors.FULFILL_OFFER, BigInteger.valueOf(7)),
        transaction.payload());
    assertEquals(new BigInteger("1500000000000000000"), transaction.value());
  }

  @Test
  void shouldPassStableAmountAsMaxPayment() {
    adapter.payOffer(Chain.BASE, "7", BigInteger.valueOf(4_500_000_000L), PaymentCurrency.STABLE);

    RelayTransaction transaction = submitted.get(0);
    assertEquals(BigInteger.ZERO, transaction.value());
    assertEquals("4500000000", transaction.arguments().get("maxPayment"));
  }

  @Test
  void shouldPollReceiptUntilMined() {
    server
        .expect(jsonPath("$.method").value("eth_getTransactionReceipt"))
        .andRespond(withSuccess(rpcNull(), MediaType.APPLICATION_JSON));
    server
        .expect(jsonPath("$.method").value("eth_getTransactionReceipt"))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"status\":\"0x1\"}}",
                MediaType.APPLICATION_JSON));

    ConfirmationStatus status =
        adapter.waitForConfirmation(Chain.BASE, new TxRef(Chain.BASE, "0xfeed"));

    assertEquals(ConfirmationStatus.CONFIRMED, status);
    server.verify();
  }

  @Test
  void shouldReportFailedReceipt() {
    server
        .expect(jsonPath("$.method").value("eth_getTransactionReceipt"))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"status\":\"0x0\"}}",
                MediaType.APPLICATION_JSON));

    assertEquals(
        ConfirmationStatus.FAILED,
        adapter.waitForConfirmation(Chain.BASE, new TxRef(Chain.BASE, "0xfeed")));
  }

  @Test
  void shouldMapServerErrorToTransientFailure() {
    server.expect(requestTo(RPC_URL)).andRespond(withServerError());

    ChainException ex =
        assertThrows(ChainException.class, () -> adapter.readOffer(Chain.BASE, "7"));

    assertTrue(ex.isTransient());
  }

  @Test
  void shouldMapRevertErrorToReverted() {
    server
        .expect(requestTo(RPC_URL))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":3,"
                    + "\"message\":\"execution reverted: bad id\"}}",
                MediaType.APPLICATION_JSON));

    ChainException ex =
        assertThrows(ChainException.class, () -> adapter.readOffer(Chain.BASE, "7"));

    assertEquals(ChainException.Kind.REVERTED, ex.kind());
  }

  @Test
  void shouldReadLatestBlockNumber() {
    server
        .expect(jsonPath("$.method").value("eth_blockNumber"))
        .andRespond(
            withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10d4f\"}",
                MediaType.APPLICATION_JSON));

    assertEquals(68943L, adapter.latestHeight(Chain.BASE));
  }

  private static String offerTuple() {
    StringBuilder tuple = new StringBuilder("0x");
    tuple.append(word(3));
    tuple.append(TOKEN_ID.substring(2));
    tuple.append(address(BENEFICIARY));
    tuple.append(word(new BigInteger("10000000000000000000000")));
    tuple.append(word(1000));
    tuple.append(word(1_700_000_000L));
    tuple.append(word(1_700_000_000L + 86_400L * 30));
    tuple.append(word(50_000_000L));
    tuple.append(word(500));
    tuple.append(word(300_000_000_000L));
    tuple.append(word(1)); // stable
    tuple.append(word(1)); // approved
    tuple.append(word(0));
    tuple.append(word(0));
    tuple.append(word(0));
    tuple.append(address("0x0000000000000000000000000000000000000000"));
    tuple.append(word(0));
    return tuple.toString();
  }

  private static String word(long value) {
    return word(BigInteger.valueOf(value));
  }

  private static String word(BigInteger value) {
    String hex = value.toString(16);
    return "0".repeat(64 - hex.length()) + hex;
  }

  private static String address(String address) {
    return "0".repeat(24) + address.substring(2);
  }

  private static String rpcResult(String hex) {
    return "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"" + hex + "\"}";
  }

  private static String rpcNull() {
    return "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}";
  }
}
