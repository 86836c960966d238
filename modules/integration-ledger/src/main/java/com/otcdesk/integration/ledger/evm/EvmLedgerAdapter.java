package com.otcdesk.integration.ledger.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.DealTerms;
import com.otcdesk.domain.deals.DealValidationException;
import com.otcdesk.domain.deals.LedgerFamily;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.PaymentCurrency;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.ConfirmationPoller;
import com.otcdesk.integration.ledger.ConfirmationStatus;
import com.otcdesk.integration.ledger.LedgerAdapter;
import com.otcdesk.integration.ledger.LedgerProperties;
import com.otcdesk.integration.ledger.TxRef;
import com.otcdesk.integration.ledger.rpc.JsonRpcClient;
import com.otcdesk.integration.ledger.signer.RelayTransaction;
import com.otcdesk.integration.ledger.signer.SignerRelayClient;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EVM desk contract adapter. Records are read with {@code eth_call} against the public {@code
 * offers(uint256)} and {@code consignments(uint256)} getters; writes go through the signer relay.
 */
public class EvmLedgerAdapter implements LedgerAdapter {
  private static final Logger log = LoggerFactory.getLogger(EvmLedgerAdapter.class);

  private static final Pattern RECORD_ID = Pattern.compile("^[0-9]{1,78}$");
  private static final int NATIVE_DECIMALS = 18;
  private static final int OFFER_WORDS = 17;
  private static final int CONSIGNMENT_WORDS = 19;

  private final LedgerProperties properties;
  private final JsonRpcClient rpcClient;
  private final SignerRelayClient relayClient;
  private final ConfirmationPoller confirmationPoller;

  public EvmLedgerAdapter(
      LedgerProperties properties,
      JsonRpcClient rpcClient,
      SignerRelayClient relayClient,
      ConfirmationPoller confirmationPoller) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    this.relayClient = Objects.requireNonNull(relayClient, "relayClient must not be null");
    this.confirmationPoller =
        Objects.requireNonNull(confirmationPoller, "confirmationPoller must not be null");
  }

  @Override
  public LedgerFamily family() {
    return LedgerFamily.EVM;
  }

  @Override
  public void validateRecordId(String id) {
    if (id == null || !RECORD_ID.matcher(id).matches()) {
      throw new DealValidationException("EVM record id must be an unsigned integer: " + id);
    }
    if (new BigInteger(id).bitLength() > 256) {
      throw new DealValidationException("EVM record id exceeds uint256: " + id);
    }
  }

  @Override
  public Optional<Consignment> readConsignment(Chain chain, String id) {
    validateRecordId(id);
    LedgerProperties.EvmChain config = chainConfig(chain);
    AbiWords words =
        ethCall(chain, config, AbiWords.encodeCall(EvmSelectors.CONSIGNMENTS, new BigInteger(id)));
    if (words.size() < CONSIGNMENT_WORDS || AbiWords.isZeroAddress(words.address(1))) {
      return Optional.empty();
    }
    BigInteger total = words.uint(2);
    BigInteger remaining = words.uint(3);
    boolean active = words.bool(17);
    DealTerms terms =
        new DealTerms(
            words.bool(4),
            words.uintAsInt(5),
            words.uintAsInt(6),
            words.uintAsInt(7),
            words.uintAsInt(8),
            words.uintAsInt(9),
            words.uintAsInt(10),
            words.uint(11),
            words.uint(12),
            words.uintAsInt(15),
            words.uintAsLong(16));
    return Optional.of(
        new Consignment(
            chain,
            new BigInteger(id).toString(),
            words.bytes32(0),
            words.address(1),
            total,
            remaining,
            terms,
            words.bool(13),
            words.bool(14),
            consignmentStatus(active, remaining),
            Instant.ofEpochSecond(words.uintAsLong(18))));
  }

  @Override
  public Optional<Offer> readOffer(Chain chain, String id) {
    validateRecordId(id);
    LedgerProperties.EvmChain config = chainConfig(chain);
    AbiWords words =
        ethCall(chain, config, AbiWords.encodeCall(EvmSelectors.OFFERS, new BigInteger(id)));
    if (words.size() < OFFER_WORDS || AbiWords.isZeroAddress(words.address(2))) {
      return Optional.empty();
    }
    long createdAt = words.uintAsLong(5);
    long unlockTime = words.uintAsLong(6);
    OfferFlags flags =
        new OfferFlags(words.bool(11), words.bool(12), words.bool(13), words.bool(14));
    return Optional.of(
        new Offer(
            chain,
            new BigInteger(id).toString(),
            words.uint(0).toString(),
            words.bytes32(1),
            words.address(2),
            words.uint(3),
            words.uintAsInt(4),
            Math.max(0L, unlockTime - createdAt),
            PaymentCurrency.fromLedgerCode(words.uintAsInt(10)),
            words.uint(7),
            words.uint(9),
            Instant.ofEpochSecond(createdAt),
            flags));
  }

  @Override
  public TxRef approveOffer(Chain chain, String id) {
    return submit(chain, EvmSelectors.APPROVE_OFFER, id, BigInteger.ZERO, Map.of());
  }

  @Override
  public TxRef payOffer(Chain chain, String id, BigInteger amount, PaymentCurrency currency) {
    Objects.requireNonNull(amount, "amount must not be null");
    if (amount.signum() <= 0) {
      throw new DealValidationException("payment amount must be > 0");
    }
    if (currency == PaymentCurrency.NATIVE) {
      return submit(chain, EvmSelectors.FULFILL_OFFER, id, amount, Map.of());
    }
    // Stable payments are pulled by the contract against the signer's standing allowance.
    return submit(
        chain,
        EvmSelectors.FULFILL_OFFER,
        id,
        BigInteger.ZERO,
        Map.of("maxPayment", amount.toString()));
  }

  @Override
  public TxRef cancelOffer(Chain chain, String id) {
    return submit(chain, EvmSelectors.CANCEL_OFFER, id, BigInteger.ZERO, Map.of());
  }

  @Override
  public ConfirmationStatus waitForConfirmation(Chain chain, TxRef txRef) {
    LedgerProperties.EvmChain config = chainConfig(chain);
    ConfirmationStatus status =
        confirmationPoller.await(() -> receiptStatus(chain, config, txRef.hash()));
    log.info(
        "EVM transaction confirmation chain={} tx_hash={} status={}",
        chain.id(),
        txRef.hash(),
        status);
    return status;
  }

  @Override
  public int paymentDecimals(Chain chain, PaymentCurrency currency) {
    if (currency == PaymentCurrency.NATIVE) {
      return NATIVE_DECIMALS;
    }
    return chainConfig(chain).getStableDecimals();
  }

  @Override
  public String signerIdentity(Chain chain) {
    return chainConfig(chain).getSignerAddress();
  }

  @Override
  public long latestHeight(Chain chain) {
    JsonNode result = rpcClient.call(chain, chainConfig(chain).getRpcUrl(), "eth_blockNumber");
    return parseHexQuantity(chain, result.asText("")).longValueExact();
  }

  private TxRef submit(
      Chain chain, String selector, String id, BigInteger value, Map<String, String> arguments) {
    validateRecordId(id);
    LedgerProperties.EvmChain config = chainConfig(chain);
    String calldata = AbiWords.encodeCall(selector, new BigInteger(id));
    return relayClient.submit(
        new RelayTransaction(chain, config.getDeskContract(), calldata, value, arguments));
  }

  private AbiWords ethCall(Chain chain, LedgerProperties.EvmChain config, String calldata) {
    JsonNode result =
        rpcClient.call(
            chain,
            config.getRpcUrl(),
            "eth_call",
            Map.of("to", config.getDeskContract(), "data", calldata),
            "latest");
    return AbiWords.decode(result.asText(""));
  }

  private Optional<ConfirmationStatus> receiptStatus(
      Chain chain, LedgerProperties.EvmChain config, String txHash) {
    JsonNode receipt =
        rpcClient.call(chain, config.getRpcUrl(), "eth_getTransactionReceipt", txHash);
    if (receipt == null || receipt.isNull() || receipt.isMissingNode()) {
      return Optional.empty();
    }
    BigInteger status = parseHexQuantity(chain, receipt.path("status").asText("0x0"));
    return Optional.of(
        status.signum() == 0 ? ConfirmationStatus.FAILED : ConfirmationStatus.CONFIRMED);
  }

  private LedgerProperties.EvmChain chainConfig(Chain chain) {
    if (chain.family() != LedgerFamily.EVM) {
      throw new DealValidationException("Chain " + chain.id() + " is not an EVM chain");
    }
    LedgerProperties.EvmChain config = properties.getEvm().get(chain.id());
    if (config == null || config.getRpcUrl().isBlank() || config.getDeskContract().isBlank()) {
      throw new DealValidationException("Chain " + chain.id() + " is not configured");
    }
    return config;
  }

  private static ConsignmentStatus consignmentStatus(boolean active, BigInteger remaining) {
    if (active) {
      return ConsignmentStatus.ACTIVE;
    }
    return remaining.signum() == 0 ? ConsignmentStatus.EXHAUSTED : ConsignmentStatus.WITHDRAWN;
  }

  private static BigInteger parseHexQuantity(Chain chain, String value) {
    String hex = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
    if (hex.isEmpty()) {
      throw ChainException.transientFailure(chain, "empty hex quantity from node", null);
    }
    try {
      return new BigInteger(hex, 16);
    } catch (NumberFormatException ex) {
      throw ChainException.transientFailure(chain, "malformed hex quantity: " + value, ex);
    }
  }
}
