package com.otcdesk.integration.ledger.alt;

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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter for the account-model ledger. Offers and consignments are Borsh-encoded program accounts
 * owned by the desk program. Records are addressed either by their numeric id, which is resolved
 * with a filtered {@code getProgramAccounts} scan, or directly by account address.
 */
public class AltLedgerAdapter implements LedgerAdapter {
  private static final Logger log = LoggerFactory.getLogger(AltLedgerAdapter.class);

  static final byte[] OFFER_DISCRIMINATOR = {
    (byte) 215, 88, 60, 71, (byte) 170, (byte) 162, 73, (byte) 229
  };
  static final byte[] CONSIGNMENT_DISCRIMINATOR = {
    (byte) 158, 104, (byte) 234, 9, 1, (byte) 189, 75, (byte) 228
  };
  // Discriminator plus the serialized struct.
  static final int OFFER_ACCOUNT_SIZE = 8 + 201;
  static final int CONSIGNMENT_ACCOUNT_SIZE = 8 + 176;

  private static final int DESK_OFFSET = 8;
  private static final int OFFER_ID_OFFSET = 80;
  private static final int CONSIGNMENT_ID_OFFSET = 40;
  private static final Pattern NUMERIC_ID = Pattern.compile("^[0-9]{1,20}$");
  private static final BigInteger MAX_U64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
  private static final int NATIVE_DECIMALS = 9;
  private static final int STABLE_DECIMALS = 6;

  private final LedgerProperties.AltLedger properties;
  private final JsonRpcClient rpcClient;
  private final SignerRelayClient relayClient;
  private final ConfirmationPoller confirmationPoller;

  public AltLedgerAdapter(
      LedgerProperties properties,
      JsonRpcClient rpcClient,
      SignerRelayClient relayClient,
      ConfirmationPoller confirmationPoller) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null").getAlt();
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    this.relayClient = Objects.requireNonNull(relayClient, "relayClient must not be null");
    this.confirmationPoller =
        Objects.requireNonNull(confirmationPoller, "confirmationPoller must not be null");
  }

  @Override
  public LedgerFamily family() {
    return LedgerFamily.ALT_LEDGER;
  }

  @Override
  public void validateRecordId(String id) {
    if (id == null || id.isBlank()) {
      throw new DealValidationException("record id must not be blank");
    }
    if (NUMERIC_ID.matcher(id).matches()) {
      if (new BigInteger(id).compareTo(MAX_U64) > 0) {
        throw new DealValidationException("record id exceeds u64: " + id);
      }
      return;
    }
    if (!Base58.isPublicKey(id)) {
      throw new DealValidationException(
          "record id must be a u64 or a base58 account address: " + id);
    }
  }

  @Override
  public Optional<Consignment> readConsignment(Chain chain, String id) {
    validateRecordId(id);
    return fetchAccount(chain, id, CONSIGNMENT_DISCRIMINATOR, CONSIGNMENT_ID_OFFSET)
        .map(account -> decodeConsignment(chain, account.data()));
  }

  @Override
  public Optional<Offer> readOffer(Chain chain, String id) {
    validateRecordId(id);
    return fetchAccount(chain, id, OFFER_DISCRIMINATOR, OFFER_ID_OFFSET)
        .map(account -> decodeOffer(chain, account.data()));
  }

  @Override
  public TxRef approveOffer(Chain chain, String id) {
    return submit(chain, "approve_offer", id, BigInteger.ZERO);
  }

  @Override
  public TxRef payOffer(Chain chain, String id, BigInteger amount, PaymentCurrency currency) {
    Objects.requireNonNull(amount, "amount must not be null");
    if (amount.signum() <= 0) {
      throw new DealValidationException("payment amount must be > 0");
    }
    String instruction =
        currency == PaymentCurrency.NATIVE ? "fulfill_offer_sol" : "fulfill_offer_usdc";
    return submit(chain, instruction, id, amount);
  }

  @Override
  public TxRef cancelOffer(Chain chain, String id) {
    return submit(chain, "cancel_offer", id, BigInteger.ZERO);
  }

  @Override
  public ConfirmationStatus waitForConfirmation(Chain chain, TxRef txRef) {
    requireAltChain(chain);
    ConfirmationStatus status = confirmationPoller.await(() -> signatureStatus(chain, txRef));
    log.info(
        "Alt-ledger transaction confirmation chain={} signature={} status={}",
        chain.id(),
        txRef.hash(),
        status);
    return status;
  }

  @Override
  public int paymentDecimals(Chain chain, PaymentCurrency currency) {
    return currency == PaymentCurrency.NATIVE ? NATIVE_DECIMALS : STABLE_DECIMALS;
  }

  @Override
  public String signerIdentity(Chain chain) {
    return properties.getSignerAddress();
  }

  @Override
  public long latestHeight(Chain chain) {
    requireAltChain(chain);
    JsonNode result =
        rpcClient.call(
            chain,
            properties.getRpcUrl(),
            "getSlot",
            Map.of("commitment", properties.getCommitment()));
    if (!result.canConvertToLong()) {
      throw ChainException.transientFailure(chain, "getSlot returned " + result, null);
    }
    return result.asLong();
  }

  private TxRef submit(Chain chain, String instruction, String id, BigInteger amount) {
    validateRecordId(id);
    ProgramAccount offer =
        fetchAccount(chain, id, OFFER_DISCRIMINATOR, OFFER_ID_OFFSET)
            .orElseThrow(
                () -> ChainException.reverted(chain, "offer account not found for id " + id));
    BigInteger offerId = new BorshReader(offer.data()).skipTo(OFFER_ID_OFFSET).u64();
    Map<String, String> arguments = new LinkedHashMap<>();
    arguments.put("desk", properties.getDeskAddress());
    arguments.put("offer", offer.address());
    arguments.put("offerId", offerId.toString());
    if (amount.signum() > 0) {
      arguments.put("amount", amount.toString());
    }
    return relayClient.submit(
        new RelayTransaction(chain, properties.getProgramId(), instruction, amount, arguments));
  }

  private Optional<ProgramAccount> fetchAccount(
      Chain chain, String id, byte[] discriminator, int idOffset) {
    requireAltChain(chain);
    if (NUMERIC_ID.matcher(id).matches()) {
      return findById(chain, new BigInteger(id), discriminator, idOffset);
    }
    JsonNode result =
        rpcClient.call(
            chain,
            properties.getRpcUrl(),
            "getAccountInfo",
            id,
            Map.of("encoding", "base64", "commitment", properties.getCommitment()));
    JsonNode value = result.path("value");
    if (value.isNull() || value.isMissingNode()) {
      return Optional.empty();
    }
    if (!properties.getProgramId().equals(value.path("owner").asText())) {
      return Optional.empty();
    }
    byte[] data = decodeData(chain, value.path("data"));
    if (!hasPrefix(data, discriminator)) {
      return Optional.empty();
    }
    return Optional.of(new ProgramAccount(id, data));
  }

  private Optional<ProgramAccount> findById(
      Chain chain, BigInteger id, byte[] discriminator, int idOffset) {
    byte[] idBytes =
        ByteBuffer.allocate(Long.BYTES)
            .order(ByteOrder.LITTLE_ENDIAN)
            .putLong(id.longValue())
            .array();
    List<Map<String, Object>> filters =
        List.of(
            memcmp(0, Base58.encode(discriminator)),
            memcmp(DESK_OFFSET, properties.getDeskAddress()),
            memcmp(idOffset, Base58.encode(idBytes)));
    JsonNode result =
        rpcClient.call(
            chain,
            properties.getRpcUrl(),
            "getProgramAccounts",
            properties.getProgramId(),
            Map.of(
                "encoding",
                "base64",
                "commitment",
                properties.getCommitment(),
                "filters",
                filters));
    if (!result.isArray() || result.isEmpty()) {
      return Optional.empty();
    }
    if (result.size() > 1) {
      log.warn(
          "Multiple program accounts matched id chain={} id={} matches={}",
          chain.id(),
          id,
          result.size());
    }
    JsonNode first = result.get(0);
    return Optional.of(
        new ProgramAccount(
            first.path("pubkey").asText(), decodeData(chain, first.path("account").path("data"))));
  }

  private Optional<ConfirmationStatus> signatureStatus(Chain chain, TxRef txRef) {
    JsonNode result =
        rpcClient.call(
            chain,
            properties.getRpcUrl(),
            "getSignatureStatuses",
            List.of(txRef.hash()),
            Map.of("searchTransactionHistory", true));
    JsonNode status = result.path("value").path(0);
    if (status.isNull() || status.isMissingNode()) {
      return Optional.empty();
    }
    JsonNode err = status.path("err");
    if (!err.isNull() && !err.isMissingNode()) {
      return Optional.of(ConfirmationStatus.FAILED);
    }
    String level = status.path("confirmationStatus").asText("");
    if ("finalized".equals(level)
        || ("confirmed".equals(level) && !"finalized".equals(properties.getCommitment()))) {
      return Optional.of(ConfirmationStatus.CONFIRMED);
    }
    return Optional.of(ConfirmationStatus.PENDING);
  }

  Offer decodeOffer(Chain chain, byte[] data) {
    requireSize(chain, data, OFFER_ACCOUNT_SIZE, "offer");
    BorshReader reader = new BorshReader(data);
    reader.bytes(OFFER_DISCRIMINATOR.length);
    reader.pubkey(); // desk
    BigInteger consignmentId = reader.u64();
    String tokenMint = reader.pubkey();
    BigInteger id = reader.u64();
    String beneficiary = reader.pubkey();
    BigInteger tokenAmount = reader.u64();
    int discountBps = reader.u16();
    long createdAt = reader.i64();
    long unlockTime = reader.i64();
    BigInteger priceUsd8d = reader.u64();
    reader.u16(); // max price deviation, enforced on-chain
    BigInteger nativeUsd8d = reader.u64();
    int currency = reader.u8();
    OfferFlags flags = new OfferFlags(reader.bool(), reader.bool(), reader.bool(), reader.bool());
    return new Offer(
        chain,
        id.toString(),
        consignmentId.toString(),
        tokenMint,
        beneficiary,
        tokenAmount,
        discountBps,
        Math.max(0L, unlockTime - createdAt),
        PaymentCurrency.fromLedgerCode(currency),
        priceUsd8d,
        nativeUsd8d,
        Instant.ofEpochSecond(createdAt),
        flags);
  }

  Consignment decodeConsignment(Chain chain, byte[] data) {
    requireSize(chain, data, CONSIGNMENT_ACCOUNT_SIZE, "consignment");
    BorshReader reader = new BorshReader(data);
    reader.bytes(CONSIGNMENT_DISCRIMINATOR.length);
    reader.pubkey(); // desk
    BigInteger id = reader.u64();
    String tokenMint = reader.pubkey();
    String consigner = reader.pubkey();
    BigInteger total = reader.u64();
    BigInteger remaining = reader.u64();
    boolean negotiable = reader.bool();
    int fixedDiscountBps = reader.u16();
    long fixedLockupDays = reader.u32();
    int minDiscountBps = reader.u16();
    int maxDiscountBps = reader.u16();
    long minLockupDays = reader.u32();
    long maxLockupDays = reader.u32();
    BigInteger minDeal = reader.u64();
    BigInteger maxDeal = reader.u64();
    boolean fractionalized = reader.bool();
    boolean privateListing = reader.bool();
    int maxPriceVolatilityBps = reader.u16();
    long maxTimeToExecute = reader.i64();
    boolean active = reader.bool();
    long createdAt = reader.i64();
    DealTerms terms =
        new DealTerms(
            negotiable,
            fixedDiscountBps,
            Math.toIntExact(fixedLockupDays),
            minDiscountBps,
            maxDiscountBps,
            Math.toIntExact(minLockupDays),
            Math.toIntExact(maxLockupDays),
            minDeal,
            maxDeal,
            maxPriceVolatilityBps,
            Math.max(0L, maxTimeToExecute));
    ConsignmentStatus status;
    if (active) {
      status = ConsignmentStatus.ACTIVE;
    } else {
      status = remaining.signum() == 0 ? ConsignmentStatus.EXHAUSTED : ConsignmentStatus.WITHDRAWN;
    }
    return new Consignment(
        chain,
        id.toString(),
        tokenMint,
        consigner,
        total,
        remaining,
        terms,
        fractionalized,
        privateListing,
        status,
        Instant.ofEpochSecond(createdAt));
  }

  private static Map<String, Object> memcmp(int offset, String bytes) {
    return Map.of("memcmp", Map.of("offset", offset, "bytes", bytes));
  }

  private static byte[] decodeData(Chain chain, JsonNode dataNode) {
    String encoded = dataNode.isArray() ? dataNode.path(0).asText("") : dataNode.asText("");
    try {
      return Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException ex) {
      throw ChainException.transientFailure(chain, "account data is not valid base64", ex);
    }
  }

  private static boolean hasPrefix(byte[] data, byte[] prefix) {
    if (data.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (data[i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }

  private static void requireSize(Chain chain, byte[] data, int minimum, String kind) {
    if (data.length < minimum) {
      throw ChainException.transientFailure(
          chain, kind + " account too short: " + data.length + " < " + minimum, null);
    }
  }

  private void requireAltChain(Chain chain) {
    if (chain.family() != LedgerFamily.ALT_LEDGER) {
      throw new DealValidationException("Chain " + chain.id() + " is not an alt-ledger chain");
    }
    if (!properties.isEnabled() || properties.getProgramId().isBlank()) {
      throw new DealValidationException("Chain " + chain.id() + " is not configured");
    }
  }

  private record ProgramAccount(String address, byte[] data) {}
}
