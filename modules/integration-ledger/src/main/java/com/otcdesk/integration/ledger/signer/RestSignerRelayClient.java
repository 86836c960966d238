package com.otcdesk.integration.ledger.signer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.otcdesk.integration.ledger.ChainException;
import com.otcdesk.integration.ledger.TxRef;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

public class RestSignerRelayClient implements SignerRelayClient {
  private static final Logger log = LoggerFactory.getLogger(RestSignerRelayClient.class);

  private static final String TRANSACTIONS_PATH = "/v1/transactions";
  private static final String API_KEY_HEADER = "X-RELAY-APIKEY";
  private static final String TIMESTAMP_HEADER = "X-RELAY-TIMESTAMP";
  private static final String RECV_WINDOW_HEADER = "X-RELAY-RECV-WINDOW";
  private static final String SIGNATURE_HEADER = "X-RELAY-SIGNATURE";

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final SignerRelayProperties properties;
  private final RelayRequestSigner requestSigner;

  public RestSignerRelayClient(
      RestClient restClient,
      ObjectMapper objectMapper,
      SignerRelayProperties properties,
      RelayRequestSigner requestSigner) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.requestSigner = Objects.requireNonNull(requestSigner, "requestSigner must not be null");
  }

  @Override
  public TxRef submit(RelayTransaction transaction) {
    String body = toJson(transaction);
    RelayRequestSigner.SignedRequest signed = requestSigner.sign(body);
    String responseBody;
    try {
      responseBody =
          restClient
              .post()
              .uri(TRANSACTIONS_PATH)
              .contentType(MediaType.APPLICATION_JSON)
              .header(API_KEY_HEADER, properties.getApiKey())
              .header(TIMESTAMP_HEADER, signed.timestamp())
              .header(RECV_WINDOW_HEADER, signed.recvWindow())
              .header(SIGNATURE_HEADER, signed.signature())
              .body(body)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  (request, response) -> raiseRelayError(transaction, response))
              .body(String.class);
    } catch (ResourceAccessException ex) {
      // The relay may already have broadcast; the caller has to re-read the ledger.
      throw ChainException.transientFailure(
          transaction.chain(), "relay unreachable: " + ex.getMessage(), ex);
    }

    JsonNode root = parseJson(transaction, responseBody);
    String status = root.path("status").asText("");
    if ("REJECTED".equalsIgnoreCase(status)) {
      throw ChainException.reverted(transaction.chain(), root.path("reason").asText("rejected"));
    }
    String txHash = root.path("txHash").asText("");
    if (txHash.isBlank()) {
      throw ChainException.transientFailure(
          transaction.chain(), "relay response missing txHash status=" + status, null);
    }
    log.info(
        "Relay submission accepted chain={} target={} payload={} tx_hash={}",
        transaction.chain().id(),
        transaction.target(),
        abbreviate(transaction.payload()),
        txHash);
    return new TxRef(transaction.chain(), txHash);
  }

  private void raiseRelayError(RelayTransaction transaction, ClientHttpResponse response)
      throws IOException {
    int status = response.getStatusCode().value();
    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    if (response.getStatusCode().is5xxServerError() || status == 429) {
      throw ChainException.transientFailure(
          transaction.chain(), "relay status=" + status + " body=" + body, null);
    }
    throw ChainException.reverted(transaction.chain(), extractReason(status, body));
  }

  private String extractReason(int status, String body) {
    try {
      JsonNode root = objectMapper.readTree(body);
      if (root.hasNonNull("reason")) {
        return root.get("reason").asText();
      }
    } catch (IOException ignored) {
      // non-JSON error bodies fall through to the raw text
    }
    return "relay status=" + status + " body=" + body;
  }

  private String toJson(RelayTransaction transaction) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("chain", transaction.chain().id());
    node.put("target", transaction.target());
    node.put("payload", transaction.payload());
    node.put("value", transaction.value().toString());
    ObjectNode arguments = node.putObject("arguments");
    transaction.arguments().forEach(arguments::put);
    return node.toString();
  }

  private JsonNode parseJson(RelayTransaction transaction, String body) {
    if (body == null || body.isBlank()) {
      throw ChainException.transientFailure(transaction.chain(), "relay returned empty body", null);
    }
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw ChainException.transientFailure(
          transaction.chain(), "relay returned malformed JSON", ex);
    }
  }

  private static String abbreviate(String value) {
    return value.length() <= 18 ? value : value.substring(0, 18) + "...";
  }
}
