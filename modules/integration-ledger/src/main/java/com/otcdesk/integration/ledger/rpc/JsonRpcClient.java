package com.otcdesk.integration.ledger.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.integration.ledger.ChainException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class JsonRpcClient {
  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final AtomicLong requestIds = new AtomicLong();

  public JsonRpcClient(RestClient restClient, ObjectMapper objectMapper) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  /**
   * Invokes {@code method} and returns the {@code result} member, which may be a JSON null. Node
   * errors mentioning a revert surface as {@code REVERTED}; every other failure is {@code
   * TRANSIENT}.
   */
  public JsonNode call(Chain chain, String url, String method, Object... params) {
    if (url == null || url.isBlank()) {
      throw new IllegalStateException("No RPC endpoint configured for chain " + chain.id());
    }
    ObjectNode request = objectMapper.createObjectNode();
    request.put("jsonrpc", "2.0");
    request.put("id", requestIds.incrementAndGet());
    request.put("method", method);
    ArrayNode paramsNode = request.putArray("params");
    for (Object param : params) {
      paramsNode.add(objectMapper.valueToTree(param));
    }

    String body;
    try {
      body =
          restClient
              .post()
              .uri(URI.create(url))
              .contentType(MediaType.APPLICATION_JSON)
              .body(request.toString())
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  (req, response) -> {
                    String errorBody =
                        StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                    int status = response.getStatusCode().value();
                    throw ChainException.transientFailure(
                        chain, method + " http status=" + status + " " + errorBody, null);
                  })
              .body(String.class);
    } catch (ResourceAccessException ex) {
      throw ChainException.transientFailure(chain, method + " I/O failure: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      if (ex.getCause() instanceof ChainException chainException) {
        throw chainException;
      }
      throw ChainException.transientFailure(chain, method + " failed: " + ex.getMessage(), ex);
    }

    JsonNode root = parse(chain, method, body);
    JsonNode error = root.get("error");
    if (error != null && !error.isNull()) {
      String message = error.path("message").asText("unknown rpc error");
      if (message.toLowerCase(Locale.ROOT).contains("revert")) {
        throw ChainException.reverted(chain, message);
      }
      throw ChainException.transientFailure(chain, method + " rpc error: " + message, null);
    }
    return root.path("result");
  }

  private JsonNode parse(Chain chain, String method, String body) {
    if (body == null || body.isBlank()) {
      throw ChainException.transientFailure(chain, method + " returned an empty body", null);
    }
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw ChainException.transientFailure(chain, method + " returned malformed JSON", ex);
    }
  }
}
