package com.otcdesk.integration.ledger.signer;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public class RelayRequestSigner {
  private final String apiSecret;
  private final long recvWindowMs;
  private final Clock clock;

  public RelayRequestSigner(String apiSecret, long recvWindowMs, Clock clock) {
    this.apiSecret = Objects.requireNonNullElse(apiSecret, "");
    this.recvWindowMs = Math.max(1L, recvWindowMs);
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /** Signs {@code timestamp.recvWindow.body} with HMAC-SHA256. */
  public SignedRequest sign(String body) {
    String timestamp = String.valueOf(clock.millis());
    String recvWindow = String.valueOf(recvWindowMs);
    String canonical = timestamp + "." + recvWindow + "." + Objects.requireNonNullElse(body, "");
    return new SignedRequest(timestamp, recvWindow, hmacSha256Hex(canonical));
  }

  private String hmacSha256Hex(String payload) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
      byte[] signatureBytes = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(signatureBytes.length * 2);
      for (byte b : signatureBytes) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16));
        hex.append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to sign relay request", ex);
    }
  }

  public record SignedRequest(String timestamp, String recvWindow, String signature) {}
}
