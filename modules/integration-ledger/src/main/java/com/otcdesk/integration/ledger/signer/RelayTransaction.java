package com.otcdesk.integration.ledger.signer;

import com.otcdesk.domain.deals.Chain;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * A write the custodial signer relay should sign and broadcast. {@code target} is the contract or
 * program, {@code payload} the calldata or instruction name, {@code value} the native amount sent
 * along and {@code arguments} any named instruction arguments.
 */
public record RelayTransaction(
    Chain chain, String target, String payload, BigInteger value, Map<String, String> arguments) {
  public RelayTransaction {
    Objects.requireNonNull(chain, "chain must not be null");
    if (target == null || target.isBlank()) {
      throw new IllegalArgumentException("target must not be blank");
    }
    if (payload == null || payload.isBlank()) {
      throw new IllegalArgumentException("payload must not be blank");
    }
    value = value == null ? BigInteger.ZERO : value;
    arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
  }
}
