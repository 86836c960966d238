package com.otcdesk.integration.ledger;

import com.otcdesk.domain.deals.Chain;
import java.util.Objects;

public class ChainException extends RuntimeException {
  public enum Kind {
    TRANSIENT,
    REVERTED
  }

  private final Kind kind;
  private final Chain chain;
  private final String reason;

  public ChainException(Kind kind, Chain chain, String reason, Throwable cause) {
    super(kind + " ledger error on " + chain + ": " + reason, cause);
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
    this.chain = chain;
    this.reason = Objects.requireNonNullElse(reason, "unknown");
  }

  public static ChainException transientFailure(Chain chain, String reason, Throwable cause) {
    return new ChainException(Kind.TRANSIENT, chain, reason, cause);
  }

  public static ChainException reverted(Chain chain, String reason) {
    return new ChainException(Kind.REVERTED, chain, reason, null);
  }

  public Kind kind() {
    return kind;
  }

  public Chain chain() {
    return chain;
  }

  public String reason() {
    return reason;
  }

  public boolean isTransient() {
    return kind == Kind.TRANSIENT;
  }

  public static boolean isTransient(RuntimeException ex) {
    return ex instanceof ChainException chainException && chainException.isTransient();
  }
}
