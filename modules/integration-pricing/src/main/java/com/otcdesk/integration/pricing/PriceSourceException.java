package com.otcdesk.integration.pricing;

/** Failure talking to an external price source. */
public class PriceSourceException extends RuntimeException {
  private final String source;
  private final boolean transientFailure;

  public PriceSourceException(
      String source, String message, boolean transientFailure, Throwable cause) {
    super(source + ": " + message, cause);
    this.source = source;
    this.transientFailure = transientFailure;
  }

  public String source() {
    return source;
  }

  public boolean isTransient() {
    return transientFailure;
  }

  public static boolean isTransient(RuntimeException ex) {
    return ex instanceof PriceSourceException priceSourceException
        && priceSourceException.isTransient();
  }
}
