package com.otcdesk.domain.deals;

/**
 * Monotonic status flags of an offer. Flags only move from false to true, {@code fulfilled} implies
 * {@code paid} which implies {@code approved}, and {@code cancelled} never coexists with {@code
 * fulfilled}.
 */
public record OfferFlags(boolean approved, boolean paid, boolean fulfilled, boolean cancelled) {
  public static final OfferFlags NONE = new OfferFlags(false, false, false, false);

  public OfferFlags {
    if (fulfilled && !paid) {
      throw new DealValidationException("fulfilled offer must be paid");
    }
    if (paid && !approved) {
      throw new DealValidationException("paid offer must be approved");
    }
    if (fulfilled && cancelled) {
      throw new DealValidationException("offer cannot be both fulfilled and cancelled");
    }
  }

  public OfferStatus status() {
    if (cancelled) {
      return OfferStatus.CANCELLED;
    }
    if (fulfilled) {
      return OfferStatus.FULFILLED;
    }
    if (paid) {
      return OfferStatus.PAID;
    }
    if (approved) {
      return OfferStatus.APPROVED;
    }
    return OfferStatus.CREATED;
  }

  public boolean isTerminal() {
    return status().isTerminal();
  }

  /** True when every flag set here is also set in {@code other}. */
  public boolean isCoveredBy(OfferFlags other) {
    return (!approved || other.approved)
        && (!paid || other.paid)
        && (!fulfilled || other.fulfilled)
        && (!cancelled || other.cancelled);
  }

  public OfferFlags union(OfferFlags other) {
    OfferFlags merged =
        new OfferFlags(
            approved || other.approved,
            paid || other.paid,
            fulfilled || other.fulfilled,
            cancelled || other.cancelled);
    OfferStateMachine.validateTransition(status(), merged.status());
    return merged;
  }

  public OfferFlags withApproved() {
    return union(new OfferFlags(true, false, false, false));
  }

  public OfferFlags withPaid() {
    return union(new OfferFlags(true, true, false, false));
  }

  public OfferFlags withCancelled() {
    return union(new OfferFlags(false, false, false, true));
  }
}
