package com.otcdesk.domain.deals;

import java.util.EnumSet;
import java.util.Map;

public final class OfferStateMachine {
  // Ledger observations may skip intermediate states, so forward jumps are allowed.
  private static final Map<OfferStatus, EnumSet<OfferStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          OfferStatus.CREATED,
              EnumSet.of(
                  OfferStatus.CREATED,
                  OfferStatus.APPROVED,
                  OfferStatus.PAID,
                  OfferStatus.FULFILLED,
                  OfferStatus.CANCELLED),
          OfferStatus.APPROVED,
              EnumSet.of(
                  OfferStatus.APPROVED,
                  OfferStatus.PAID,
                  OfferStatus.FULFILLED,
                  OfferStatus.CANCELLED),
          OfferStatus.PAID,
              EnumSet.of(OfferStatus.PAID, OfferStatus.FULFILLED, OfferStatus.CANCELLED),
          OfferStatus.FULFILLED, EnumSet.of(OfferStatus.FULFILLED),
          OfferStatus.CANCELLED, EnumSet.of(OfferStatus.CANCELLED));

  private OfferStateMachine() {}

  public static boolean canTransition(OfferStatus from, OfferStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<OfferStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(OfferStatus from, OfferStatus to) {
    if (!canTransition(from, to)) {
      throw new DealValidationException(
          "Invalid offer status transition from " + from + " to " + to);
    }
  }

  public static boolean canCancel(OfferStatus from) {
    return from != null && !from.isTerminal();
  }
}
