package com.otcdesk.domain.deals;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Computes the exact amount a payer owes for an offer, in the smallest unit of the payment asset.
 * USD amounts are carried with eight decimals; rounding of the final amount is always up so the
 * desk is never underpaid.
 */
public final class PaymentCalculator {
  private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000L);
  private static final BigInteger USD_SCALE = BigInteger.TEN.pow(Offer.PRICE_DECIMALS);

  private PaymentCalculator() {}

  public static PaymentAmount requiredPayment(
      Offer offer, int tokenDecimals, int paymentAssetDecimals) {
    Objects.requireNonNull(offer, "offer must not be null");
    if (tokenDecimals < 0 || paymentAssetDecimals < 0) {
      throw new DealValidationException("decimals must be >= 0");
    }
    if (offer.priceUsdPerToken8d().signum() <= 0) {
      throw new DealValidationException("offer " + offer.id() + " has no price snapshot");
    }

    BigInteger grossUsd8 =
        offer
            .tokenAmount()
            .multiply(offer.priceUsdPerToken8d())
            .divide(BigInteger.TEN.pow(tokenDecimals));
    BigInteger discountedUsd8 =
        grossUsd8
            .multiply(BPS_DENOMINATOR.subtract(BigInteger.valueOf(offer.discountBps())))
            .divide(BPS_DENOMINATOR);
    BigInteger paymentScale = BigInteger.TEN.pow(paymentAssetDecimals);

    BigInteger amount;
    if (offer.currency() == PaymentCurrency.NATIVE) {
      if (offer.nativeUsdPrice8d().signum() <= 0) {
        throw new DealValidationException("offer " + offer.id() + " has no native price snapshot");
      }
      amount = ceilDiv(discountedUsd8.multiply(paymentScale), offer.nativeUsdPrice8d());
    } else {
      amount = ceilDiv(discountedUsd8.multiply(paymentScale), USD_SCALE);
    }
    return new PaymentAmount(offer.currency(), amount, discountedUsd8);
  }

  static BigInteger ceilDiv(BigInteger numerator, BigInteger denominator) {
    BigInteger[] division = numerator.divideAndRemainder(denominator);
    return division[1].signum() == 0 ? division[0] : division[0].add(BigInteger.ONE);
  }

  public record PaymentAmount(PaymentCurrency currency, BigInteger amount, BigInteger usd8) {}
}
