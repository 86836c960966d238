package com.otcdesk.integration.ledger.alt;

import java.math.BigInteger;
import java.util.Arrays;

/** Bitcoin-alphabet base58, used for alternate-ledger account keys. */
public final class Base58 {
  private static final String ALPHABET =
      "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
  private static final BigInteger BASE = BigInteger.valueOf(58);

  private Base58() {}

  public static String encode(byte[] input) {
    if (input.length == 0) {
      return "";
    }
    int leadingZeros = 0;
    while (leadingZeros < input.length && input[leadingZeros] == 0) {
      leadingZeros++;
    }
    StringBuilder encoded = new StringBuilder();
    BigInteger value = new BigInteger(1, input);
    while (value.signum() > 0) {
      BigInteger[] divRem = value.divideAndRemainder(BASE);
      encoded.append(ALPHABET.charAt(divRem[1].intValue()));
      value = divRem[0];
    }
    for (int i = 0; i < leadingZeros; i++) {
      encoded.append(ALPHABET.charAt(0));
    }
    return encoded.reverse().toString();
  }

  public static byte[] decode(String input) {
    if (input == null || input.isEmpty()) {
      return new byte[0];
    }
    BigInteger value = BigInteger.ZERO;
    int leadingZeros = 0;
    boolean leading = true;
    for (int i = 0; i < input.length(); i++) {
      int digit = ALPHABET.indexOf(input.charAt(i));
      if (digit < 0) {
        throw new IllegalArgumentException("Invalid base58 character '" + input.charAt(i) + "'");
      }
      if (leading && digit == 0) {
        leadingZeros++;
      } else {
        leading = false;
      }
      value = value.multiply(BASE).add(BigInteger.valueOf(digit));
    }
    byte[] magnitude = value.signum() == 0 ? new byte[0] : value.toByteArray();
    if (magnitude.length > 1 && magnitude[0] == 0) {
      magnitude = Arrays.copyOfRange(magnitude, 1, magnitude.length);
    }
    byte[] decoded = new byte[leadingZeros + magnitude.length];
    System.arraycopy(magnitude, 0, decoded, leadingZeros, magnitude.length);
    return decoded;
  }

  /** True when {@code input} decodes to exactly 32 bytes. */
  public static boolean isPublicKey(String input) {
    try {
      return decode(input).length == 32;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }
}
