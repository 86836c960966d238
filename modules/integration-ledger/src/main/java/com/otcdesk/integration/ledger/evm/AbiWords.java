package com.otcdesk.integration.ledger.evm;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Encoding of static ABI arguments and decoding of tuples made only of 32-byte words. */
public final class AbiWords {
  private static final int WORD_HEX_LENGTH = 64;
  private static final BigInteger MAX_UINT256 =
      BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

  private final List<String> words;

  private AbiWords(List<String> words) {
    this.words = words;
  }

  public static AbiWords decode(String hex) {
    String body = strip0x(hex);
    if (body.length() % WORD_HEX_LENGTH != 0) {
      throw new IllegalArgumentException(
          "ABI payload is not word aligned: length=" + body.length());
    }
    List<String> words = new ArrayList<>(body.length() / WORD_HEX_LENGTH);
    for (int offset = 0; offset < body.length(); offset += WORD_HEX_LENGTH) {
      words.add(body.substring(offset, offset + WORD_HEX_LENGTH));
    }
    return new AbiWords(words);
  }

  public static String encodeCall(String selector, Object... args) {
    StringBuilder data = new StringBuilder("0x").append(strip0x(selector));
    for (Object arg : args) {
      data.append(encodeWord(arg));
    }
    return data.toString();
  }

  public int size() {
    return words.size();
  }

  public BigInteger uint(int index) {
    return new BigInteger(word(index), 16);
  }

  public int uintAsInt(int index) {
    return uint(index).intValueExact();
  }

  public long uintAsLong(int index) {
    return uint(index).longValueExact();
  }

  public boolean bool(int index) {
    return uint(index).signum() != 0;
  }

  public String address(int index) {
    return "0x" + word(index).substring(24);
  }

  public String bytes32(int index) {
    return "0x" + word(index);
  }

  public static boolean isZeroAddress(String address) {
    return address == null || new BigInteger(strip0x(address), 16).signum() == 0;
  }

  private String word(int index) {
    if (index < 0 || index >= words.size()) {
      throw new IllegalArgumentException(
          "ABI word index " + index + " out of range, size=" + words.size());
    }
    return words.get(index);
  }

  private static String encodeWord(Object arg) {
    if (arg instanceof BigInteger value) {
      if (value.signum() < 0 || value.compareTo(MAX_UINT256) > 0) {
        throw new IllegalArgumentException("uint256 out of range: " + value);
      }
      return leftPad(value.toString(16));
    }
    if (arg instanceof Number number) {
      return encodeWord(BigInteger.valueOf(number.longValue()));
    }
    if (arg instanceof String address) {
      String body = strip0x(address).toLowerCase(Locale.ROOT);
      if (body.length() != 40) {
        throw new IllegalArgumentException("address must be 20 bytes: " + address);
      }
      return leftPad(body);
    }
    throw new IllegalArgumentException("Unsupported ABI argument type: " + arg);
  }

  private static String leftPad(String hex) {
    StringBuilder padded = new StringBuilder(WORD_HEX_LENGTH);
    for (int i = hex.length(); i < WORD_HEX_LENGTH; i++) {
      padded.append('0');
    }
    return padded.append(hex).toString();
  }

  static String strip0x(String hex) {
    if (hex == null) {
      return "";
    }
    return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
  }
}
