package com.otcdesk.integration.ledger.alt;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Sequential little-endian reader over a Borsh-encoded program account. */
final class BorshReader {
  private final ByteBuffer buffer;

  BorshReader(byte[] data) {
    this.buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
  }

  byte[] bytes(int length) {
    byte[] out = new byte[length];
    buffer.get(out);
    return out;
  }

  BorshReader skipTo(int offset) {
    buffer.position(offset);
    return this;
  }

  String pubkey() {
    return Base58.encode(bytes(32));
  }

  boolean bool() {
    return buffer.get() != 0;
  }

  int u8() {
    return Byte.toUnsignedInt(buffer.get());
  }

  int u16() {
    return Short.toUnsignedInt(buffer.getShort());
  }

  long u32() {
    return Integer.toUnsignedLong(buffer.getInt());
  }

  BigInteger u64() {
    long raw = buffer.getLong();
    BigInteger value = BigInteger.valueOf(raw & Long.MAX_VALUE);
    return raw < 0 ? value.setBit(63) : value;
  }

  long i64() {
    return buffer.getLong();
  }
}
