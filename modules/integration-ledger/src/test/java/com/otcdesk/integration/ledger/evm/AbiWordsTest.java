package com.otcdesk.integration.ledger.evm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class AbiWordsTest {
  @Test
  void shouldEncodeSelectorFollowedByPaddedWords() {
    String calldata = AbiWords.encodeCall(EvmSelectors.OFFERS, BigInteger.valueOf(42));

    assertEquals(
        "0x8a72ea6a000000000000000000000000000000000000000000000000000000000000002a", calldata);
  }

  @Test
  void shouldEncodeAddressArgumentsLowercased() {
    String calldata =
        AbiWords.encodeCall(
            EvmSelectors.GET_PAIR,
            "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48",
            "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2");

    assertEquals(4 * 2 + 2 + 64 * 2, calldata.length());
    assertTrue(
        calldata.contains("000000000000000000000000a0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
  }

  @Test
  void shouldDecodeWordsByIndex() {
    String payload =
        "0x"
            + "0000000000000000000000000000000000000000000000000000000000000001"
            + "000000000000000000000000a0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"
            + "00000000000000000000000000000000000000000000021e19e0c9bab2400000";
    AbiWords words = AbiWords.decode(payload);

    assertEquals(3, words.size());
    assertTrue(words.bool(0));
    assertEquals("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", words.address(1));
    assertEquals(new BigInteger("10000000000000000000000"), words.uint(2));
    assertFalse(AbiWords.isZeroAddress(words.address(1)));
    assertTrue(AbiWords.isZeroAddress("0x0000000000000000000000000000000000000000"));
  }

  @Test
  void shouldRejectMisalignedPayloadAndNegativeArguments() {
    assertThrows(IllegalArgumentException.class, () -> AbiWords.decode("0x1234"));
    assertThrows(
        IllegalArgumentException.class,
        () -> AbiWords.encodeCall(EvmSelectors.OFFERS, BigInteger.valueOf(-1)));
  }
}
