package com.otcdesk.deskapi.settlement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.otcdesk.domain.deals.Chain;
import org.junit.jupiter.api.Test;

class AdvisoryLockSubmissionSequencerTest {

  @Test
  void lockKeyShouldBeStableForSameSigner() {
    assertEquals(
        AdvisoryLockSubmissionSequencer.lockKey(Chain.BASE, "0xsigner"),
        AdvisoryLockSubmissionSequencer.lockKey(Chain.BASE, "0xsigner"));
  }

  @Test
  void lockKeyShouldSeparateChainsAndSigners() {
    long base = AdvisoryLockSubmissionSequencer.lockKey(Chain.BASE, "0xsigner");

    assertNotEquals(base, AdvisoryLockSubmissionSequencer.lockKey(Chain.ETHEREUM, "0xsigner"));
    assertNotEquals(base, AdvisoryLockSubmissionSequencer.lockKey(Chain.BASE, "0xother"));
    assertTrue(base >= 0);
  }
}
