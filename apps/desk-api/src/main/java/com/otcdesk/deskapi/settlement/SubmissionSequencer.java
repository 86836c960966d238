package com.otcdesk.deskapi.settlement;

import com.otcdesk.domain.deals.Chain;
import java.util.function.Supplier;

/**
 * Serializes transaction submission per {@code (chain, signer)} across every process sharing the
 * store. Only the submission runs inside; confirmation waits happen outside.
 */
public interface SubmissionSequencer {
  <T> T submit(Chain chain, String signer, Supplier<T> submission);
}
