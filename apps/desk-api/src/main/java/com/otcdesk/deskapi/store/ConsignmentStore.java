package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

public interface ConsignmentStore {
  Optional<StoredConsignment> find(Chain chain, String consignmentId);

  StoredConsignment insertIfAbsent(Consignment consignment);

  List<StoredConsignment> findByFilter(
      Chain chain, ConsignmentStatus status, String consigner, int limit);

  /** Consignments that are active or paused. */
  List<StoredConsignment> findActive(int limit);

  ConditionalWrite updateLedgerState(
      Chain chain,
      String consignmentId,
      long expectedVersion,
      BigInteger remainingAmount,
      ConsignmentStatus status);
}
