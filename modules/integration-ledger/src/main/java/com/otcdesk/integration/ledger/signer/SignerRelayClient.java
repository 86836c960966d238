package com.otcdesk.integration.ledger.signer;

import com.otcdesk.integration.ledger.TxRef;

public interface SignerRelayClient {
  TxRef submit(RelayTransaction transaction);
}
