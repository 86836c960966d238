package com.otcdesk.integration.ledger;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.LedgerFamily;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.PaymentCurrency;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Read/write gateway to one ledger family. Implementations hold no state of their own.
 *
 * <p>Write operations broadcast irreversible transactions and are never retried here: a {@link
 * ChainException} of kind {@code TRANSIENT} means the outcome of the submission is unknown and the
 * caller must re-read ledger state before deciding to submit again.
 */
public interface LedgerAdapter {
  LedgerFamily family();

  /** Rejects ids that are malformed for this ledger family. */
  void validateRecordId(String id);

  Optional<Consignment> readConsignment(Chain chain, String id);

  Optional<Offer> readOffer(Chain chain, String id);

  TxRef approveOffer(Chain chain, String id);

  TxRef payOffer(Chain chain, String id, BigInteger amount, PaymentCurrency currency);

  TxRef cancelOffer(Chain chain, String id);

  ConfirmationStatus waitForConfirmation(Chain chain, TxRef txRef);

  /** Decimals of the payment asset as encoded on this ledger. */
  int paymentDecimals(Chain chain, PaymentCurrency currency);

  /** Identity of the custodial signer used for writes on {@code chain}. */
  String signerIdentity(Chain chain);

  long latestHeight(Chain chain);
}
