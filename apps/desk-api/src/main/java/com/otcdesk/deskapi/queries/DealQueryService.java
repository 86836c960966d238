package com.otcdesk.deskapi.queries;

import com.otcdesk.deskapi.store.ConsignmentStore;
import com.otcdesk.deskapi.store.OfferStore;
import com.otcdesk.deskapi.store.StoredConsignment;
import com.otcdesk.deskapi.store.StoredOffer;
import com.otcdesk.deskapi.store.TokenRepository;
import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.DealNotFoundException;
import com.otcdesk.domain.deals.OfferStatus;
import com.otcdesk.domain.deals.Token;
import java.util.List;
import org.springframework.stereotype.Service;

/** Read side over the local deal cache; never touches the ledger. */
@Service
public class DealQueryService {
  static final int MAX_PAGE_SIZE = 100;

  private final OfferStore offerStore;
  private final ConsignmentStore consignmentStore;
  private final TokenRepository tokenRepository;

  public DealQueryService(
      OfferStore offerStore, ConsignmentStore consignmentStore, TokenRepository tokenRepository) {
    this.offerStore = offerStore;
    this.consignmentStore = consignmentStore;
    this.tokenRepository = tokenRepository;
  }

  public StoredOffer findOffer(Chain chain, String offerId) {
    return offerStore
        .find(chain, offerId)
        .orElseThrow(() -> new DealNotFoundException("Offer", chain.id() + ":" + offerId));
  }

  public List<StoredOffer> listOffers(
      Chain chain, OfferStatus status, String beneficiary, int limit) {
    return offerStore.findByFilter(chain, status, beneficiary, clamp(limit));
  }

  public StoredConsignment findConsignment(Chain chain, String consignmentId) {
    return consignmentStore
        .find(chain, consignmentId)
        .orElseThrow(
            () -> new DealNotFoundException("Consignment", chain.id() + ":" + consignmentId));
  }

  public List<StoredConsignment> listConsignments(
      Chain chain, ConsignmentStatus status, String consigner, int limit) {
    return consignmentStore.findByFilter(chain, status, consigner, clamp(limit));
  }

  public Token registerToken(Token token) {
    tokenRepository.upsert(token);
    return findToken(token.chain(), token.ledgerTokenId());
  }

  public Token findToken(Chain chain, String ledgerTokenId) {
    return tokenRepository
        .find(chain, ledgerTokenId)
        .orElseThrow(() -> new DealNotFoundException("Token", chain.id() + ":" + ledgerTokenId));
  }

  public List<Token> listTokens(Chain chain) {
    return tokenRepository.findByChain(chain);
  }

  static int clamp(int limit) {
    return Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
  }
}
