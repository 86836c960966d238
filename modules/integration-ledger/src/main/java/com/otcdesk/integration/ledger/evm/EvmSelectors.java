package com.otcdesk.integration.ledger.evm;

/** Function selectors: first four bytes of keccak256 of the canonical signature. */
public final class EvmSelectors {
  public static final String OFFERS = "0x8a72ea6a"; // offers(uint256)
  public static final String CONSIGNMENTS = "0x7244fe04"; // consignments(uint256)
  public static final String APPROVE_OFFER = "0xa5d7c10a"; // approveOffer(uint256)
  public static final String FULFILL_OFFER = "0xc78545d9"; // fulfillOffer(uint256)
  public static final String CANCEL_OFFER = "0xef706adf"; // cancelOffer(uint256)

  public static final String DECIMALS = "0x313ce567"; // decimals()
  public static final String SLOT0 = "0x3850c7bd"; // slot0()
  public static final String LIQUIDITY = "0x1a686502"; // liquidity()
  public static final String TOKEN0 = "0x0dfe1681"; // token0()
  public static final String GET_POOL = "0x1698ee82"; // getPool(address,address,uint24)
  public static final String GET_PAIR = "0xe6a43905"; // getPair(address,address)
  public static final String GET_RESERVES = "0x0902f1ac"; // getReserves()

  private EvmSelectors() {}
}
