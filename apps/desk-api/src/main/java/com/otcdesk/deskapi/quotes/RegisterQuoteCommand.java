package com.otcdesk.deskapi.quotes;

import com.otcdesk.domain.deals.Chain;

public record RegisterQuoteCommand(
    String quoteId,
    Chain chain,
    String beneficiary,
    String tokenId,
    int discountBps,
    int lockupDays) {}
