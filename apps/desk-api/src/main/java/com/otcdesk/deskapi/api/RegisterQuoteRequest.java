package com.otcdesk.deskapi.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterQuoteRequest(
    @Size(max = 128) String quoteId,
    @NotBlank String chain,
    @NotBlank String beneficiary,
    @NotBlank String tokenId,
    @Min(0) @Max(10_000) int discountBps,
    @Min(0) @Max(3650) int lockupDays) {}
