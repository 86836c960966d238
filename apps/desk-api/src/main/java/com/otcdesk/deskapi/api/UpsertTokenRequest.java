package com.otcdesk.deskapi.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpsertTokenRequest(
    @NotBlank @Size(max = 128) String contractAddress,
    @NotBlank @Size(max = 32) String symbol,
    @Min(0) @Max(36) int decimals) {}
