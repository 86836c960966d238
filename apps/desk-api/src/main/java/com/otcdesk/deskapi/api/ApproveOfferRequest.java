package com.otcdesk.deskapi.api;

import jakarta.validation.constraints.Size;

public record ApproveOfferRequest(@Size(max = 128) String quoteId) {}
