package com.otcdesk.deskapi.api;

import java.util.List;

public record OffersResponse(List<OfferResponse> offers, int limit) {}
