package com.otcdesk.deskapi.api;

import java.util.List;

public record ConsignmentsResponse(List<ConsignmentResponse> consignments, int limit) {}
