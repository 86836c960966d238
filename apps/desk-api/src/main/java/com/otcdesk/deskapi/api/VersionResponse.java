package com.otcdesk.deskapi.api;

import java.time.Instant;
import java.util.List;

public record VersionResponse(
    String application, String version, Instant buildTime, List<String> chains) {}
