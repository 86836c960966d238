package com.otcdesk.deskapi.api;

import com.otcdesk.deskapi.health.ConfiguredChains;
import com.otcdesk.domain.deals.Chain;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class VersionController {
  private static final String DEFAULT_APP_NAME = "desk-api";
  private static final String DEFAULT_VERSION = "unknown";

  private final ObjectProvider<BuildProperties> buildPropertiesProvider;
  private final ConfiguredChains configuredChains;
  private final String applicationName;

  public VersionController(
      ObjectProvider<BuildProperties> buildPropertiesProvider,
      ConfiguredChains configuredChains,
      @Value("${spring.application.name:" + DEFAULT_APP_NAME + "}") String applicationName) {
    this.buildPropertiesProvider = buildPropertiesProvider;
    this.configuredChains = configuredChains;
    this.applicationName = applicationName;
  }

  @GetMapping("/version")
  public VersionResponse version() {
    List<String> chains = configuredChains.chains().stream().map(Chain::id).toList();
    BuildProperties buildProperties = buildPropertiesProvider.getIfAvailable();
    if (buildProperties == null) {
      return new VersionResponse(applicationName, DEFAULT_VERSION, null, chains);
    }

    String version = buildProperties.getVersion();
    if (version == null || version.isBlank()) {
      version = DEFAULT_VERSION;
    }
    return new VersionResponse(applicationName, version, buildProperties.getTime(), chains);
  }
}
