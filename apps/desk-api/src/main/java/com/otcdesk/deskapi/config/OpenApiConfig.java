package com.otcdesk.deskapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
  private static final String DEFAULT_APP_NAME = "desk-api";
  private static final String DEFAULT_VERSION = "unknown";

  @Bean
  public OpenAPI deskApiOpenApi(
      ObjectProvider<BuildProperties> buildPropertiesProvider,
      @Value("${spring.application.name:" + DEFAULT_APP_NAME + "}") String applicationName) {
    BuildProperties buildProperties = buildPropertiesProvider.getIfAvailable();
    String version = buildProperties != null ? buildProperties.getVersion() : DEFAULT_VERSION;
    if (version == null || version.isBlank()) {
      version = DEFAULT_VERSION;
    }

    return new OpenAPI()
        .info(
            new Info()
                .title(applicationName)
                .version(version)
                .description("OTC desk settlement and reconciliation API"));
  }

  @Bean
  public GroupedOpenApi publicApiGroup() {
    return GroupedOpenApi.builder()
        .group("public")
        .pathsToMatch("/v1/**")
        .pathsToExclude("/v1/version", "/v1/reconciliation/**")
        .build();
  }

  @Bean
  public GroupedOpenApi opsApiGroup() {
    return GroupedOpenApi.builder()
        .group("ops")
        .pathsToMatch(
            "/v1/version", "/v1/reconciliation/**", "/actuator/health", "/actuator/health/**")
        .build();
  }
}
