package com.tradefeed.ingest.config;

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

  @Bean
  public OpenAPI ingestWorkerOpenApi(
      ObjectProvider<BuildProperties> buildProperties,
      @Value("${spring.application.name:ingest-worker}") String applicationName) {
    String version =
        buildProperties.stream()
            .map(BuildProperties::getVersion)
            .filter(candidate -> candidate != null && !candidate.isBlank())
            .findFirst()
            .orElse("unknown");
    return new OpenAPI()
        .info(
            new Info()
                .title(applicationName)
                .version(version)
                .description("Health, counters and pair selection of the trade ingest worker"));
  }

  @Bean
  public GroupedOpenApi ingestOpsGroup() {
    return GroupedOpenApi.builder()
        .group("ops")
        .pathsToMatch("/health", "/stats", "/pairs", "/actuator/**")
        .build();
  }
}
