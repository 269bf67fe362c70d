package com.tradefeed.ingest.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradefeed.ingest.health.IngestHealth;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    String status,
    String broker,
    @JsonProperty("websocket_connections") Integer websocketConnections,
    String reason) {
  static final String HEALTHY = "healthy";
  static final String UNHEALTHY = "unhealthy";
  static final String CONNECTED = "connected";

  static HealthResponse from(IngestHealth health) {
    if (health.healthy()) {
      return new HealthResponse(HEALTHY, CONNECTED, health.websocketConnections(), null);
    }
    return new HealthResponse(UNHEALTHY, null, null, health.reason());
  }
}
