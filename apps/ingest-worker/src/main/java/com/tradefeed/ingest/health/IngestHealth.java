package com.tradefeed.ingest.health;

public record IngestHealth(boolean healthy, String reason, int websocketConnections) {
  public static final String PUBLISHER_NOT_INITIALIZED = "publisher not initialized";
  public static final String BROKER_NOT_CONNECTED = "broker not connected";
  public static final String NO_ACTIVE_CONNECTIONS = "no active websocket connections";

  static IngestHealth up(int websocketConnections) {
    return new IngestHealth(true, null, websocketConnections);
  }

  static IngestHealth degraded(String reason, int websocketConnections) {
    return new IngestHealth(false, reason, websocketConnections);
  }
}
