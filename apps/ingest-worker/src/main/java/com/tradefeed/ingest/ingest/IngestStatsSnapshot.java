package com.tradefeed.ingest.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestStatsSnapshot(
    @JsonProperty("active_connections") int activeConnections,
    @JsonProperty("total_messages") long totalMessages,
    @JsonProperty("error_messages") long errorMessages,
    @JsonProperty("connection_errors") long connectionErrors) {}
