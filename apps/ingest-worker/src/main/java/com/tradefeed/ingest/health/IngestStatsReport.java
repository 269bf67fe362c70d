package com.tradefeed.ingest.health;

import com.tradefeed.domain.trades.ConnectionSnapshot;
import com.tradefeed.domain.trades.Pair;
import com.tradefeed.infra.redis.publisher.PublisherStats;
import com.tradefeed.ingest.ingest.IngestStatsSnapshot;
import java.util.List;

public record IngestStatsReport(
    PublisherStats publisher,
    IngestStatsSnapshot ingest,
    List<Pair> pairs,
    List<ConnectionSnapshot> connections) {
  public IngestStatsReport {
    pairs = pairs == null ? List.of() : List.copyOf(pairs);
    connections = connections == null ? List.of() : List.copyOf(connections);
  }
}
