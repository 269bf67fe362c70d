package com.tradefeed.ingest.health;

import com.tradefeed.domain.trades.Pair;
import com.tradefeed.infra.redis.publisher.TradeStreamPublisher;
import com.tradefeed.ingest.discovery.PairDiscoveryService;
import com.tradefeed.ingest.ingest.TradeIngestService;
import java.util.List;
import java.util.Objects;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Aggregates publisher, ingest and discovery state for the operational endpoints.
 *
 * <p>Health checks run in a fixed order and report the first failing condition: publisher present,
 * broker reachable, at least one streaming connection.
 */
public class IngestHealthService {
  private final ObjectProvider<TradeStreamPublisher> publisherProvider;
  private final TradeIngestService ingestService;
  private final PairDiscoveryService discoveryService;

  public IngestHealthService(
      ObjectProvider<TradeStreamPublisher> publisherProvider,
      TradeIngestService ingestService,
      PairDiscoveryService discoveryService) {
    this.publisherProvider =
        Objects.requireNonNull(publisherProvider, "publisherProvider is required");
    this.ingestService = Objects.requireNonNull(ingestService, "ingestService is required");
    this.discoveryService =
        Objects.requireNonNull(discoveryService, "discoveryService is required");
  }

  public IngestHealth health() {
    int active = ingestService.getStats().activeConnections();
    TradeStreamPublisher publisher = publisherProvider.getIfAvailable();
    if (publisher == null) {
      return IngestHealth.degraded(IngestHealth.PUBLISHER_NOT_INITIALIZED, active);
    }
    if (!publisher.isHealthy()) {
      return IngestHealth.degraded(IngestHealth.BROKER_NOT_CONNECTED, active);
    }
    if (active <= 0) {
      return IngestHealth.degraded(IngestHealth.NO_ACTIVE_CONNECTIONS, active);
    }
    return IngestHealth.up(active);
  }

  public IngestStatsReport stats() {
    TradeStreamPublisher publisher = publisherProvider.getIfAvailable();
    return new IngestStatsReport(
        publisher == null ? null : publisher.getStats(),
        ingestService.getStats(),
        discoveryService.getPairs(),
        ingestService.connections());
  }

  public List<Pair> pairs() {
    return discoveryService.getPairs();
  }
}
