package com.tradefeed.ingest.ingest;

import com.tradefeed.infra.redis.publisher.TradeStreamPublisher;
import com.tradefeed.ingest.discovery.PairDiscoveryService;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/** Connects the publisher, waits for the first pair discovery, then opens the trade streams. */
public class TradeIngestLifecycle {
  private static final Logger log = LoggerFactory.getLogger(TradeIngestLifecycle.class);

  private final ObjectProvider<TradeStreamPublisher> publisher;
  private final PairDiscoveryService discoveryService;
  private final TradeIngestService ingestService;
  private final Duration startupTimeout;

  public TradeIngestLifecycle(
      ObjectProvider<TradeStreamPublisher> publisher,
      PairDiscoveryService discoveryService,
      TradeIngestService ingestService,
      Duration startupTimeout) {
    this.publisher = Objects.requireNonNull(publisher, "publisher is required");
    this.discoveryService =
        Objects.requireNonNull(discoveryService, "discoveryService is required");
    this.ingestService = Objects.requireNonNull(ingestService, "ingestService is required");
    this.startupTimeout = Objects.requireNonNull(startupTimeout, "startupTimeout is required");
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    TradeStreamPublisher streamPublisher = publisher.getIfAvailable();
    if (streamPublisher == null) {
      log.error("No trade stream publisher configured, trade streams not started");
      return;
    }
    streamPublisher.connect();
    if (!discoveryService.awaitInitialRefresh(startupTimeout)) {
      log.warn(
          "Initial pair discovery not finished after {}ms, using current pairs",
          startupTimeout.toMillis());
    }
    ingestService.start(discoveryService.getPairs());
  }

  @PreDestroy
  public void stop() {
    ingestService.stop();
    publisher.ifAvailable(TradeStreamPublisher::disconnect);
  }
}
