package com.tradefeed.ingest.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradefeed.domain.trades.ConnectionSnapshot;
import com.tradefeed.domain.trades.Pair;
import com.tradefeed.infra.redis.publisher.PublisherStats;
import com.tradefeed.ingest.health.IngestStatsReport;
import com.tradefeed.ingest.ingest.IngestStatsSnapshot;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatsResponse(
    PublisherView publisher,
    IngestStatsSnapshot ingest,
    @JsonProperty("pairs_count") int pairsCount,
    @JsonProperty("pairs_sample") List<String> pairsSample,
    List<ConnectionView> connections) {
  static final int PAIRS_SAMPLE_SIZE = 10;

  static StatsResponse from(IngestStatsReport report) {
    List<String> symbols = report.pairs().stream().map(Pair::symbol).toList();
    return new StatsResponse(
        report.publisher() == null ? null : PublisherView.from(report.publisher()),
        report.ingest(),
        symbols.size(),
        symbols.stream().limit(PAIRS_SAMPLE_SIZE).toList(),
        report.connections().stream().map(ConnectionView::from).toList());
  }

  public record PublisherView(
      @JsonProperty("publish_count") long publishCount,
      @JsonProperty("error_count") long errorCount,
      @JsonProperty("error_rate") double errorRate) {
    static PublisherView from(PublisherStats stats) {
      return new PublisherView(stats.publishCount(), stats.errorCount(), stats.errorRate());
    }
  }

  public record ConnectionView(
      @JsonProperty("connection_id") String connectionId,
      String status,
      @JsonProperty("pairs_count") int pairsCount,
      @JsonProperty("retry_count") int retryCount,
      boolean active,
      long messages,
      long errors) {
    static ConnectionView from(ConnectionSnapshot snapshot) {
      return new ConnectionView(
          snapshot.connectionId(),
          snapshot.status().name(),
          snapshot.pairs().size(),
          snapshot.retryCount(),
          snapshot.active(),
          snapshot.messages(),
          snapshot.errors());
    }
  }
}
