package com.tradefeed.ingest.ingest;

import com.tradefeed.domain.trades.ConnectionSnapshot;
import com.tradefeed.domain.trades.NormalizedTrade;
import com.tradefeed.domain.trades.Pair;
import com.tradefeed.domain.trades.PairChunks;
import com.tradefeed.domain.trades.StreamRecord;
import com.tradefeed.infra.redis.publisher.TradeStreamPublisher;
import com.tradefeed.integration.binance.BinanceStreamTransport;
import com.tradefeed.integration.binance.BinanceTradeFrameParser;
import com.tradefeed.integration.binance.BinanceTradeStreamConfig;
import com.tradefeed.integration.binance.BinanceTradeStreamConnection;
import com.tradefeed.integration.binance.BinanceTradeStreamEventHandler;
import com.tradefeed.integration.binance.FrameOutcome;
import com.tradefeed.integration.binance.TradeFrameParseException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one supervised trade stream connection per chunk of pairs and publishes every normalized
 * trade to its pair stream.
 */
public class TradeIngestService implements BinanceTradeStreamEventHandler {
  private static final Logger log = LoggerFactory.getLogger(TradeIngestService.class);
  private static final String FRAMES_COUNTER = "ingest.stream.frames.total";
  private static final String RECONNECTS_COUNTER = "ingest.stream.reconnects.total";
  private static final String FAILED_COUNTER = "ingest.stream.connections.failed";
  private static final String ACTIVE_GAUGE = "ingest.stream.connections.active";

  private final BinanceStreamTransport transport;
  private final BinanceTradeStreamConfig streamConfig;
  private final BinanceTradeFrameParser parser;
  private final Supplier<TradeStreamPublisher> publisher;
  private final IngestStats stats;
  private final MeterRegistry meterRegistry;
  private final Duration shutdownTimeout;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final List<BinanceTradeStreamConnection> connections = new CopyOnWriteArrayList<>();
  private volatile ExecutorService executor;

  public TradeIngestService(
      BinanceStreamTransport transport,
      BinanceTradeStreamConfig streamConfig,
      BinanceTradeFrameParser parser,
      TradeStreamPublisher publisher,
      IngestStats stats,
      MeterRegistry meterRegistry,
      Duration shutdownTimeout) {
    this(
        transport,
        streamConfig,
        parser,
        requirePublisher(publisher),
        stats,
        meterRegistry,
        shutdownTimeout);
  }

  /** Resolves the publisher on first use; the lifecycle only starts streams once one exists. */
  public TradeIngestService(
      BinanceStreamTransport transport,
      BinanceTradeStreamConfig streamConfig,
      BinanceTradeFrameParser parser,
      Supplier<TradeStreamPublisher> publisher,
      IngestStats stats,
      MeterRegistry meterRegistry,
      Duration shutdownTimeout) {
    this.transport = Objects.requireNonNull(transport, "transport is required");
    this.streamConfig = Objects.requireNonNull(streamConfig, "streamConfig is required");
    this.parser = Objects.requireNonNull(parser, "parser is required");
    this.publisher = Objects.requireNonNull(publisher, "publisher is required");
    this.stats = Objects.requireNonNull(stats, "stats is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.shutdownTimeout =
        shutdownTimeout == null ? Duration.ofSeconds(5) : shutdownTimeout;
    Gauge.builder(ACTIVE_GAUGE, stats, IngestStats::activeConnections).register(meterRegistry);
  }

  /** Starts one connection per chunk of pairs. Later calls are ignored. */
  public void start(List<Pair> pairs) {
    if (!started.compareAndSet(false, true)) {
      log.info("Trade ingest already started connections={}", connections.size());
      return;
    }
    List<List<Pair>> chunks = PairChunks.partition(pairs, streamConfig.pairsPerConnection());
    if (chunks.isEmpty()) {
      log.warn("Trade ingest started without pairs");
      return;
    }
    ExecutorService pool = Executors.newFixedThreadPool(chunks.size(), streamThreadFactory());
    executor = pool;
    for (int i = 0; i < chunks.size(); i++) {
      BinanceTradeStreamConnection connection =
          new BinanceTradeStreamConnection(
              "conn-" + i, chunks.get(i), transport, streamConfig, streamConfig.backoff(), this);
      connections.add(connection);
      pool.execute(connection);
    }
    log.info(
        "Trade ingest started pairs={} connections={} pairsPerConnection={}",
        chunks.stream().mapToInt(List::size).sum(),
        chunks.size(),
        streamConfig.pairsPerConnection());
  }

  public void stop() {
    connections.forEach(BinanceTradeStreamConnection::stop);
    ExecutorService pool = executor;
    if (pool == null) {
      return;
    }
    pool.shutdown();
    try {
      if (!pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Trade stream threads still running after {}ms", shutdownTimeout.toMillis());
        pool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      pool.shutdownNow();
    }
    log.info("Trade ingest stopped stats={}", stats.snapshot());
  }

  /** Normalizes one raw frame without side effects. */
  public Optional<NormalizedTrade> convert(String rawFrame) {
    return parser.parse(rawFrame);
  }

  public IngestStatsSnapshot getStats() {
    return stats.snapshot();
  }

  public List<ConnectionSnapshot> connections() {
    return connections.stream().map(BinanceTradeStreamConnection::snapshot).toList();
  }

  @Override
  public FrameOutcome onFrame(String connectionId, String payload) {
    Optional<NormalizedTrade> converted;
    try {
      converted = convert(payload);
    } catch (TradeFrameParseException ex) {
      stats.malformedFrame();
      log.debug("Malformed trade frame connectionId={} error={}", connectionId, ex.getMessage());
      return countFrame(FrameOutcome.MALFORMED);
    }
    if (converted.isEmpty()) {
      return countFrame(FrameOutcome.IGNORED);
    }
    NormalizedTrade trade = converted.get();
    stats.tradeReceived();
    boolean published =
        publisher.get().publish(trade.pair().symbol(), StreamRecord.from(trade).fields());
    return countFrame(published ? FrameOutcome.PUBLISHED : FrameOutcome.PUBLISH_FAILED);
  }

  @Override
  public void onConnected(String connectionId, List<Pair> pairs) {
    stats.connectionOpened();
  }

  @Override
  public void onDisconnected(String connectionId, int statusCode, String reason) {
    stats.connectionClosed();
    log.info(
        "Trade stream disconnected connectionId={} status={} reason={}",
        connectionId,
        statusCode,
        reason);
  }

  @Override
  public void onConnectionError(
      String connectionId, String errorCode, String errorMessage, Throwable error) {
    stats.connectionError();
  }

  @Override
  public void onReconnectScheduled(String connectionId, int retryCount, Duration delay) {
    meterRegistry.counter(RECONNECTS_COUNTER).increment();
  }

  @Override
  public void onFailed(String connectionId, int retryCount) {
    meterRegistry.counter(FAILED_COUNTER).increment();
  }

  private FrameOutcome countFrame(FrameOutcome outcome) {
    meterRegistry
        .counter(FRAMES_COUNTER, "outcome", outcome.name().toLowerCase(Locale.ROOT))
        .increment();
    return outcome;
  }

  private static ThreadFactory streamThreadFactory() {
    AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "trade-stream-" + sequence.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static Supplier<TradeStreamPublisher> requirePublisher(TradeStreamPublisher publisher) {
    Objects.requireNonNull(publisher, "publisher is required");
    return () -> publisher;
  }
}
