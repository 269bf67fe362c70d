package com.tradefeed.infra.redis.publisher;

import com.tradefeed.infra.redis.observability.StreamTelemetry;
import com.tradefeed.infra.redis.streams.StreamKeys;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStreamCommands.XAddOptions;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.connection.stream.StringRecord;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisTradeStreamPublisher implements TradeStreamPublisher {
  private static final Logger log = LoggerFactory.getLogger(RedisTradeStreamPublisher.class);
  private static final String TIMESTAMP_FIELD = "timestamp";
  private static final String PONG = "PONG";

  private final StringRedisTemplate redisTemplate;
  private final StreamKeys streamKeys;
  private final StreamTelemetry telemetry;
  private final XAddOptions addOptions;
  private final Clock clock;
  private final AtomicBoolean connected = new AtomicBoolean(false);
  private final AtomicLong publishCount = new AtomicLong();
  private final AtomicLong errorCount = new AtomicLong();

  public RedisTradeStreamPublisher(
      StringRedisTemplate redisTemplate,
      StreamKeys streamKeys,
      StreamTelemetry telemetry,
      long maxLength,
      boolean approximateTrimming,
      Clock clock) {
    this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate is required");
    this.streamKeys = Objects.requireNonNull(streamKeys, "streamKeys is required");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    if (maxLength <= 0L) {
      throw new IllegalArgumentException("maxLength must be > 0");
    }
    this.addOptions = XAddOptions.maxlen(maxLength).approximateTrimming(approximateTrimming);
  }

  @Override
  public void connect() {
    connected.set(true);
    if (ping()) {
      log.info("Redis stream publisher connected");
    } else {
      log.warn("Redis stream publisher started but broker did not answer PING");
    }
  }

  @Override
  public void disconnect() {
    if (connected.compareAndSet(true, false)) {
      log.info(
          "Redis stream publisher disconnected publishCount={} errorCount={}",
          publishCount.get(),
          errorCount.get());
    }
  }

  @Override
  public boolean publish(String pair, Map<String, ?> record) {
    long started = System.nanoTime();
    String streamKey = null;
    try {
      streamKey = streamKeys.forPair(pair);
      StringRecord entry = StreamRecords.string(stringify(record)).withStreamKey(streamKey);
      RecordId recordId =
          redisTemplate.execute(
              (RedisCallback<RecordId>)
                  connection -> ((StringRedisConnection) connection).xAdd(entry, addOptions));
      if (recordId == null) {
        throw new IllegalStateException("XADD returned no record id");
      }
      publishCount.incrementAndGet();
      telemetry.onPublishSuccess(streamKey, System.nanoTime() - started);
      return true;
    } catch (RuntimeException ex) {
      errorCount.incrementAndGet();
      StreamPublishException publishException =
          new StreamPublishException(
              streamKey, "Failed to append record to stream pair=" + pair, ex);
      telemetry.onPublishFailure(streamKey, publishException);
      log.warn(
          "Stream publish failed pair={} streamKey={} error={}",
          pair,
          streamKey,
          ex.getMessage());
      return false;
    }
  }

  @Override
  public boolean isHealthy() {
    return connected.get() && ping();
  }

  @Override
  public PublisherStats getStats() {
    return PublisherStats.of(publishCount.get(), errorCount.get());
  }

  private boolean ping() {
    try {
      String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
      return PONG.equalsIgnoreCase(reply);
    } catch (RuntimeException ex) {
      log.debug("Redis PING failed", ex);
      return false;
    }
  }

  private Map<String, String> stringify(Map<String, ?> record) {
    if (record == null || record.isEmpty()) {
      throw new IllegalArgumentException("record must not be empty");
    }
    Map<String, String> fields = new LinkedHashMap<>();
    for (Map.Entry<String, ?> field : record.entrySet()) {
      Object value = field.getValue();
      fields.put(field.getKey(), value == null ? "" : value.toString());
    }
    String timestamp = fields.get(TIMESTAMP_FIELD);
    if (timestamp == null || timestamp.isBlank()) {
      fields.put(TIMESTAMP_FIELD, Instant.now(clock).toString());
    }
    return fields;
  }
}
