package com.tradefeed.integration.coingecko;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Retries calls rejected with HTTP 429, honouring {@code Retry-After} up to the max backoff. */
public class RateLimitRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RateLimitRetryExecutor.class);
  private static final String RETRY_COUNTER = "connector.coingecko.rate_limit.retry";
  private static final String EXHAUSTED_COUNTER = "connector.coingecko.rate_limit.exhausted";

  private final int maxAttempts;
  private final Duration baseBackoff;
  private final Duration maxBackoff;
  private final RetryAfterParser retryAfterParser;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public RateLimitRetryExecutor(
      CoinGeckoApiConfig config, RetryAfterParser retryAfterParser, MeterRegistry meterRegistry) {
    this(config, retryAfterParser, duration -> Thread.sleep(duration.toMillis()), meterRegistry);
  }

  public RateLimitRetryExecutor(
      CoinGeckoApiConfig config,
      RetryAfterParser retryAfterParser,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    Objects.requireNonNull(config, "config must not be null");
    this.maxAttempts = config.maxAttempts();
    this.baseBackoff = config.retryBaseBackoff();
    this.maxBackoff = config.retryMaxBackoff();
    this.retryAfterParser =
        Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (CoinGeckoClientException ex) {
        if (!ex.isRateLimited() || attempt >= maxAttempts) {
          if (ex.isRateLimited()) {
            meterRegistry.counter(EXHAUSTED_COUNTER).increment();
          }
          throw ex;
        }
        Duration wait = resolveBackoff(ex, attempt);
        meterRegistry.counter(RETRY_COUNTER).increment();
        log.warn(
            "CoinGecko rate limited attempt={} maxAttempts={} waitMs={}",
            attempt,
            maxAttempts,
            wait.toMillis());
        sleep(wait);
        attempt++;
      }
    }
  }

  private Duration resolveBackoff(CoinGeckoClientException ex, int attempt) {
    return ex.retryAfterHeader()
        .flatMap(retryAfterParser::parse)
        .map(retryAfter -> retryAfter.compareTo(maxBackoff) <= 0 ? retryAfter : maxBackoff)
        .orElseGet(() -> exponential(attempt));
  }

  private Duration exponential(int attempt) {
    long baseMs = baseBackoff.toMillis();
    long maxMs = maxBackoff.toMillis();
    double scaled = baseMs * Math.pow(2.0d, Math.max(0, attempt - 1));
    return Duration.ofMillis((long) Math.min((double) maxMs, scaled));
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new CoinGeckoClientException(
          "Interrupted during CoinGecko rate-limit backoff", -1, interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
