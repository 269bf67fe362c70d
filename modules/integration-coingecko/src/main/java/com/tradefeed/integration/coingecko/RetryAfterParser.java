package com.tradefeed.integration.coingecko;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns a {@code Retry-After} header into a wait. CoinGecko sends delay seconds; the HTTP-date
 * form is accepted as well and a date in the past means no wait.
 */
public class RetryAfterParser {
  private static final Pattern DELAY_SECONDS = Pattern.compile("\\d{1,9}");

  private final Clock clock;

  public RetryAfterParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public Optional<Duration> parse(String headerValue) {
    String value = headerValue == null ? "" : headerValue.trim();
    if (value.isEmpty()) {
      return Optional.empty();
    }
    if (DELAY_SECONDS.matcher(value).matches()) {
      return Optional.of(Duration.ofSeconds(Long.parseLong(value)));
    }
    return httpDate(value).map(this::untilNow);
  }

  private Duration untilNow(Instant retryAt) {
    Duration wait = Duration.between(clock.instant(), retryAt);
    return wait.isNegative() ? Duration.ZERO : wait;
  }

  private static Optional<Instant> httpDate(String value) {
    try {
      return Optional.of(DateTimeFormatter.RFC_1123_DATE_TIME.parse(value, Instant::from));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
