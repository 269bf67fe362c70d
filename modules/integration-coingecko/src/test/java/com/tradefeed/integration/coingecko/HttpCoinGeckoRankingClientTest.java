package com.tradefeed.integration.coingecko;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpCoinGeckoRankingClientTest {
  private MockWebServer server;
  private SimpleMeterRegistry registry;
  private List<Duration> waits;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    registry = new SimpleMeterRegistry();
    waits = new ArrayList<>();
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void shouldRequestMarketsOrderedByMarketCap() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                """
                [
                  {"id":"ethereum","symbol":"eth","market_cap_rank":2},
                  {"id":"bitcoin","symbol":"btc","market_cap_rank":1},
                  {"id":"unranked","symbol":"unr","market_cap_rank":null}
                ]
                """));

    List<RankedCoin> coins = client(null).getTopByMarketCap(3);

    assertEquals(
        List.of(new RankedCoin("bitcoin", "BTC", 1), new RankedCoin("ethereum", "ETH", 2)), coins);
    RecordedRequest recorded = server.takeRequest();
    assertEquals("GET", recorded.getMethod());
    assertEquals(
        "/api/v3/coins/markets?vs_currency=usd&order=market_cap_desc&per_page=3&page=1",
        recorded.getPath());
    assertNull(recorded.getHeader(HttpCoinGeckoRankingClient.PRO_API_KEY_HEADER));
  }

  @Test
  void shouldSendProApiKeyWhenConfigured() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

    client("cg-pro-key").getTopByMarketCap(10);

    assertEquals(
        "cg-pro-key", server.takeRequest().getHeader(HttpCoinGeckoRankingClient.PRO_API_KEY_HEADER));
  }

  @Test
  void shouldPageThroughLargeRankings() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).setBody(page(1, 250)));
    server.enqueue(new MockResponse().setResponseCode(200).setBody(page(251, 250)));

    List<RankedCoin> coins = client(null).getTopByMarketCap(300);

    assertEquals(300, coins.size());
    assertEquals(300, coins.get(299).marketCapRank());
    assertEquals(
        "/api/v3/coins/markets?vs_currency=usd&order=market_cap_desc&per_page=250&page=1",
        server.takeRequest().getPath());
    assertEquals(
        "/api/v3/coins/markets?vs_currency=usd&order=market_cap_desc&per_page=250&page=2",
        server.takeRequest().getPath());
  }

  @Test
  void shouldRetryRateLimitedRequestUsingRetryAfter() {
    server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "2"));
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody("[{\"id\":\"bitcoin\",\"symbol\":\"btc\",\"market_cap_rank\":1}]"));

    List<RankedCoin> coins = client(null).getTopByMarketCap(1);

    assertEquals(1, coins.size());
    assertEquals(List.of(Duration.ofSeconds(2)), waits);
    assertEquals(
        1.0d, registry.get("connector.coingecko.rate_limit.retry").counter().count());
  }

  @Test
  void shouldFailAfterRetriesAreExhausted() {
    server.enqueue(new MockResponse().setResponseCode(429));
    server.enqueue(new MockResponse().setResponseCode(429));
    server.enqueue(new MockResponse().setResponseCode(429));

    CoinGeckoClientException ex =
        assertThrows(CoinGeckoClientException.class, () -> client(null).getTopByMarketCap(5));

    assertEquals(429, ex.httpStatus());
    assertEquals(List.of(Duration.ofMillis(100L), Duration.ofMillis(200L)), waits);
    assertEquals(
        1.0d, registry.get("connector.coingecko.rate_limit.exhausted").counter().count());
  }

  @Test
  void shouldNotRetryServerErrors() {
    server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":\"boom\"}"));

    CoinGeckoClientException ex =
        assertThrows(CoinGeckoClientException.class, () -> client(null).getTopByMarketCap(5));

    assertEquals(500, ex.httpStatus());
    assertEquals(1, server.getRequestCount());
  }

  private HttpCoinGeckoRankingClient client(String apiKey) {
    CoinGeckoApiConfig config =
        new CoinGeckoApiConfig(
            server.url("/api/v3").uri(),
            apiKey,
            Duration.ofSeconds(3),
            3,
            Duration.ofMillis(100L),
            Duration.ofSeconds(5));
    RateLimitRetryExecutor retryExecutor =
        new RateLimitRetryExecutor(
            config, new RetryAfterParser(Clock.systemUTC()), waits::add, registry);
    return new HttpCoinGeckoRankingClient(
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
        new ObjectMapper(),
        config,
        retryExecutor);
  }

  private static String page(int firstRank, int size) {
    StringBuilder body = new StringBuilder("[");
    for (int i = 0; i < size; i++) {
      int rank = firstRank + i;
      if (i > 0) {
        body.append(',');
      }
      body.append("{\"id\":\"coin-")
          .append(rank)
          .append("\",\"symbol\":\"c")
          .append(rank)
          .append("\",\"market_cap_rank\":")
          .append(rank)
          .append('}');
    }
    return body.append(']').toString();
  }
}
