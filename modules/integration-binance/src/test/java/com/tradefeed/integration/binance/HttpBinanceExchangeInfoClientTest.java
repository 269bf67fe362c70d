package com.tradefeed.integration.binance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpBinanceExchangeInfoClientTest {
  private MockWebServer server;
  private HttpBinanceExchangeInfoClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();

    client =
        new HttpBinanceExchangeInfoClient(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
            new ObjectMapper(),
            new BinanceApiConfig(server.url("/").uri(), Duration.ofSeconds(3)));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void shouldListSymbolsFromExchangeInfo() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("exchange-info.json")));

    List<BinanceSymbolInfo> symbols = client.getSymbols();

    assertEquals(3, symbols.size());
    assertEquals(new BinanceSymbolInfo("BTCUSDT", "TRADING", "BTC", "USDT"), symbols.get(0));
    assertTrue(symbols.get(0).isTrading());
    assertFalse(symbols.get(2).isTrading());

    RecordedRequest recorded = server.takeRequest();
    assertEquals("GET", recorded.getMethod());
    assertEquals("/api/v3/exchangeInfo", recorded.getPath());
  }

  @Test
  void shouldMapBinanceErrorPayload() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(429)
            .setBody("{\"code\":-1003,\"msg\":\"Too many requests\"}"));

    BinanceConnectorException ex =
        assertThrows(BinanceConnectorException.class, () -> client.getSymbols());

    assertEquals(429, ex.httpStatus());
    assertEquals(-1003, ex.binanceCode());
    assertTrue(ex.isRateLimited());
  }

  @Test
  void shouldRejectResponseWithoutSymbols() {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"timezone\":\"UTC\"}"));

    BinanceConnectorException ex =
        assertThrows(BinanceConnectorException.class, () -> client.getSymbols());

    assertFalse(ex.isRateLimited());
  }

  private static String fixture(String name) throws Exception {
    try (InputStream input =
        HttpBinanceExchangeInfoClientTest.class.getResourceAsStream("/fixtures/binance/" + name)) {
      return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
