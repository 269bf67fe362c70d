package com.tradefeed.integration.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Reads the spot symbol list from {@code GET /api/v3/exchangeInfo}. */
public class HttpBinanceExchangeInfoClient implements BinanceExchangeInfoClient {
  private static final String EXCHANGE_INFO_PATH = "/api/v3/exchangeInfo";
  private static final int NO_RESPONSE = -1;
  private static final int MAX_BODY_IN_MESSAGE = 200;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final BinanceApiConfig config;

  public HttpBinanceExchangeInfoClient(
      HttpClient httpClient, ObjectMapper objectMapper, BinanceApiConfig config) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.config = Objects.requireNonNull(config, "config is required");
  }

  @Override
  public List<BinanceSymbolInfo> getSymbols() {
    URI uri = config.baseUri().resolve(EXCHANGE_INFO_PATH);
    HttpResponse<String> response =
        send(HttpRequest.newBuilder(uri).timeout(config.timeout()).GET());
    if (response.statusCode() / 100 != 2) {
      throw rejected(response.statusCode(), response.body());
    }
    JsonNode symbolsNode = readJson(response.body(), response.statusCode()).path("symbols");
    if (!symbolsNode.isArray()) {
      throw new BinanceConnectorException(
          "Binance exchangeInfo response has no symbols array", response.statusCode(), null);
    }

    List<BinanceSymbolInfo> symbols = new ArrayList<>(symbolsNode.size());
    for (JsonNode node : symbolsNode) {
      String symbol = upper(node, "symbol");
      if (!symbol.isBlank()) {
        symbols.add(
            new BinanceSymbolInfo(
                symbol,
                node.path("status").asText(""),
                upper(node, "baseAsset"),
                upper(node, "quoteAsset")));
      }
    }
    return List.copyOf(symbols);
  }

  private HttpResponse<String> send(HttpRequest.Builder request) {
    try {
      return httpClient.send(
          request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new BinanceConnectorException(
          "Interrupted while calling Binance exchangeInfo", NO_RESPONSE, null, ex);
    } catch (IOException ex) {
      throw new BinanceConnectorException(
          "Binance exchangeInfo unreachable: " + ex.getMessage(), NO_RESPONSE, null, ex);
    }
  }

  /** Error bodies look like {@code {"code":-1003,"msg":"..."}}; anything else is kept raw. */
  private BinanceConnectorException rejected(int statusCode, String body) {
    JsonNode error;
    try {
      error = objectMapper.readTree(body == null ? "" : body);
    } catch (IOException ex) {
      error = null;
    }
    if (error == null || !error.hasNonNull("code")) {
      return new BinanceConnectorException(
          "Binance exchangeInfo rejected status=" + statusCode + " body=" + abbreviate(body),
          statusCode,
          null);
    }
    int code = error.get("code").intValue();
    return new BinanceConnectorException(
        "Binance exchangeInfo rejected status="
            + statusCode
            + " code="
            + code
            + " msg="
            + error.path("msg").asText(""),
        statusCode,
        code);
  }

  private JsonNode readJson(String body, int statusCode) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new BinanceConnectorException(
          "Binance exchangeInfo returned invalid JSON: " + abbreviate(body), statusCode, null, ex);
    }
  }

  private static String upper(JsonNode node, String field) {
    return node.path(field).asText("").trim().toUpperCase(Locale.ROOT);
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE);
  }
}
