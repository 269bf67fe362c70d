package com.tradefeed.integration.coingecko;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public class HttpCoinGeckoRankingClient implements CoinGeckoRankingClient {
  static final String PRO_API_KEY_HEADER = "x-cg-pro-api-key";
  static final int MAX_PAGE_SIZE = 250;
  private static final String MARKETS_PATH = "/coins/markets";
  private static final int IO_FAILURE_STATUS = -1;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final CoinGeckoApiConfig config;
  private final RateLimitRetryExecutor retryExecutor;

  public HttpCoinGeckoRankingClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      CoinGeckoApiConfig config,
      RateLimitRetryExecutor retryExecutor) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor is required");
  }

  @Override
  public List<RankedCoin> getTopByMarketCap(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    // page offsets are relative to per_page, so every page uses the same size
    int perPage = Math.min(MAX_PAGE_SIZE, limit);
    List<RankedCoin> coins = new ArrayList<>();
    int page = 1;
    while (coins.size() < limit) {
      int requestedPage = page;
      List<RankedCoin> pageCoins =
          retryExecutor.execute(() -> fetchMarketsPage(perPage, requestedPage));
      coins.addAll(pageCoins);
      if (pageCoins.size() < perPage) {
        break;
      }
      page++;
    }
    coins.sort(Comparator.comparingInt(RankedCoin::marketCapRank));
    return List.copyOf(coins.size() > limit ? coins.subList(0, limit) : coins);
  }

  private List<RankedCoin> fetchMarketsPage(int perPage, int page) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(
                resolve(
                    MARKETS_PATH
                        + "?vs_currency=usd&order=market_cap_desc&per_page="
                        + perPage
                        + "&page="
                        + page))
            .timeout(config.timeout())
            .header("Accept", "application/json")
            .GET();
    config.proApiKey().ifPresent(apiKey -> builder.header(PRO_API_KEY_HEADER, apiKey));
    HttpResponse<String> response = execute(builder.build());
    return parseMarkets(response.body());
  }

  private HttpResponse<String> execute(HttpRequest request) {
    HttpResponse<String> response;
    try {
      response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CoinGeckoClientException(
          "CoinGecko markets request was interrupted", IO_FAILURE_STATUS, ex);
    } catch (IOException ex) {
      throw new CoinGeckoClientException(
          "Failed to call CoinGecko markets endpoint", IO_FAILURE_STATUS, ex);
    }
    if (response.statusCode() >= 200 && response.statusCode() < 300) {
      return response;
    }
    throw new CoinGeckoClientException(
        "CoinGecko API error status="
            + response.statusCode()
            + " body="
            + abbreviate(response.body()),
        response.statusCode(),
        response.headers().firstValue("Retry-After").orElse(null));
  }

  private List<RankedCoin> parseMarkets(String responseBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(responseBody);
    } catch (IOException ex) {
      throw new CoinGeckoClientException("Failed to parse CoinGecko markets JSON", 200, ex);
    }
    if (root == null || !root.isArray()) {
      throw new CoinGeckoClientException(
          "CoinGecko markets response is not an array", 200, (String) null);
    }
    List<RankedCoin> coins = new ArrayList<>();
    for (JsonNode coinNode : root) {
      String symbol = coinNode.path("symbol").asText("");
      JsonNode rankNode = coinNode.get("market_cap_rank");
      if (symbol.isBlank() || rankNode == null || !rankNode.canConvertToInt()) {
        continue;
      }
      coins.add(
          new RankedCoin(
              coinNode.path("id").asText(""),
              symbol.toUpperCase(Locale.ROOT),
              rankNode.asInt()));
    }
    return coins;
  }

  private URI resolve(String pathAndQuery) {
    String base = config.baseUri().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + pathAndQuery);
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    String compact = body.replaceAll("\\s+", " ").trim();
    return compact.length() <= 300 ? compact : compact.substring(0, 300);
  }
}
