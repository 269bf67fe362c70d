package com.tradefeed.ingest.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
  private Stream stream = new Stream();
  private Discovery discovery = new Discovery();

  public Stream getStream() {
    return stream;
  }

  public void setStream(Stream stream) {
    this.stream = stream;
  }

  public Discovery getDiscovery() {
    return discovery;
  }

  public void setDiscovery(Discovery discovery) {
    this.discovery = discovery;
  }

  public static class Stream {
    private String wsBaseUrl = "wss://stream.binance.com:9443";
    private int pairsPerConnection = 50;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration reconnectBaseBackoff = Duration.ofSeconds(1);
    private Duration reconnectMaxBackoff = Duration.ofSeconds(60);
    private int maxRetries = 10;
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    public String getWsBaseUrl() {
      return wsBaseUrl;
    }

    public void setWsBaseUrl(String wsBaseUrl) {
      this.wsBaseUrl = wsBaseUrl;
    }

    public int getPairsPerConnection() {
      return pairsPerConnection;
    }

    public void setPairsPerConnection(int pairsPerConnection) {
      this.pairsPerConnection = pairsPerConnection;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReconnectBaseBackoff() {
      return reconnectBaseBackoff;
    }

    public void setReconnectBaseBackoff(Duration reconnectBaseBackoff) {
      this.reconnectBaseBackoff = reconnectBaseBackoff;
    }

    public Duration getReconnectMaxBackoff() {
      return reconnectMaxBackoff;
    }

    public void setReconnectMaxBackoff(Duration reconnectMaxBackoff) {
      this.reconnectMaxBackoff = reconnectMaxBackoff;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getShutdownTimeout() {
      return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
    }
  }

  public static class Discovery {
    private Duration refreshInterval = Duration.ofHours(1);
    private int pairLimit = 200;
    private int rankingSize = 250;
    private List<String> quoteAssets = new ArrayList<>(List.of("USDT"));
    private List<String> excludedBaseAssets =
        new ArrayList<>(List.of("USDT", "USDC", "FDUSD", "TUSD", "DAI", "BUSD", "USDP"));
    private List<String> fallbackPairs =
        new ArrayList<>(
            List.of(
                "BTCUSDT", "ETHUSDT", "BNBUSDT", "SOLUSDT", "XRPUSDT", "ADAUSDT", "DOGEUSDT",
                "AVAXUSDT", "LINKUSDT", "DOTUSDT"));
    private Duration startupTimeout = Duration.ofSeconds(30);

    public Duration getRefreshInterval() {
      return refreshInterval;
    }

    public void setRefreshInterval(Duration refreshInterval) {
      this.refreshInterval = refreshInterval;
    }

    public int getPairLimit() {
      return pairLimit;
    }

    public void setPairLimit(int pairLimit) {
      this.pairLimit = pairLimit;
    }

    public int getRankingSize() {
      return rankingSize;
    }

    public void setRankingSize(int rankingSize) {
      this.rankingSize = rankingSize;
    }

    public List<String> getQuoteAssets() {
      return quoteAssets;
    }

    public void setQuoteAssets(List<String> quoteAssets) {
      this.quoteAssets = quoteAssets;
    }

    public List<String> getExcludedBaseAssets() {
      return excludedBaseAssets;
    }

    public void setExcludedBaseAssets(List<String> excludedBaseAssets) {
      this.excludedBaseAssets = excludedBaseAssets;
    }

    public List<String> getFallbackPairs() {
      return fallbackPairs;
    }

    public void setFallbackPairs(List<String> fallbackPairs) {
      this.fallbackPairs = fallbackPairs;
    }

    public Duration getStartupTimeout() {
      return startupTimeout;
    }

    public void setStartupTimeout(Duration startupTimeout) {
      this.startupTimeout = startupTimeout;
    }
  }
}
