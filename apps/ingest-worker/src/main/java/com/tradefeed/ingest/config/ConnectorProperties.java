package com.tradefeed.ingest.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "connector")
public class ConnectorProperties {
  private Binance binance = new Binance();
  private CoinGecko coingecko = new CoinGecko();

  public Binance getBinance() {
    return binance;
  }

  public void setBinance(Binance binance) {
    this.binance = binance;
  }

  public CoinGecko getCoingecko() {
    return coingecko;
  }

  public void setCoingecko(CoinGecko coingecko) {
    this.coingecko = coingecko;
  }

  public static class Binance {
    private String restBaseUrl = "https://api.binance.com";
    private Duration timeout = Duration.ofSeconds(10);

    public String getRestBaseUrl() {
      return restBaseUrl;
    }

    public void setRestBaseUrl(String restBaseUrl) {
      this.restBaseUrl = restBaseUrl;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }

  public static class CoinGecko {
    private String baseUrl = "https://api.coingecko.com/api/v3";
    private String apiKey = "";
    private Duration timeout = Duration.ofSeconds(30);
    private int maxAttempts = 3;
    private Duration retryBaseBackoff = Duration.ofSeconds(5);
    private Duration retryMaxBackoff = Duration.ofSeconds(60);

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getRetryBaseBackoff() {
      return retryBaseBackoff;
    }

    public void setRetryBaseBackoff(Duration retryBaseBackoff) {
      this.retryBaseBackoff = retryBaseBackoff;
    }

    public Duration getRetryMaxBackoff() {
      return retryMaxBackoff;
    }

    public void setRetryMaxBackoff(Duration retryMaxBackoff) {
      this.retryMaxBackoff = retryMaxBackoff;
    }
  }
}
