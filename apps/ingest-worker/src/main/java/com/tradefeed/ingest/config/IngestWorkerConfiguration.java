package com.tradefeed.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradefeed.infra.redis.publisher.TradeStreamPublisher;
import com.tradefeed.ingest.discovery.PairDiscoveryConfig;
import com.tradefeed.ingest.discovery.PairDiscoveryService;
import com.tradefeed.ingest.health.IngestHealthService;
import com.tradefeed.ingest.ingest.IngestStats;
import com.tradefeed.ingest.ingest.TradeIngestLifecycle;
import com.tradefeed.ingest.ingest.TradeIngestService;
import com.tradefeed.integration.binance.BinanceApiConfig;
import com.tradefeed.integration.binance.BinanceExchangeInfoClient;
import com.tradefeed.integration.binance.BinanceStreamTransport;
import com.tradefeed.integration.binance.BinanceTradeFrameParser;
import com.tradefeed.integration.binance.BinanceTradeStreamConfig;
import com.tradefeed.integration.binance.HttpBinanceExchangeInfoClient;
import com.tradefeed.integration.binance.JdkWebSocketStreamTransport;
import com.tradefeed.integration.coingecko.CoinGeckoApiConfig;
import com.tradefeed.integration.coingecko.CoinGeckoRankingClient;
import com.tradefeed.integration.coingecko.HttpCoinGeckoRankingClient;
import com.tradefeed.integration.coingecko.RateLimitRetryExecutor;
import com.tradefeed.integration.coingecko.RetryAfterParser;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.LinkedHashSet;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({IngestProperties.class, ConnectorProperties.class})
public class IngestWorkerConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock ingestClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(name = "ingestHttpClient")
  public HttpClient ingestHttpClient(IngestProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.getStream().getConnectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public BinanceTradeStreamConfig binanceTradeStreamConfig(IngestProperties properties) {
    IngestProperties.Stream stream = properties.getStream();
    return new BinanceTradeStreamConfig(
        URI.create(stream.getWsBaseUrl()),
        stream.getPairsPerConnection(),
        stream.getConnectTimeout(),
        stream.getReconnectBaseBackoff(),
        stream.getReconnectMaxBackoff(),
        stream.getMaxRetries());
  }

  @Bean
  @ConditionalOnMissingBean
  public BinanceStreamTransport binanceStreamTransport(HttpClient ingestHttpClient) {
    return new JdkWebSocketStreamTransport(ingestHttpClient);
  }

  @Bean
  @ConditionalOnMissingBean
  public BinanceTradeFrameParser binanceTradeFrameParser(
      ObjectMapper objectMapper, Clock ingestClock) {
    return new BinanceTradeFrameParser(objectMapper, ingestClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public BinanceExchangeInfoClient binanceExchangeInfoClient(
      HttpClient ingestHttpClient, ObjectMapper objectMapper, ConnectorProperties properties) {
    ConnectorProperties.Binance binance = properties.getBinance();
    return new HttpBinanceExchangeInfoClient(
        ingestHttpClient,
        objectMapper,
        new BinanceApiConfig(URI.create(binance.getRestBaseUrl()), binance.getTimeout()));
  }

  @Bean
  public CoinGeckoApiConfig coinGeckoApiConfig(ConnectorProperties properties) {
    ConnectorProperties.CoinGecko coingecko = properties.getCoingecko();
    return new CoinGeckoApiConfig(
        URI.create(coingecko.getBaseUrl()),
        coingecko.getApiKey(),
        coingecko.getTimeout(),
        coingecko.getMaxAttempts(),
        coingecko.getRetryBaseBackoff(),
        coingecko.getRetryMaxBackoff());
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitRetryExecutor coinGeckoRetryExecutor(
      CoinGeckoApiConfig coinGeckoApiConfig, Clock ingestClock, MeterRegistry meterRegistry) {
    return new RateLimitRetryExecutor(
        coinGeckoApiConfig, new RetryAfterParser(ingestClock), meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public CoinGeckoRankingClient coinGeckoRankingClient(
      HttpClient ingestHttpClient,
      ObjectMapper objectMapper,
      CoinGeckoApiConfig coinGeckoApiConfig,
      RateLimitRetryExecutor coinGeckoRetryExecutor) {
    return new HttpCoinGeckoRankingClient(
        ingestHttpClient, objectMapper, coinGeckoApiConfig, coinGeckoRetryExecutor);
  }

  @Bean
  public PairDiscoveryConfig pairDiscoveryConfig(IngestProperties properties) {
    IngestProperties.Discovery discovery = properties.getDiscovery();
    return new PairDiscoveryConfig(
        discovery.getPairLimit(),
        discovery.getRankingSize(),
        new LinkedHashSet<>(discovery.getQuoteAssets()),
        new LinkedHashSet<>(discovery.getExcludedBaseAssets()),
        PairDiscoveryConfig.parsePairs(discovery.getFallbackPairs()));
  }

  @Bean
  public PairDiscoveryService pairDiscoveryService(
      CoinGeckoRankingClient coinGeckoRankingClient,
      BinanceExchangeInfoClient binanceExchangeInfoClient,
      PairDiscoveryConfig pairDiscoveryConfig,
      MeterRegistry meterRegistry) {
    return new PairDiscoveryService(
        coinGeckoRankingClient, binanceExchangeInfoClient, pairDiscoveryConfig, meterRegistry);
  }

  @Bean
  public IngestStats ingestStats() {
    return new IngestStats();
  }

  @Bean
  public TradeIngestService tradeIngestService(
      BinanceStreamTransport binanceStreamTransport,
      BinanceTradeStreamConfig binanceTradeStreamConfig,
      BinanceTradeFrameParser binanceTradeFrameParser,
      ObjectProvider<TradeStreamPublisher> tradeStreamPublisher,
      IngestStats ingestStats,
      MeterRegistry meterRegistry,
      IngestProperties properties) {
    return new TradeIngestService(
        binanceStreamTransport,
        binanceTradeStreamConfig,
        binanceTradeFrameParser,
        tradeStreamPublisher::getObject,
        ingestStats,
        meterRegistry,
        properties.getStream().getShutdownTimeout());
  }

  @Bean
  public TradeIngestLifecycle tradeIngestLifecycle(
      ObjectProvider<TradeStreamPublisher> tradeStreamPublisher,
      PairDiscoveryService pairDiscoveryService,
      TradeIngestService tradeIngestService,
      IngestProperties properties) {
    return new TradeIngestLifecycle(
        tradeStreamPublisher,
        pairDiscoveryService,
        tradeIngestService,
        properties.getDiscovery().getStartupTimeout());
  }

  @Bean
  public IngestHealthService ingestHealthService(
      ObjectProvider<TradeStreamPublisher> tradeStreamPublisher,
      TradeIngestService tradeIngestService,
      PairDiscoveryService pairDiscoveryService) {
    return new IngestHealthService(
        tradeStreamPublisher, tradeIngestService, pairDiscoveryService);
  }
}
