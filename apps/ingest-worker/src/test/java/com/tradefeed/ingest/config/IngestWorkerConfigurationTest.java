package com.tradefeed.ingest.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradefeed.domain.trades.Pair;
import com.tradefeed.infra.redis.publisher.TradeStreamPublisher;
import com.tradefeed.ingest.discovery.PairDiscoveryConfig;
import com.tradefeed.ingest.discovery.PairDiscoveryService;
import com.tradefeed.ingest.health.IngestHealthService;
import com.tradefeed.ingest.ingest.TradeIngestLifecycle;
import com.tradefeed.ingest.ingest.TradeIngestService;
import com.tradefeed.integration.binance.BinanceTradeStreamConfig;
import com.tradefeed.integration.coingecko.CoinGeckoApiConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class IngestWorkerConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(IngestWorkerConfiguration.class)
          .withBean(ObjectMapper.class, ObjectMapper::new)
          .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
          .withBean(TradeStreamPublisher.class, () -> mock(TradeStreamPublisher.class));

  @Test
  void shouldRegisterIngestBeansWithDefaults() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(TradeIngestService.class);
          assertThat(context).hasSingleBean(TradeIngestLifecycle.class);
          assertThat(context).hasSingleBean(PairDiscoveryService.class);
          assertThat(context).hasSingleBean(IngestHealthService.class);
          assertThat(context).hasBean("ingestHttpClient");

          BinanceTradeStreamConfig streamConfig = context.getBean(BinanceTradeStreamConfig.class);
          assertThat(streamConfig.pairsPerConnection()).isEqualTo(50);
          assertThat(streamConfig.maxRetries()).isEqualTo(10);
          assertThat(streamConfig.reconnectMaxBackoff()).isEqualTo(Duration.ofSeconds(60));

          PairDiscoveryConfig discoveryConfig = context.getBean(PairDiscoveryConfig.class);
          assertThat(discoveryConfig.pairLimit()).isEqualTo(200);
          assertThat(discoveryConfig.quoteAssets()).isEqualTo(Set.of("USDT"));
          assertThat(discoveryConfig.excludedBaseAssets()).contains("USDC", "FDUSD");
          assertThat(context.getBean(PairDiscoveryService.class).getPairs())
              .startsWith(Pair.of("BTCUSDT"), Pair.of("ETHUSDT"));

          assertThat(context.getBean(CoinGeckoApiConfig.class).proApiKey()).isEmpty();
        });
  }

  @Test
  void shouldBindOverriddenProperties() {
    contextRunner
        .withPropertyValues(
            "ingest.stream.ws-base-url=wss://stream.example.test:9443",
            "ingest.stream.pairs-per-connection=25",
            "ingest.discovery.pair-limit=2",
            "ingest.discovery.fallback-pairs=solusdt,xrpusdt,adausdt",
            "connector.coingecko.api-key=cg-key")
        .run(
            context -> {
              BinanceTradeStreamConfig streamConfig =
                  context.getBean(BinanceTradeStreamConfig.class);
              assertThat(streamConfig.pairsPerConnection()).isEqualTo(25);
              assertThat(streamConfig.combinedStreamUri(List.of(Pair.of("BTCUSDT"))).toString())
                  .isEqualTo("wss://stream.example.test:9443/stream?streams=btcusdt@trade");
              assertThat(context.getBean(PairDiscoveryService.class).getPairs())
                  .containsExactly(Pair.of("SOLUSDT"), Pair.of("XRPUSDT"));
              assertThat(context.getBean(CoinGeckoApiConfig.class).proApiKey()).contains("cg-key");
            });
  }

  @Test
  void shouldFailOnInvalidFallbackPair() {
    contextRunner
        .withPropertyValues("ingest.discovery.fallback-pairs=BTC-USDT")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void shouldFailOnBlankFallbackPairs() {
    contextRunner
        .withPropertyValues("ingest.discovery.fallback-pairs= ")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void shouldStartWithoutPublisherAndReportIt() {
    new ApplicationContextRunner()
        .withUserConfiguration(IngestWorkerConfiguration.class)
        .withBean(ObjectMapper.class, ObjectMapper::new)
        .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              assertThat(context).doesNotHaveBean(TradeStreamPublisher.class);
              assertThat(context.getBean(IngestHealthService.class).health().reason())
                  .isEqualTo("publisher not initialized");
            });
  }
}
