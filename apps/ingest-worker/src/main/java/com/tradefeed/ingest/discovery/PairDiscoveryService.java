package com.tradefeed.ingest.discovery;

import com.tradefeed.domain.trades.Pair;
import com.tradefeed.integration.binance.BinanceConnectorException;
import com.tradefeed.integration.binance.BinanceExchangeInfoClient;
import com.tradefeed.integration.binance.BinanceSymbolInfo;
import com.tradefeed.integration.coingecko.CoinGeckoClientException;
import com.tradefeed.integration.coingecko.CoinGeckoRankingClient;
import com.tradefeed.integration.coingecko.RankedCoin;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Keeps the working set of pairs to subscribe: top coins by market cap that trade on Binance,
 * followed by the configured fallback pairs.
 *
 * <p>Readers always see a complete list; a refresh builds the next list aside and publishes it with
 * a single reference swap.
 */
public class PairDiscoveryService {
  private static final Logger log = LoggerFactory.getLogger(PairDiscoveryService.class);
  private static final String REFRESH_COUNTER = "ingest.discovery.refresh.total";

  private final CoinGeckoRankingClient rankingClient;
  private final BinanceExchangeInfoClient exchangeInfoClient;
  private final PairDiscoveryConfig config;
  private final MeterRegistry meterRegistry;
  private final AtomicReference<List<Pair>> workingSet;
  private final CountDownLatch initialRefresh = new CountDownLatch(1);

  public PairDiscoveryService(
      CoinGeckoRankingClient rankingClient,
      BinanceExchangeInfoClient exchangeInfoClient,
      PairDiscoveryConfig config,
      MeterRegistry meterRegistry) {
    this.rankingClient = Objects.requireNonNull(rankingClient, "rankingClient is required");
    this.exchangeInfoClient =
        Objects.requireNonNull(exchangeInfoClient, "exchangeInfoClient is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.workingSet = new AtomicReference<>(merge(List.of()));
  }

  public List<Pair> getPairs() {
    return workingSet.get();
  }

  @Scheduled(fixedDelayString = "${ingest.discovery.refresh-interval:PT1H}")
  public void refreshPairs() {
    try {
      List<RankedCoin> ranking = rankingClient.getTopByMarketCap(config.rankingSize());
      List<BinanceSymbolInfo> symbols = exchangeInfoClient.getSymbols();
      List<Pair> discovered = intersect(ranking, symbols);
      List<Pair> next = merge(discovered);
      workingSet.set(next);
      recordRefresh("success");
      log.info(
          "Pair discovery refreshed ranked={} discovered={} pairs={}",
          ranking.size(),
          discovered.size(),
          next.size());
    } catch (RuntimeException ex) {
      recordRefresh("failure");
      log.warn(
          "Pair discovery refresh failed, keeping {} pairs rateLimited={} error={}",
          workingSet.get().size(),
          isRateLimited(ex),
          ex.getMessage());
    } finally {
      initialRefresh.countDown();
    }
  }

  /** Waits for the first refresh attempt; returns false when the timeout elapsed first. */
  public boolean awaitInitialRefresh(Duration timeout) {
    try {
      return initialRefresh.await(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  List<Pair> intersect(List<RankedCoin> ranking, List<BinanceSymbolInfo> symbols) {
    Map<String, Integer> rankByBase = new HashMap<>();
    for (RankedCoin coin : ranking) {
      String base = coin.symbol().toUpperCase(Locale.ROOT);
      if (config.excludedBaseAssets().contains(base)) {
        continue;
      }
      rankByBase.merge(base, coin.marketCapRank(), Math::min);
    }

    List<RankedPair> candidates = new ArrayList<>();
    for (BinanceSymbolInfo symbol : symbols) {
      if (!symbol.isTrading() || symbol.baseAsset() == null || symbol.quoteAsset() == null) {
        continue;
      }
      String quote = symbol.quoteAsset().toUpperCase(Locale.ROOT);
      Integer rank = rankByBase.get(symbol.baseAsset().toUpperCase(Locale.ROOT));
      if (rank == null || !config.quoteAssets().contains(quote)) {
        continue;
      }
      try {
        candidates.add(new RankedPair(Pair.of(symbol.symbol()), rank));
      } catch (IllegalArgumentException ex) {
        log.debug(
            "Skipping unsupported symbol symbol={} error={}", symbol.symbol(), ex.getMessage());
      }
    }
    candidates.sort(
        Comparator.comparingInt(RankedPair::rank).thenComparing(RankedPair::pair));
    return candidates.stream().map(RankedPair::pair).distinct().toList();
  }

  private List<Pair> merge(List<Pair> discovered) {
    Set<Pair> merged = new LinkedHashSet<>(discovered);
    merged.addAll(config.fallbackPairs());
    return merged.stream().limit(config.pairLimit()).toList();
  }

  private void recordRefresh(String outcome) {
    meterRegistry.counter(REFRESH_COUNTER, "outcome", outcome).increment();
  }

  private static boolean isRateLimited(RuntimeException ex) {
    if (ex instanceof BinanceConnectorException binanceFailure) {
      return binanceFailure.isRateLimited();
    }
    return ex instanceof CoinGeckoClientException coinGeckoFailure
        && coinGeckoFailure.isRateLimited();
  }

  private record RankedPair(Pair pair, int rank) {}
}
