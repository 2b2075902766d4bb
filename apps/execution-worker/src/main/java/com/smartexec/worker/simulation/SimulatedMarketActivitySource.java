package com.smartexec.worker.simulation;

import com.smartexec.execution.marketdata.MarketActivitySource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Constant-rate market volume and a fixed VWAP per symbol. */
public class SimulatedMarketActivitySource implements MarketActivitySource {
  private final SimulationProperties properties;
  private final Clock clock;

  public SimulatedMarketActivitySource(SimulationProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public long volumeSince(String symbol, Instant since) {
    SimulationProperties.Market market = properties.getMarkets().get(symbol);
    if (market == null) {
      return 0L;
    }
    long elapsedMillis = Math.max(0L, Duration.between(since, clock.instant()).toMillis());
    return market.getVolumePerMinute() * elapsedMillis / 60_000L;
  }

  @Override
  public Optional<BigDecimal> vwapSince(String symbol, Instant since) {
    SimulationProperties.Market market = properties.getMarkets().get(symbol);
    return market == null ? Optional.empty() : Optional.ofNullable(market.getVwap());
  }

  /** The configured profile repeated to fill {@code buckets}. */
  @Override
  public List<BigDecimal> volumeProfile(String symbol, Instant start, Instant end, int buckets) {
    SimulationProperties.Market market = properties.getMarkets().get(symbol);
    if (market == null || market.getVolumeProfile().isEmpty() || buckets < 1) {
      return List.of();
    }
    List<BigDecimal> profile = market.getVolumeProfile();
    List<BigDecimal> weights = new ArrayList<>(buckets);
    for (int i = 0; i < buckets; i++) {
      weights.add(profile.get(i % profile.size()));
    }
    return weights;
  }
}
