package com.smartexec.worker.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SimulatedMarketActivitySourceTest {
  private static final Instant NOW = Instant.parse("2026-03-02T14:30:00Z");

  @Test
  void shouldAccrueVolumeAtConfiguredRate() {
    SimulatedMarketActivitySource source = source();

    assertEquals(30_000L, source.volumeSince("AAPL", NOW.minus(Duration.ofSeconds(15))));
    assertEquals(0L, source.volumeSince("AAPL", NOW.plusSeconds(60)));
    assertEquals(0L, source.volumeSince("TSLA", NOW.minusSeconds(60)));
    assertEquals(
        Optional.of(new BigDecimal("150.02")), source.vwapSince("AAPL", NOW.minusSeconds(60)));
    assertEquals(Optional.empty(), source.vwapSince("TSLA", NOW.minusSeconds(60)));
  }

  @Test
  void shouldRepeatProfileAcrossBuckets() {
    SimulatedMarketActivitySource source = source();

    assertEquals(
        List.of(
            new BigDecimal("2"), new BigDecimal("1"), new BigDecimal("2"), new BigDecimal("1"),
            new BigDecimal("2")),
        source.volumeProfile("AAPL", NOW, NOW.plusSeconds(300), 5));
    assertTrue(source.volumeProfile("MSFT", NOW, NOW.plusSeconds(300), 5).isEmpty());
  }

  private static SimulatedMarketActivitySource source() {
    SimulationProperties properties = new SimulationProperties();
    SimulationProperties.Market aapl = new SimulationProperties.Market();
    aapl.setVolumePerMinute(120_000L);
    aapl.setVwap(new BigDecimal("150.02"));
    aapl.setVolumeProfile(List.of(new BigDecimal("2"), new BigDecimal("1")));
    properties.getMarkets().put("AAPL", aapl);
    properties.getMarkets().put("MSFT", new SimulationProperties.Market());
    return new SimulatedMarketActivitySource(properties, Clock.fixed(NOW, ZoneOffset.UTC));
  }
}
