package com.smartexec.worker.simulation;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Venues, books and market activity served by the simulated ports. Books are generated from a
 * top-of-book price, a tick size and a per-level quantity.
 */
@ConfigurationProperties(prefix = "worker.simulation")
public class SimulationProperties {
  private boolean enabled = true;
  private Map<String, Venue> venues = new LinkedHashMap<>();
  private Map<String, Market> markets = new LinkedHashMap<>();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Map<String, Venue> getVenues() {
    return venues;
  }

  public void setVenues(Map<String, Venue> venues) {
    this.venues = venues;
  }

  public Map<String, Market> getMarkets() {
    return markets;
  }

  public void setMarkets(Map<String, Market> markets) {
    this.markets = markets;
  }

  public static class Venue {
    private boolean available = true;
    private Duration latency = Duration.ZERO;
    private BigDecimal fillRatio = BigDecimal.ONE;
    private Map<String, Book> books = new LinkedHashMap<>();

    public boolean isAvailable() {
      return available;
    }

    public void setAvailable(boolean available) {
      this.available = available;
    }

    public Duration getLatency() {
      return latency;
    }

    public void setLatency(Duration latency) {
      this.latency = latency;
    }

    public BigDecimal getFillRatio() {
      return fillRatio;
    }

    public void setFillRatio(BigDecimal fillRatio) {
      this.fillRatio = fillRatio;
    }

    public Map<String, Book> getBooks() {
      return books;
    }

    public void setBooks(Map<String, Book> books) {
      this.books = books;
    }
  }

  public static class Book {
    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal tickSize = new BigDecimal("0.01");
    private long levelQuantity = 1_000L;
    private int levels = 5;

    public BigDecimal getBid() {
      return bid;
    }

    public void setBid(BigDecimal bid) {
      this.bid = bid;
    }

    public BigDecimal getAsk() {
      return ask;
    }

    public void setAsk(BigDecimal ask) {
      this.ask = ask;
    }

    public BigDecimal getTickSize() {
      return tickSize;
    }

    public void setTickSize(BigDecimal tickSize) {
      this.tickSize = tickSize;
    }

    public long getLevelQuantity() {
      return levelQuantity;
    }

    public void setLevelQuantity(long levelQuantity) {
      this.levelQuantity = levelQuantity;
    }

    public int getLevels() {
      return levels;
    }

    public void setLevels(int levels) {
      this.levels = levels;
    }
  }

  public static class Market {
    private long volumePerMinute;
    private BigDecimal vwap;
    private List<BigDecimal> volumeProfile = new ArrayList<>();

    public long getVolumePerMinute() {
      return volumePerMinute;
    }

    public void setVolumePerMinute(long volumePerMinute) {
      this.volumePerMinute = volumePerMinute;
    }

    public BigDecimal getVwap() {
      return vwap;
    }

    public void setVwap(BigDecimal vwap) {
      this.vwap = vwap;
    }

    public List<BigDecimal> getVolumeProfile() {
      return volumeProfile;
    }

    public void setVolumeProfile(List<BigDecimal> volumeProfile) {
      this.volumeProfile = volumeProfile;
    }
  }
}
