package com.smartexec.execution.marketdata;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Observed market activity used by POV, VWAP slicing and progress monitoring. */
public interface MarketActivitySource {
  long volumeSince(String symbol, Instant since);

  Optional<BigDecimal> vwapSince(String symbol, Instant since);

  /**
   * Historical volume weights for {@code buckets} consecutive intervals starting at
   * {@code start}. An empty list means no profile is available.
   */
  List<BigDecimal> volumeProfile(String symbol, Instant start, Instant end, int buckets);
}
