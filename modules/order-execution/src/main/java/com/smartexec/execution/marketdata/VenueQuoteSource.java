package com.smartexec.execution.marketdata;

import java.util.List;
import java.util.Map;

public interface VenueQuoteSource {
  /** Current books keyed by venue; venues without a quote are absent from the map. */
  Map<String, OrderBookSnapshot> quotes(String symbol, List<String> venues);
}
