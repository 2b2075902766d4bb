package com.smartexec.worker.simulation;

import com.smartexec.execution.marketdata.OrderBookSnapshot;
import com.smartexec.execution.marketdata.PriceLevel;
import com.smartexec.execution.marketdata.VenueQuoteSource;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Static books from {@link SimulationProperties}; unavailable venues publish no quote. */
public class ConfiguredVenueQuoteSource implements VenueQuoteSource {
  private final SimulationProperties properties;

  public ConfiguredVenueQuoteSource(SimulationProperties properties) {
    this.properties = properties;
  }

  @Override
  public Map<String, OrderBookSnapshot> quotes(String symbol, List<String> venues) {
    Map<String, OrderBookSnapshot> quotes = new LinkedHashMap<>();
    for (String venueName : venues) {
      SimulationProperties.Venue venue = properties.getVenues().get(venueName);
      if (venue == null || !venue.isAvailable()) {
        continue;
      }
      SimulationProperties.Book book = venue.getBooks().get(symbol);
      if (book != null) {
        quotes.put(venueName, toSnapshot(book));
      }
    }
    return quotes;
  }

  static OrderBookSnapshot toSnapshot(SimulationProperties.Book book) {
    int levels = Math.max(1, book.getLevels());
    long quantity = Math.max(0L, book.getLevelQuantity());
    List<PriceLevel> bids = new ArrayList<>(levels);
    List<PriceLevel> asks = new ArrayList<>(levels);
    for (int i = 0; i < levels; i++) {
      BigDecimal offset = book.getTickSize().multiply(BigDecimal.valueOf(i));
      if (book.getBid() != null && book.getBid().subtract(offset).signum() > 0) {
        bids.add(new PriceLevel(book.getBid().subtract(offset), quantity));
      }
      if (book.getAsk() != null) {
        asks.add(new PriceLevel(book.getAsk().add(offset), quantity));
      }
    }
    return new OrderBookSnapshot(bids, asks);
  }
}
