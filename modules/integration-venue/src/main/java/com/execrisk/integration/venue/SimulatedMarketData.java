package com.execrisk.integration.venue;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory quote board for local runs and tests. */
public class SimulatedMarketData implements MarketDataProvider {
  private final Map<String, Quote> quotes = new ConcurrentHashMap<>();
  private final Clock clock;

  public SimulatedMarketData(Clock clock) {
    this.clock = clock;
  }

  public void publish(String instrument, BigDecimal bid, BigDecimal ask) {
    quotes.put(instrument, new Quote(instrument, bid, ask, clock.instant()));
  }

  public void clear(String instrument) {
    quotes.remove(instrument);
  }

  @Override
  public Optional<Quote> latestQuote(String instrument) {
    return Optional.ofNullable(quotes.get(instrument));
  }
}
