package com.execrisk.integration.venue;

import java.util.Optional;

@FunctionalInterface
public interface MarketDataProvider {
  Optional<Quote> latestQuote(String instrument);
}
