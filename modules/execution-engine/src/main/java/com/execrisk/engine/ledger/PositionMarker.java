package com.execrisk.engine.ledger;

import com.execrisk.integration.venue.MarketDataProvider;
import com.execrisk.integration.venue.Quote;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the mark of every open position to the mid of its latest quote. Instruments without a
 * quote keep their previous mark.
 */
public class PositionMarker {
  private static final Logger log = LoggerFactory.getLogger(PositionMarker.class);

  private final PositionLedger ledger;
  private final MarketDataProvider marketData;

  public PositionMarker(PositionLedger ledger, MarketDataProvider marketData) {
    this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    this.marketData = Objects.requireNonNull(marketData, "marketData must not be null");
  }

  /** Returns how many positions were re-marked. */
  public int markAll() {
    int marked = 0;
    for (String instrument : ledger.heldInstruments()) {
      Optional<Quote> quote = marketData.latestQuote(instrument);
      if (quote.isEmpty()) {
        log.debug("No quote to mark position instrument={}", instrument);
        continue;
      }
      ledger.markToMarket(instrument, quote.get().mid());
      marked++;
    }
    return marked;
  }
}
