package com.execrisk.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public record AggregatePosition(
    BigDecimal cash,
    Map<String, Position> positions,
    BigDecimal grossExposure,
    BigDecimal portfolioValue,
    BigDecimal realizedPnl,
    BigDecimal unrealizedPnl,
    BigDecimal fees,
    long fillCount,
    Instant asOf) {

  public AggregatePosition {
    Objects.requireNonNull(cash, "cash must not be null");
    positions =
        Collections.unmodifiableMap(
            new TreeMap<>(Objects.requireNonNull(positions, "positions must not be null")));
    Objects.requireNonNull(grossExposure, "grossExposure must not be null");
    Objects.requireNonNull(portfolioValue, "portfolioValue must not be null");
    Objects.requireNonNull(realizedPnl, "realizedPnl must not be null");
    Objects.requireNonNull(unrealizedPnl, "unrealizedPnl must not be null");
    Objects.requireNonNull(fees, "fees must not be null");
    Objects.requireNonNull(asOf, "asOf must not be null");
  }

  public static AggregatePosition of(
      BigDecimal cash,
      Map<String, Position> positions,
      BigDecimal fees,
      long fillCount,
      Instant asOf) {
    BigDecimal gross = BigDecimal.ZERO;
    BigDecimal marketValue = BigDecimal.ZERO;
    BigDecimal realized = BigDecimal.ZERO;
    BigDecimal unrealized = BigDecimal.ZERO;
    for (Position position : positions.values()) {
      gross = gross.add(position.grossExposure());
      marketValue = marketValue.add(position.marketValue());
      realized = realized.add(position.realizedPnl());
      unrealized = unrealized.add(position.unrealizedPnl());
    }
    return new AggregatePosition(
        cash,
        positions,
        gross,
        cash.add(marketValue),
        realized,
        unrealized,
        fees,
        fillCount,
        asOf);
  }

  public Position position(String instrument) {
    Position position = positions.get(instrument);
    return position == null ? Position.flat(instrument) : position;
  }

  /** Realized plus unrealized PnL, net of fees. */
  public BigDecimal totalPnl() {
    return realizedPnl.add(unrealizedPnl).subtract(fees);
  }
}
