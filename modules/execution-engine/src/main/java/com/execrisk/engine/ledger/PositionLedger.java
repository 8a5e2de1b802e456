package com.execrisk.engine.ledger;

import com.execrisk.domain.ledger.AggregatePosition;
import com.execrisk.domain.ledger.Fill;
import com.execrisk.domain.ledger.LedgerInconsistencyException;
import com.execrisk.domain.ledger.Position;
import com.execrisk.domain.orders.ChildOrderSlice;
import com.execrisk.domain.orders.OrderSide;
import com.execrisk.domain.risk.DrawdownTracker;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single writer of positions and fill history. Every mutation and every read that feeds a risk
 * decision happens under one lock; callers only ever see immutable snapshots.
 */
public class PositionLedger {
  static final String FILLS_COUNTER = "ledger.fills.applied";
  private static final int PRICE_SCALE = 8;

  private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final LedgerJournal journal;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Map<String, Position> positions = new HashMap<>();
  private final Map<UUID, SliceAccount> slices = new HashMap<>();
  private final Map<UUID, BigDecimal> parentFilled = new HashMap<>();
  private final Map<UUID, BigDecimal> parentNotional = new HashMap<>();
  private final Set<String> seenFillIds = new HashSet<>();
  private final DrawdownTracker drawdown;

  private BigDecimal cash;
  private BigDecimal fees = BigDecimal.ZERO;
  private long fillCount;
  private BigDecimal sessionBaselinePnl = BigDecimal.ZERO;

  public PositionLedger(
      BigDecimal initialCash, LedgerJournal journal, MeterRegistry meterRegistry, Clock clock) {
    this.cash = Objects.requireNonNull(initialCash, "initialCash must not be null");
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.drawdown = new DrawdownTracker(initialCash);
  }

  /** Makes a slice known to the ledger. Fills for unregistered slices are refused. */
  public void registerSlice(ChildOrderSlice slice) {
    Objects.requireNonNull(slice, "slice must not be null");
    lock.lock();
    try {
      slices.putIfAbsent(
          slice.id(),
          new SliceAccount(slice.parentId(), slice.instrument(), slice.side(), slice.qty()));
    } finally {
      lock.unlock();
    }
  }

  /** Stops accepting fills for a slice that ended without filling completely. */
  public void closeSlice(UUID sliceId) {
    lock.lock();
    try {
      SliceAccount account = slices.get(sliceId);
      if (account != null) {
        account.closed = true;
      }
    } finally {
      lock.unlock();
    }
  }

  public FillApplication applyFill(Fill fill) {
    Objects.requireNonNull(fill, "fill must not be null");
    lock.lock();
    try {
      if (seenFillIds.contains(fill.fillId())) {
        record(FillOutcome.DUPLICATE);
        log.info(
            "Duplicate fill ignored fillId={} sliceId={}", fill.fillId(), fill.sliceId());
        return new FillApplication(FillOutcome.DUPLICATE, positionOf(fill.instrument()));
      }
      SliceAccount account = slices.get(fill.sliceId());
      String problem = inconsistency(fill, account);
      if (problem != null) {
        record(FillOutcome.REJECTED);
        log.error(
            "Ledger refused fill fillId={} sliceId={} parentId={} instrument={} qty={} reason={}",
            fill.fillId(),
            fill.sliceId(),
            fill.parentId(),
            fill.instrument(),
            fill.qty(),
            problem);
        throw new LedgerInconsistencyException(fill.fillId(), fill.sliceId(), problem);
      }

      Position next = positionOf(fill.instrument()).apply(fill);
      // nothing is committed until the journal has the fill, so a failed append can be redelivered
      try {
        journal.append(fill);
      } catch (RuntimeException ex) {
        record(FillOutcome.JOURNAL_FAILED);
        log.error(
            "Journal append failed, fill not applied fillId={} sliceId={} parentId={}",
            fill.fillId(),
            fill.sliceId(),
            fill.parentId(),
            ex);
        throw ex;
      }
      positions.put(fill.instrument(), next);
      account.filled = account.filled.add(fill.qty());
      parentFilled.merge(account.parentId, fill.qty(), BigDecimal::add);
      parentNotional.merge(account.parentId, fill.qty().multiply(fill.price()), BigDecimal::add);
      cash = cash.add(fill.cashDelta());
      fees = fees.add(fill.fee());
      fillCount++;
      seenFillIds.add(fill.fillId());
      drawdown.observe(aggregateLocked().portfolioValue());
      record(FillOutcome.APPLIED);
      return new FillApplication(FillOutcome.APPLIED, next);
    } finally {
      lock.unlock();
    }
  }

  public Position snapshot(String instrument) {
    lock.lock();
    try {
      return positionOf(instrument);
    } finally {
      lock.unlock();
    }
  }

  public AggregatePosition aggregate() {
    lock.lock();
    try {
      return aggregateLocked();
    } finally {
      lock.unlock();
    }
  }

  public PortfolioView portfolio() {
    lock.lock();
    try {
      return portfolioLocked();
    } finally {
      lock.unlock();
    }
  }

  /** One consistent read for a risk decision; {@code parentId} may be null. */
  public LedgerView view(String instrument, UUID parentId) {
    lock.lock();
    try {
      BigDecimal filled = parentId == null ? BigDecimal.ZERO : parentFilledLocked(parentId);
      return new LedgerView(positionOf(instrument), portfolioLocked(), filled);
    } finally {
      lock.unlock();
    }
  }

  public BigDecimal parentFilledQty(UUID parentId) {
    lock.lock();
    try {
      return parentFilledLocked(parentId);
    } finally {
      lock.unlock();
    }
  }

  /** Quantity-weighted fill price of a parent, empty until something fills. */
  public Optional<BigDecimal> parentAverageFillPrice(UUID parentId) {
    lock.lock();
    try {
      BigDecimal filled = parentFilledLocked(parentId);
      if (filled.signum() == 0) {
        return Optional.empty();
      }
      BigDecimal notional = parentNotional.getOrDefault(parentId, BigDecimal.ZERO);
      return Optional.of(notional.divide(filled, PRICE_SCALE, RoundingMode.HALF_UP));
    } finally {
      lock.unlock();
    }
  }

  /** Instruments with a non-zero position, in no particular order. */
  public List<String> heldInstruments() {
    lock.lock();
    try {
      List<String> held = new ArrayList<>();
      for (Position position : positions.values()) {
        if (position.qty().signum() != 0) {
          held.add(position.instrument());
        }
      }
      return held;
    } finally {
      lock.unlock();
    }
  }

  public Position markToMarket(String instrument, BigDecimal price) {
    lock.lock();
    try {
      Position current = positions.get(instrument);
      if (current == null) {
        return Position.flat(instrument);
      }
      Position marked = current.markedAt(price, clock.instant());
      positions.put(instrument, marked);
      drawdown.observe(aggregateLocked().portfolioValue());
      return marked;
    } finally {
      lock.unlock();
    }
  }

  /** Starts a new session: loss is measured from here and the drawdown peak restarts. */
  public PortfolioView resetSession() {
    lock.lock();
    try {
      AggregatePosition aggregate = aggregateLocked();
      sessionBaselinePnl = aggregate.totalPnl();
      drawdown.reset(aggregate.portfolioValue());
      log.info(
          "Ledger session reset baselinePnl={} peak={}",
          sessionBaselinePnl,
          aggregate.portfolioValue());
      return portfolioLocked();
    } finally {
      lock.unlock();
    }
  }

  private String inconsistency(Fill fill, SliceAccount account) {
    if (account == null) {
      return "UNKNOWN_SLICE";
    }
    if (!account.parentId.equals(fill.parentId())) {
      return "PARENT_MISMATCH";
    }
    if (!account.instrument.equals(fill.instrument())) {
      return "INSTRUMENT_MISMATCH";
    }
    if (account.side != fill.side()) {
      return "SIDE_MISMATCH";
    }
    if (account.closed) {
      return "SLICE_CLOSED";
    }
    if (fill.qty().compareTo(account.qty.subtract(account.filled)) > 0) {
      return "OVERFILL";
    }
    return null;
  }

  private Position positionOf(String instrument) {
    Position position = positions.get(instrument);
    return position == null ? Position.flat(instrument) : position;
  }

  private BigDecimal parentFilledLocked(UUID parentId) {
    return parentFilled.getOrDefault(parentId, BigDecimal.ZERO);
  }

  private AggregatePosition aggregateLocked() {
    return AggregatePosition.of(cash, positions, fees, fillCount, clock.instant());
  }

  private PortfolioView portfolioLocked() {
    return new PortfolioView(aggregateLocked(), sessionBaselinePnl, drawdown.peak());
  }

  private void record(FillOutcome outcome) {
    meterRegistry.counter(FILLS_COUNTER, "outcome", outcome.metricTag()).increment();
  }

  private static final class SliceAccount {
    private final UUID parentId;
    private final String instrument;
    private final OrderSide side;
    private final BigDecimal qty;
    private BigDecimal filled = BigDecimal.ZERO;
    private boolean closed;

    private SliceAccount(UUID parentId, String instrument, OrderSide side, BigDecimal qty) {
      this.parentId = parentId;
      this.instrument = instrument;
      this.side = side;
      this.qty = qty;
    }
  }
}
