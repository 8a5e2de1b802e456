package com.execrisk.engine.lifecycle;

import com.execrisk.domain.ledger.Fill;
import com.execrisk.domain.ledger.LedgerInconsistencyException;
import com.execrisk.domain.orders.ChildOrderSlice;
import com.execrisk.domain.orders.SliceStatus;
import com.execrisk.engine.ledger.FillApplication;
import com.execrisk.engine.ledger.FillOutcome;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.integration.venue.VenueCancelResult;
import com.execrisk.integration.venue.VenueFillListener;
import com.execrisk.integration.venue.VenueFillNotification;
import com.execrisk.integration.venue.VenueGateway;
import com.execrisk.integration.venue.VenueOrderRequest;
import com.execrisk.integration.venue.VenueRetryExecutor;
import com.execrisk.integration.venue.VenueRetryExhaustedException;
import com.execrisk.integration.venue.VenueSubmitResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives each slice through its venue life. Submission and fill handling for one parent share a
 * lane lock, so a fill is booked in the ledger before that parent's next slice is accepted.
 */
public class OrderLifecycleEngine implements SliceSubmitter, VenueFillListener {
  static final String FILLS_COUNTER = "ledger.fills.applied";

  private static final Logger log = LoggerFactory.getLogger(OrderLifecycleEngine.class);

  private final VenueGateway venue;
  private final VenueRetryExecutor retryExecutor;
  private final PositionLedger ledger;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final List<SliceEventListener> listeners = new CopyOnWriteArrayList<>();
  private final Map<UUID, ChildOrderSlice> slices = new ConcurrentHashMap<>();
  private final Map<String, UUID> sliceByVenueOrderId = new HashMap<>();
  private final Map<String, List<VenueFillNotification>> earlyFills = new HashMap<>();
  private final Map<UUID, ReentrantLock> lanes = new ConcurrentHashMap<>();

  public OrderLifecycleEngine(
      VenueGateway venue,
      VenueRetryExecutor retryExecutor,
      PositionLedger ledger,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.venue = Objects.requireNonNull(venue, "venue must not be null");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    venue.registerFillListener(this);
  }

  public void addListener(SliceEventListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
  }

  @Override
  public ChildOrderSlice submit(ChildOrderSlice slice) {
    Objects.requireNonNull(slice, "slice must not be null");
    if (slice.status() != SliceStatus.CREATED) {
      throw new IllegalArgumentException("only CREATED slices can be submitted: " + slice.id());
    }
    ReentrantLock lane = lane(slice.parentId());
    lane.lock();
    try {
      ledger.registerSlice(slice);
      slices.put(slice.id(), slice);
      VenueOrderRequest request =
          new VenueOrderRequest(
              slice.id().toString(),
              slice.instrument(),
              slice.side(),
              slice.qty(),
              slice.limitPrice());
      AtomicInteger attempts = new AtomicInteger();
      ChildOrderSlice next;
      try {
        VenueSubmitResult result =
            retryExecutor.execute(
                attempt -> {
                  attempts.set(attempt);
                  return venue.submit(request);
                });
        ChildOrderSlice attempted = slice.withAttempts(attempts.get());
        if (result instanceof VenueSubmitResult.Accepted accepted) {
          next =
              attempted.transitionTo(
                  SliceStatus.SUBMITTED, null, accepted.venueOrderId(), null, clock.instant());
        } else {
          String reason = ((VenueSubmitResult.Rejected) result).reason();
          next = attempted.transitionTo(SliceStatus.REJECTED, null, null, reason, clock.instant());
        }
      } catch (VenueRetryExhaustedException ex) {
        next =
            slice
                .withAttempts(ex.attempts())
                .transitionTo(
                    SliceStatus.FAILED,
                    null,
                    null,
                    "RETRIES_EXHAUSTED:" + ex.lastFailure().reason(),
                    clock.instant());
      }
      slices.put(next.id(), next);
      List<VenueFillNotification> pending = List.of();
      if (next.venueOrderId() != null) {
        pending = mapVenueOrder(next.venueOrderId(), next.id());
      }
      log.info(
          "Slice submitted sliceId={} parentId={} index={} qty={} status={} attempts={}"
              + " venueOrderId={}",
          next.id(),
          next.parentId(),
          next.index(),
          next.qty(),
          next.status(),
          next.attempts(),
          next.venueOrderId());
      if (next.status().isTerminal()) {
        ledger.closeSlice(next.id());
        notifyTerminal(next);
      } else {
        notifyUpdated(next);
      }
      for (VenueFillNotification early : pending) {
        applyNotification(next.id(), early);
      }
      return slices.get(next.id());
    } finally {
      lane.unlock();
    }
  }

  /**
   * Fills for a venue order id not yet known are held until the submission that produced it is
   * recorded; a fast venue can report a fill before its acknowledgement has been processed.
   */
  @Override
  public void onFill(VenueFillNotification notification) {
    UUID sliceId;
    synchronized (sliceByVenueOrderId) {
      sliceId = sliceByVenueOrderId.get(notification.venueOrderId());
      if (sliceId == null) {
        earlyFills
            .computeIfAbsent(notification.venueOrderId(), ignored -> new ArrayList<>())
            .add(notification);
      }
    }
    if (sliceId == null) {
      meterRegistry.counter(FILLS_COUNTER, "outcome", FillOutcome.UNMAPPED.metricTag()).increment();
      log.warn(
          "Fill held for unmapped venue order venueOrderId={} tradeId={} qty={}",
          notification.venueOrderId(),
          notification.tradeId(),
          notification.qty());
      return;
    }
    applyNotification(sliceId, notification);
  }

  private void applyNotification(UUID sliceId, VenueFillNotification notification) {
    ReentrantLock lane = lane(slices.get(sliceId).parentId());
    lane.lock();
    try {
      ChildOrderSlice slice = slices.get(sliceId);
      Fill fill =
          new Fill(
              notification.tradeId(),
              slice.id(),
              slice.parentId(),
              slice.instrument(),
              slice.side(),
              notification.qty(),
              notification.price(),
              notification.fee(),
              notification.executedAt());
      FillApplication application;
      try {
        application = ledger.applyFill(fill);
      } catch (LedgerInconsistencyException ex) {
        notifyInconsistency(slice, ex);
        return;
      }
      if (!application.applied()) {
        return;
      }
      ChildOrderSlice next = applyToSlice(slice, fill);
      if (next.status().isTerminal()) {
        notifyTerminal(next);
      } else {
        notifyUpdated(next);
      }
    } finally {
      lane.unlock();
    }
  }

  @Override
  public void onCanceled(String venueOrderId, String reason) {
    UUID sliceId;
    synchronized (sliceByVenueOrderId) {
      sliceId = sliceByVenueOrderId.get(venueOrderId);
    }
    if (sliceId == null) {
      log.warn("Cancel for unknown venue order venueOrderId={} reason={}", venueOrderId, reason);
      return;
    }
    ReentrantLock lane = lane(slices.get(sliceId).parentId());
    lane.lock();
    try {
      ChildOrderSlice slice = slices.get(sliceId);
      if (slice.status().isTerminal()) {
        return;
      }
      ChildOrderSlice canceled =
          slice.transitionTo(SliceStatus.CANCELED, null, null, reason, clock.instant());
      slices.put(sliceId, canceled);
      ledger.closeSlice(sliceId);
      log.info(
          "Slice canceled at venue sliceId={} parentId={} filledQty={} reason={}",
          sliceId,
          canceled.parentId(),
          canceled.filledQty(),
          reason);
      notifyTerminal(canceled);
    } finally {
      lane.unlock();
    }
  }

  /** Asks the venue to cancel a working slice; the CANCELED state follows its notification. */
  public VenueCancelResult cancelSlice(UUID sliceId) {
    ChildOrderSlice slice = slices.get(sliceId);
    if (slice == null) {
      return VenueCancelResult.error("UNKNOWN_SLICE");
    }
    if (slice.status().isTerminal()) {
      return VenueCancelResult.error("SLICE_" + slice.status());
    }
    if (slice.venueOrderId() == null) {
      return VenueCancelResult.error("NOT_SUBMITTED");
    }
    VenueCancelResult result = venue.cancel(slice.venueOrderId());
    if (!result.acknowledged()) {
      log.warn(
          "Venue refused cancel sliceId={} venueOrderId={} error={}",
          sliceId,
          slice.venueOrderId(),
          result.error());
    }
    return result;
  }

  public Optional<ChildOrderSlice> slice(UUID sliceId) {
    return Optional.ofNullable(slices.get(sliceId));
  }

  public List<ChildOrderSlice> slicesFor(UUID parentId) {
    return slices.values().stream()
        .filter(slice -> slice.parentId().equals(parentId))
        .sorted((left, right) -> Integer.compare(left.index(), right.index()))
        .collect(Collectors.toList());
  }

  private ChildOrderSlice applyToSlice(ChildOrderSlice slice, Fill fill) {
    BigDecimal filled = slice.filledQty().add(fill.qty());
    SliceStatus status =
        filled.compareTo(slice.qty()) >= 0 ? SliceStatus.FILLED : SliceStatus.PARTIALLY_FILLED;
    ChildOrderSlice next = slice.transitionTo(status, filled, null, null, clock.instant());
    slices.put(next.id(), next);
    return next;
  }

  private List<VenueFillNotification> mapVenueOrder(String venueOrderId, UUID sliceId) {
    synchronized (sliceByVenueOrderId) {
      sliceByVenueOrderId.put(venueOrderId, sliceId);
      List<VenueFillNotification> pending = earlyFills.remove(venueOrderId);
      return pending == null ? List.of() : pending;
    }
  }

  private ReentrantLock lane(UUID parentId) {
    return lanes.computeIfAbsent(parentId, ignored -> new ReentrantLock());
  }

  private void notifyTerminal(ChildOrderSlice slice) {
    for (SliceEventListener listener : listeners) {
      try {
        listener.onSliceTerminal(slice);
      } catch (RuntimeException ex) {
        log.error("Slice listener failed sliceId={} status={}", slice.id(), slice.status(), ex);
      }
    }
  }

  private void notifyUpdated(ChildOrderSlice slice) {
    for (SliceEventListener listener : listeners) {
      try {
        listener.onSliceUpdated(slice);
      } catch (RuntimeException ex) {
        log.error("Slice listener failed sliceId={} status={}", slice.id(), slice.status(), ex);
      }
    }
  }

  private void notifyInconsistency(ChildOrderSlice slice, LedgerInconsistencyException ex) {
    for (SliceEventListener listener : listeners) {
      try {
        listener.onLedgerInconsistency(slice, ex);
      } catch (RuntimeException listenerFailure) {
        log.error(
            "Slice listener failed on ledger inconsistency sliceId={}",
            slice.id(),
            listenerFailure);
      }
    }
  }
}
