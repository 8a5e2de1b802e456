package com.execrisk.engine.intake;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Process-wide trading halt. While halted, intake refuses new intents. */
public class TradingControl {
  private static final Logger log = LoggerFactory.getLogger(TradingControl.class);

  private final Clock clock;
  private final AtomicReference<TradingControlState> state;

  public TradingControl(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.state =
        new AtomicReference<>(new TradingControlState(false, null, "system", clock.instant()));
  }

  public TradingControlState state() {
    return state.get();
  }

  public boolean isHalted() {
    return state.get().halted();
  }

  public TradingControlState halt(String reason, String actor) {
    TradingControlState next =
        new TradingControlState(
            true, normalizeReason(reason), normalizeActor(actor), clock.instant());
    state.set(next);
    log.warn("Trading halted reason={} actor={}", next.haltReason(), next.updatedBy());
    return next;
  }

  public TradingControlState resume(String actor) {
    TradingControlState next =
        new TradingControlState(false, null, normalizeActor(actor), clock.instant());
    state.set(next);
    log.info("Trading resumed actor={}", next.updatedBy());
    return next;
  }

  private static String normalizeReason(String reason) {
    if (reason == null || reason.isBlank()) {
      return "manual_halt";
    }
    return reason;
  }

  private static String normalizeActor(String actor) {
    if (actor == null || actor.isBlank()) {
      return "admin";
    }
    return actor;
  }
}
