package com.execrisk.engine.scheduler;

import com.execrisk.domain.ledger.LedgerInconsistencyException;
import com.execrisk.domain.orders.ChildOrderSlice;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.ParentOrderStatus;
import com.execrisk.domain.orders.SliceStatus;
import com.execrisk.domain.risk.RiskDecision;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.engine.lifecycle.SliceEventListener;
import com.execrisk.engine.lifecycle.SliceSubmitter;
import com.execrisk.engine.risk.PreTradeRiskService;
import com.execrisk.integration.venue.MarketDataProvider;
import com.execrisk.integration.venue.Quote;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paces parent orders into slices. Each parent is a chain of one-shot tasks on the shared
 * executor: a task risk-checks and submits one slice, then schedules the next after its delay.
 * Slice k+1 is therefore never emitted before slice k's risk decision and submission outcome.
 */
public class ExecutionScheduler implements SliceEventListener {
  static final String SLICES_COUNTER = "execution.slices.emitted";
  static final String COMPLETED_COUNTER = "execution.parents.completed";
  static final int HISTORY_LIMIT = 1_000;

  private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

  private final ScheduledExecutorService executor;
  private final PreTradeRiskService riskService;
  private final SliceSubmitter submitter;
  private final PositionLedger ledger;
  private final MarketDataProvider marketData;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Map<UUID, ParentRun> active = new ConcurrentHashMap<>();
  private final Map<UUID, ExecutionReport> history =
      new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<UUID, ExecutionReport> eldest) {
          return size() > HISTORY_LIMIT;
        }
      };
  private final List<ExecutionStatusListener> listeners = new CopyOnWriteArrayList<>();

  /** {@code marketData} supplies the arrival mid that slippage is reported against. */
  public ExecutionScheduler(
      ScheduledExecutorService executor,
      PreTradeRiskService riskService,
      SliceSubmitter submitter,
      PositionLedger ledger,
      MarketDataProvider marketData,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
    this.riskService = Objects.requireNonNull(riskService, "riskService must not be null");
    this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
    this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    this.marketData = Objects.requireNonNull(marketData, "marketData must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public void addListener(ExecutionStatusListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
  }

  /** Starts working {@code intent}; the future completes with its terminal report. */
  public CompletableFuture<ExecutionReport> start(OrderIntent intent, PacingStrategy strategy) {
    Objects.requireNonNull(intent, "intent must not be null");
    Objects.requireNonNull(strategy, "strategy must not be null");
    BigDecimal arrivalMid =
        marketData.latestQuote(intent.instrument()).map(Quote::mid).orElse(null);
    ParentRun run =
        new ParentRun(intent, strategy.algorithm(), strategy.schedule(intent), arrivalMid);
    if (active.putIfAbsent(intent.id(), run) != null) {
      throw new IllegalStateException("parent order already active: " + intent.id());
    }
    log.info(
        "Parent order started parentId={} instrument={} side={} qty={} algorithm={} arrivalMid={}",
        intent.id(),
        intent.instrument(),
        intent.side(),
        intent.qty(),
        strategy.algorithm(),
        arrivalMid);
    ExecutionReport report;
    synchronized (run) {
      scheduleNextStep(run);
      report = completeIfDone(run);
    }
    publish(run, report);
    return run.completion;
  }

  /** Stops emitting further slices of a parent. Slices already at the venue keep working. */
  public boolean cancel(UUID parentId, String reason) {
    ParentRun run = active.get(parentId);
    if (run == null) {
      return false;
    }
    ExecutionReport report;
    synchronized (run) {
      if (run.emissionStopped) {
        return false;
      }
      run.cancelRequested = true;
      stopEmission(run, ParentOrderStatus.CANCELED, reason == null ? "CANCELED" : reason);
      report = completeIfDone(run);
    }
    log.info("Parent order cancel requested parentId={} reason={}", parentId, reason);
    publish(run, report);
    return true;
  }

  public int cancelAll(String reason) {
    int canceled = 0;
    for (UUID parentId : new ArrayList<>(active.keySet())) {
      if (cancel(parentId, reason)) {
        canceled++;
      }
    }
    if (canceled > 0) {
      log.warn("Canceled all active parent orders count={} reason={}", canceled, reason);
    }
    return canceled;
  }

  public Optional<ExecutionReport> status(UUID parentId) {
    ParentRun run = active.get(parentId);
    if (run != null) {
      synchronized (run) {
        return Optional.of(report(run, ParentOrderStatus.WORKING));
      }
    }
    synchronized (history) {
      return Optional.ofNullable(history.get(parentId));
    }
  }

  public Optional<CompletableFuture<ExecutionReport>> completion(UUID parentId) {
    ParentRun run = active.get(parentId);
    if (run != null) {
      return Optional.of(run.completion);
    }
    return status(parentId).map(CompletableFuture::completedFuture);
  }

  public List<ExecutionReport> activeParents() {
    List<ExecutionReport> reports = new ArrayList<>();
    for (ParentRun run : active.values()) {
      synchronized (run) {
        reports.add(report(run, ParentOrderStatus.WORKING));
      }
    }
    return reports;
  }

  public List<ExecutionReport> history() {
    synchronized (history) {
      return List.copyOf(history.values());
    }
  }

  /** Cancels everything and waits up to {@code timeout} for running slice tasks to finish. */
  public boolean shutdown(Duration timeout) {
    cancelAll("SCHEDULER_SHUTDOWN");
    executor.shutdown();
    try {
      if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Execution scheduler did not stop in time timeoutMs={}", timeout.toMillis());
      executor.shutdownNow();
      return false;
    } catch (InterruptedException interrupted) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public void onSliceTerminal(ChildOrderSlice slice) {
    ParentRun run = active.get(slice.parentId());
    if (run == null) {
      return;
    }
    ExecutionReport report;
    synchronized (run) {
      if (!run.outstanding.remove(slice.id())) {
        return;
      }
      if (slice.status() != SliceStatus.FILLED) {
        run.deadQty = run.deadQty.add(slice.remainingQty());
      }
      if (slice.status() == SliceStatus.REJECTED) {
        stopEmission(run, ParentOrderStatus.PARTIALLY_EXECUTED, "VENUE_REJECTED:" + reason(slice));
      } else if (slice.status() == SliceStatus.FAILED) {
        stopEmission(run, ParentOrderStatus.PARTIALLY_EXECUTED, reason(slice));
      } else if (slice.status() == SliceStatus.CANCELED && !run.cancelRequested) {
        stopEmission(run, ParentOrderStatus.PARTIALLY_EXECUTED, "SLICE_CANCELED_AT_VENUE");
      }
      report = completeIfDone(run);
    }
    publish(run, report);
  }

  @Override
  public void onLedgerInconsistency(ChildOrderSlice slice, LedgerInconsistencyException ex) {
    ParentRun run = active.get(slice.parentId());
    if (run == null) {
      return;
    }
    ExecutionReport report;
    synchronized (run) {
      run.outstanding.remove(slice.id());
      run.failed = true;
      stopEmission(run, ParentOrderStatus.FAILED, ex.code() + ":" + ex.getMessage());
      report = completeIfDone(run);
    }
    log.error(
        "Parent order failed on ledger inconsistency parentId={} sliceId={} fillId={}",
        slice.parentId(),
        slice.id(),
        ex.fillId());
    publish(run, report);
  }

  private void step(ParentRun run) {
    ChildOrderSlice slice;
    ExecutionReport report = null;
    synchronized (run) {
      run.pendingStep = null;
      if (run.emissionStopped) {
        return;
      }
      if (!run.sequence.hasNext()) {
        run.emissionStopped = true;
        report = completeIfDone(run);
        slice = null;
      } else {
        slice = emit(run, run.sequence.next());
        if (slice == null) {
          report = completeIfDone(run);
        }
      }
    }
    if (slice == null) {
      publish(run, report);
      return;
    }

    ChildOrderSlice submitted;
    try {
      submitted = submitter.submit(slice);
    } catch (RuntimeException ex) {
      log.error(
          "Slice submission failed parentId={} sliceId={} index={}",
          slice.parentId(),
          slice.id(),
          slice.index(),
          ex);
      synchronized (run) {
        if (run.outstanding.remove(slice.id())) {
          run.deadQty = run.deadQty.add(slice.qty());
        }
        stopEmission(run, ParentOrderStatus.PARTIALLY_EXECUTED, "SUBMISSION_ERROR");
        report = completeIfDone(run);
      }
      publish(run, report);
      return;
    }
    if (submitted.status().isTerminal()) {
      onSliceTerminal(submitted);
    }
    synchronized (run) {
      if (!run.emissionStopped) {
        if (run.sequence.hasNext()) {
          scheduleNextStep(run);
        } else {
          run.emissionStopped = true;
        }
      }
      report = completeIfDone(run);
    }
    publish(run, report);
  }

  /** Risk-checks a planned slice and books it on the run; null when risk halts the parent. */
  private ChildOrderSlice emit(ParentRun run, PlannedSlice planned) {
    OrderIntent intent = run.intent;
    RiskDecision decision =
        riskService.checkSlice(
            intent.id(),
            intent.instrument(),
            intent.side(),
            run.scheduledQty.subtract(run.deadQty),
            planned.qty(),
            intent.limitPrice());
    if (!decision.accepted()) {
      String prefix = decision.requiresFlatten() ? "FORCE_FLATTEN:" : "RISK_REJECTED:";
      stopEmission(run, ParentOrderStatus.PARTIALLY_EXECUTED, prefix + decision.summary());
      return null;
    }
    ChildOrderSlice slice =
        ChildOrderSlice.createNew(intent, planned.index(), planned.qty(), clock.instant());
    run.scheduledQty = run.scheduledQty.add(planned.qty());
    run.slicesEmitted++;
    run.outstanding.add(slice.id());
    meterRegistry.counter(SLICES_COUNTER).increment();
    log.debug(
        "Slice emitted parentId={} index={} qty={} scheduledQty={}",
        intent.id(),
        planned.index(),
        planned.qty(),
        run.scheduledQty);
    return slice;
  }

  private void scheduleNextStep(ParentRun run) {
    Duration delay = run.sequence.nextDelay();
    try {
      run.pendingStep =
          executor.schedule(() -> step(run), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.warn("Scheduler rejected next slice parentId={}", run.intent.id(), ex);
      stopEmission(run, ParentOrderStatus.CANCELED, "SCHEDULER_SHUTDOWN");
    }
  }

  private void stopEmission(ParentRun run, ParentOrderStatus status, String reason) {
    if (run.pendingStep != null) {
      run.pendingStep.cancel(false);
      run.pendingStep = null;
    }
    if (run.failed && status != ParentOrderStatus.FAILED) {
      return;
    }
    if (run.emissionStopped && run.haltStatus != null && status != ParentOrderStatus.FAILED) {
      return;
    }
    run.emissionStopped = true;
    run.haltStatus = status;
    run.reason = reason;
  }

  private ExecutionReport completeIfDone(ParentRun run) {
    if (run.completed || !run.emissionStopped || !run.outstanding.isEmpty()) {
      return null;
    }
    run.completed = true;
    ParentOrderStatus status = run.haltStatus;
    if (status == null) {
      BigDecimal filled = ledger.parentFilledQty(run.intent.id());
      status =
          filled.compareTo(run.intent.qty()) == 0
              ? ParentOrderStatus.FILLED
              : ParentOrderStatus.PARTIALLY_EXECUTED;
    }
    ExecutionReport report = report(run, status);
    active.remove(run.intent.id(), run);
    synchronized (history) {
      history.put(report.parentId(), report);
    }
    meterRegistry.counter(COMPLETED_COUNTER, "status", status.name()).increment();
    log.info(
        "Parent order completed parentId={} status={} targetQty={} scheduledQty={} filledQty={}"
            + " slices={} reason={}",
        report.parentId(),
        report.status(),
        report.targetQty(),
        report.scheduledQty(),
        report.filledQty(),
        report.slicesEmitted(),
        report.reason());
    return report;
  }

  private void publish(ParentRun run, ExecutionReport report) {
    if (report == null) {
      return;
    }
    for (ExecutionStatusListener listener : listeners) {
      try {
        listener.onParentCompleted(report);
      } catch (RuntimeException ex) {
        log.error(
            "Execution status listener failed parentId={} status={}",
            report.parentId(),
            report.status(),
            ex);
      }
    }
    run.completion.complete(report);
  }

  private ExecutionReport report(ParentRun run, ParentOrderStatus status) {
    return new ExecutionReport(
        run.intent.id(),
        run.intent.instrument(),
        run.intent.side(),
        run.algorithm,
        status,
        run.intent.qty(),
        run.scheduledQty,
        ledger.parentFilledQty(run.intent.id()),
        ledger.parentAverageFillPrice(run.intent.id()).orElse(null),
        run.arrivalMid,
        run.slicesEmitted,
        run.reason,
        clock.instant());
  }

  private static String reason(ChildOrderSlice slice) {
    return slice.statusReason() == null ? slice.status().name() : slice.statusReason();
  }

  private static final class ParentRun {
    private final OrderIntent intent;
    private final PacingAlgorithm algorithm;
    private final SliceSequence sequence;
    private final BigDecimal arrivalMid;
    private final Set<UUID> outstanding = new HashSet<>();
    private final CompletableFuture<ExecutionReport> completion = new CompletableFuture<>();
    private BigDecimal scheduledQty = BigDecimal.ZERO;
    private BigDecimal deadQty = BigDecimal.ZERO;
    private int slicesEmitted;
    private ScheduledFuture<?> pendingStep;
    private boolean cancelRequested;
    private boolean emissionStopped;
    private boolean failed;
    private boolean completed;
    private ParentOrderStatus haltStatus;
    private String reason;

    private ParentRun(
        OrderIntent intent,
        PacingAlgorithm algorithm,
        SliceSequence sequence,
        BigDecimal arrivalMid) {
      this.intent = intent;
      this.algorithm = algorithm;
      this.sequence = sequence;
      this.arrivalMid = arrivalMid;
    }
  }
}
