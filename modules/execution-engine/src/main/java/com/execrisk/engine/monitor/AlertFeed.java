package com.execrisk.engine.monitor;

import com.execrisk.domain.risk.Alert;
import com.execrisk.domain.risk.AlertSeverity;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Append-only log of raised alerts with fan-out to subscribers. */
public class AlertFeed {
  static final String RAISED_COUNTER = "risk.alerts.raised";

  private static final Logger log = LoggerFactory.getLogger(AlertFeed.class);

  private final List<Alert> alerts = new CopyOnWriteArrayList<>();
  private final Set<UUID> acknowledged = ConcurrentHashMap.newKeySet();
  private final List<AlertSubscriber> subscribers = new CopyOnWriteArrayList<>();
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public AlertFeed(MeterRegistry meterRegistry, Clock clock) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public void subscribe(AlertSubscriber subscriber) {
    subscribers.add(Objects.requireNonNull(subscriber, "subscriber must not be null"));
  }

  public void append(Alert alert) {
    Objects.requireNonNull(alert, "alert must not be null");
    alerts.add(alert);
    meterRegistry
        .counter(RAISED_COUNTER, "severity", alert.severity().name().toLowerCase(Locale.ROOT))
        .increment();
    if (alert.severity() == AlertSeverity.INFO) {
      log.info("Risk alert rule={} message={}", alert.ruleId(), alert.message());
    } else {
      log.warn(
          "Risk alert severity={} rule={} message={}",
          alert.severity(),
          alert.ruleId(),
          alert.message());
    }
    for (AlertSubscriber subscriber : subscribers) {
      try {
        subscriber.onAlert(alert);
      } catch (RuntimeException ex) {
        log.error("Alert subscriber failed alertId={} rule={}", alert.id(), alert.ruleId(), ex);
      }
    }
  }

  public List<Alert> all() {
    return List.copyOf(alerts);
  }

  public List<Alert> recent(Duration window) {
    Instant since = clock.instant().minus(window);
    List<Alert> recent = new ArrayList<>();
    for (Alert alert : alerts) {
      if (!alert.raisedAt().isBefore(since)) {
        recent.add(alert);
      }
    }
    return recent;
  }

  public long trailingCount(Duration window) {
    return recent(window).size();
  }

  public Map<AlertSeverity, Long> countsBySeverity(Duration window) {
    Map<AlertSeverity, Long> counts = new EnumMap<>(AlertSeverity.class);
    for (AlertSeverity severity : AlertSeverity.values()) {
      counts.put(severity, 0L);
    }
    for (Alert alert : recent(window)) {
      counts.merge(alert.severity(), 1L, Long::sum);
    }
    return counts;
  }

  /** Marks an alert as seen by an operator. Returns false for unknown ids. */
  public boolean acknowledge(UUID alertId) {
    for (Alert alert : alerts) {
      if (alert.id().equals(alertId)) {
        acknowledged.add(alertId);
        return true;
      }
    }
    return false;
  }

  public List<Alert> unacknowledgedCritical() {
    List<Alert> pending = new ArrayList<>();
    for (Alert alert : alerts) {
      if (alert.severity() == AlertSeverity.CRITICAL && !acknowledged.contains(alert.id())) {
        pending.add(alert);
      }
    }
    return pending;
  }
}
