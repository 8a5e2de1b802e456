package com.execrisk.integration.venue;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries venue calls that fail with {@link VenueTransientException}. When an attempt executor is
 * supplied every attempt is bounded by {@code attemptTimeout}; an attempt that overruns counts as a
 * TIMEOUT failure.
 */
public class VenueRetryExecutor {
  static final String RETRY_COUNTER = "venue.submit.retry";
  static final String EXHAUSTED_COUNTER = "venue.submit.exhausted";

  private static final Logger log = LoggerFactory.getLogger(VenueRetryExecutor.class);

  private final int maxAttempts;
  private final JitteredExponentialBackoff backoff;
  private final Duration attemptTimeout;
  private final ExecutorService attemptExecutor;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public VenueRetryExecutor(
      int maxAttempts,
      JitteredExponentialBackoff backoff,
      Duration attemptTimeout,
      ExecutorService attemptExecutor,
      MeterRegistry meterRegistry) {
    this(
        maxAttempts,
        backoff,
        attemptTimeout,
        attemptExecutor,
        duration -> Thread.sleep(duration.toMillis()),
        meterRegistry);
  }

  public VenueRetryExecutor(
      int maxAttempts,
      JitteredExponentialBackoff backoff,
      Duration attemptTimeout,
      ExecutorService attemptExecutor,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.attemptTimeout = attemptTimeout == null ? Duration.ZERO : attemptTimeout;
    this.attemptExecutor = attemptExecutor;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return runAttempt(operation, attempt);
      } catch (VenueTransientException ex) {
        if (attempt >= maxAttempts) {
          meterRegistry.counter(EXHAUSTED_COUNTER).increment();
          log.warn(
              "Venue retries exhausted attempts={} reason={} message={}",
              attempt,
              ex.reason(),
              ex.getMessage());
          throw new VenueRetryExhaustedException(attempt, ex);
        }
        Duration wait = backoff.delayBeforeRetry(attempt);
        meterRegistry.counter(RETRY_COUNTER).increment();
        log.info(
            "Retrying venue call attempt={} reason={} backoffMs={}",
            attempt,
            ex.reason(),
            wait.toMillis());
        sleep(wait);
        attempt++;
      }
    }
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private <T> T runAttempt(Operation<T> operation, int attempt) {
    if (attemptExecutor == null || attemptTimeout.isZero() || attemptTimeout.isNegative()) {
      return operation.run(attempt);
    }
    Future<T> future = attemptExecutor.submit(() -> operation.run(attempt));
    try {
      return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException timeout) {
      future.cancel(true);
      throw new VenueTransientException(
          VenueTransientException.Reason.TIMEOUT,
          "attempt " + attempt + " exceeded " + attemptTimeout.toMillis() + "ms",
          timeout);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Venue call failed", cause);
    } catch (InterruptedException interrupted) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for venue call", interrupted);
    }
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during venue retry backoff", interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run(int attempt);
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
