package com.execrisk.integration.venue;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Doubling backoff capped at {@code max}. A jitter ratio of {@code r} keeps {@code (1 - r)} of the
 * computed delay and randomizes the rest.
 */
public class JitteredExponentialBackoff {
  private final long baseMs;
  private final long maxMs;
  private final double jitterRatio;
  private final DoubleSupplier random;

  public JitteredExponentialBackoff(Duration base, Duration max, double jitterRatio) {
    this(base, max, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
  }

  public JitteredExponentialBackoff(
      Duration base, Duration max, double jitterRatio, DoubleSupplier random) {
    Objects.requireNonNull(base, "base must not be null");
    Objects.requireNonNull(max, "max must not be null");
    this.baseMs = Math.max(0L, base.toMillis());
    this.maxMs = Math.max(this.baseMs, max.toMillis());
    this.jitterRatio = Math.max(0.0d, Math.min(1.0d, jitterRatio));
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  public static JitteredExponentialBackoff none() {
    return new JitteredExponentialBackoff(Duration.ZERO, Duration.ZERO, 0.0d);
  }

  public Duration delayBeforeRetry(int failedAttempt) {
    long capped = cappedDelay(failedAttempt);
    if (capped == 0L || jitterRatio == 0.0d) {
      return Duration.ofMillis(capped);
    }
    double sample = Math.max(0.0d, Math.min(1.0d, random.getAsDouble()));
    long fixedPart = Math.round(capped * (1.0d - jitterRatio));
    long randomPart = (long) Math.floor(capped * jitterRatio * sample);
    return Duration.ofMillis(Math.min(maxMs, fixedPart + randomPart));
  }

  public Duration max() {
    return Duration.ofMillis(maxMs);
  }

  private long cappedDelay(int failedAttempt) {
    if (baseMs == 0L) {
      return 0L;
    }
    int exponent = Math.min(30, Math.max(0, failedAttempt - 1));
    return Math.min(maxMs, baseMs << exponent);
  }
}
