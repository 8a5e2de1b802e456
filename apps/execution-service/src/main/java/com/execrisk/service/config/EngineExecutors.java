package com.execrisk.service.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.DisposableBean;

/**
 * Thread pools used by the engine. Held in one bean so none of them is picked up as the
 * application's {@code @Scheduled} executor.
 */
public class EngineExecutors implements DisposableBean {
  private final ScheduledExecutorService slicePacing;
  private final ScheduledExecutorService venueFills;
  private final ExecutorService venueAttempts;

  public EngineExecutors(int slicePacingThreads) {
    this.slicePacing =
        Executors.newScheduledThreadPool(Math.max(1, slicePacingThreads), named("slice-pacing"));
    this.venueFills = Executors.newSingleThreadScheduledExecutor(named("venue-fills"));
    this.venueAttempts = Executors.newCachedThreadPool(named("venue-attempt"));
  }

  public ScheduledExecutorService slicePacing() {
    return slicePacing;
  }

  public ScheduledExecutorService venueFills() {
    return venueFills;
  }

  public ExecutorService venueAttempts() {
    return venueAttempts;
  }

  @Override
  public void destroy() {
    slicePacing.shutdownNow();
    venueFills.shutdownNow();
    venueAttempts.shutdownNow();
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger sequence = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
