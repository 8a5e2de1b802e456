package com.execrisk.service.config;

import com.execrisk.engine.scheduler.ExecutionScheduler;
import java.time.Duration;
import org.springframework.beans.factory.DisposableBean;

/** Stops pacing before the pools behind it are torn down. */
public class ExecutionSchedulerShutdown implements DisposableBean {
  private final ExecutionScheduler scheduler;
  private final Duration timeout;

  public ExecutionSchedulerShutdown(ExecutionScheduler scheduler, Duration timeout) {
    this.scheduler = scheduler;
    this.timeout = timeout;
  }

  @Override
  public void destroy() {
    scheduler.shutdown(timeout);
  }
}
