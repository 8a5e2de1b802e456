package com.execrisk.engine.scheduler;

import java.time.Duration;
import java.util.Iterator;

/**
 * Lazy, finite run of slices for one parent. Sequences are single-use; ask the strategy for a new
 * one to start over.
 */
public interface SliceSequence extends Iterator<PlannedSlice> {
  /**
   * How long to wait before the next slice is due. Known ahead of {@link #next()}, which may only
   * decide the quantity at emission time.
   */
  Duration nextDelay();
}
