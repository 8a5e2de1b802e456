package com.execrisk.engine.lifecycle;

import com.execrisk.domain.orders.ChildOrderSlice;

@FunctionalInterface
public interface SliceSubmitter {
  /** Sends a CREATED slice to the venue and returns it in its post-submission state. */
  ChildOrderSlice submit(ChildOrderSlice slice);
}
