package com.execrisk.engine.monitor;

@FunctionalInterface
public interface ParentOrderCanceller {
  int cancelAll(String reason);
}
