package com.execrisk.engine.scheduler;

@FunctionalInterface
public interface ExecutionStatusListener {
  void onParentCompleted(ExecutionReport report);
}
