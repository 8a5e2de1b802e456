package com.execrisk.engine.monitor;

import com.execrisk.domain.risk.Alert;

@FunctionalInterface
public interface AlertSubscriber {
  void onAlert(Alert alert);
}
