package com.execrisk.engine.risk;

import com.execrisk.domain.risk.RiskDecision;
import com.execrisk.domain.risk.RiskEvaluationContext;

/** Audit hook invoked after every pre-trade evaluation. */
@FunctionalInterface
public interface RiskDecisionListener {
  void onDecision(RiskEvaluationContext context, RiskDecision decision);
}
