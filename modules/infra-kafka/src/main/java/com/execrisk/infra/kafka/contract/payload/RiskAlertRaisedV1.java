package com.execrisk.infra.kafka.contract.payload;

import java.time.Instant;

public record RiskAlertRaisedV1(
    String alertId, String severity, String ruleId, String message, Instant raisedAt) {}
