package com.execrisk.engine.intake;

import java.time.Instant;

public record TradingControlState(
    boolean halted, String haltReason, String updatedBy, Instant updatedAt) {}
