package com.execrisk.engine.intake;

import java.util.UUID;

public record IntakeResult(UUID orderId, boolean accepted) {}
