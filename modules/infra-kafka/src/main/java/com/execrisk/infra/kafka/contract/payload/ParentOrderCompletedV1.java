package com.execrisk.infra.kafka.contract.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Terminal state of a parent order. {@code reason} is absent when the order filled; the price
 * fields are absent when nothing filled or no arrival quote was known.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParentOrderCompletedV1(
    String orderId,
    String instrument,
    String side,
    String algorithm,
    String status,
    BigDecimal targetQty,
    BigDecimal scheduledQty,
    BigDecimal filledQty,
    BigDecimal avgFillPrice,
    BigDecimal arrivalMid,
    BigDecimal slippageBps,
    int slicesEmitted,
    String reason,
    Instant completedAt) {}
