package com.execrisk.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record ChildOrderSlice(
    UUID id,
    UUID parentId,
    int index,
    String instrument,
    OrderSide side,
    BigDecimal qty,
    BigDecimal limitPrice,
    SliceStatus status,
    BigDecimal filledQty,
    String venueOrderId,
    int attempts,
    String statusReason,
    Instant scheduledAt,
    Instant updatedAt) {
  public ChildOrderSlice {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(parentId, "parentId must not be null");
    if (index < 0) {
      throw new OrderDomainException("index must be >= 0");
    }
    if (instrument == null || instrument.isBlank()) {
      throw new OrderDomainException("instrument must not be blank");
    }
    Objects.requireNonNull(side, "side must not be null");
    if (qty == null || qty.signum() <= 0) {
      throw new OrderDomainException(OrderIntent.QTY_NOT_POSITIVE, "slice qty must be > 0");
    }
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(filledQty, "filledQty must not be null");
    if (filledQty.signum() < 0 || filledQty.compareTo(qty) > 0) {
      throw new OrderDomainException("filledQty must be between 0 and qty");
    }
    Objects.requireNonNull(scheduledAt, "scheduledAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public static ChildOrderSlice createNew(
      OrderIntent parent, int index, BigDecimal qty, Instant scheduledAt) {
    Objects.requireNonNull(parent, "parent must not be null");
    return new ChildOrderSlice(
        UUID.randomUUID(),
        parent.id(),
        index,
        parent.instrument(),
        parent.side(),
        qty,
        parent.limitPrice(),
        SliceStatus.CREATED,
        BigDecimal.ZERO,
        null,
        0,
        null,
        scheduledAt,
        scheduledAt);
  }

  public ChildOrderSlice transitionTo(
      SliceStatus toStatus,
      BigDecimal nextFilledQty,
      String nextVenueOrderId,
      String reason,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    SliceStateMachine.validateTransition(status, toStatus);
    BigDecimal safeFilledQty = nextFilledQty == null ? filledQty : nextFilledQty;
    if (safeFilledQty.compareTo(filledQty) < 0) {
      throw new OrderDomainException("filledQty must not decrease");
    }
    String safeVenueOrderId = nextVenueOrderId == null ? venueOrderId : nextVenueOrderId;
    return new ChildOrderSlice(
        id,
        parentId,
        index,
        instrument,
        side,
        qty,
        limitPrice,
        toStatus,
        safeFilledQty,
        safeVenueOrderId,
        attempts,
        reason,
        scheduledAt,
        now);
  }

  public ChildOrderSlice withAttempts(int nextAttempts) {
    return new ChildOrderSlice(
        id,
        parentId,
        index,
        instrument,
        side,
        qty,
        limitPrice,
        status,
        filledQty,
        venueOrderId,
        nextAttempts,
        statusReason,
        scheduledAt,
        updatedAt);
  }

  public BigDecimal remainingQty() {
    return qty.subtract(filledQty);
  }
}
