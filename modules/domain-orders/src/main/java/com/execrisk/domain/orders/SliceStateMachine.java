package com.execrisk.domain.orders;

import java.util.EnumSet;
import java.util.Map;

public final class SliceStateMachine {
  private static final Map<SliceStatus, EnumSet<SliceStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          SliceStatus.CREATED,
              EnumSet.of(
                  SliceStatus.SUBMITTED,
                  SliceStatus.REJECTED,
                  SliceStatus.FAILED,
                  SliceStatus.CANCELED),
          SliceStatus.SUBMITTED,
              EnumSet.of(
                  SliceStatus.PARTIALLY_FILLED,
                  SliceStatus.FILLED,
                  SliceStatus.CANCELED,
                  SliceStatus.REJECTED),
          SliceStatus.PARTIALLY_FILLED,
              EnumSet.of(SliceStatus.PARTIALLY_FILLED, SliceStatus.FILLED, SliceStatus.CANCELED),
          SliceStatus.FILLED, EnumSet.noneOf(SliceStatus.class),
          SliceStatus.CANCELED, EnumSet.noneOf(SliceStatus.class),
          SliceStatus.REJECTED, EnumSet.noneOf(SliceStatus.class),
          SliceStatus.FAILED, EnumSet.noneOf(SliceStatus.class));

  private SliceStateMachine() {}

  public static boolean canTransition(SliceStatus from, SliceStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<SliceStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(SliceStatus from, SliceStatus to) {
    if (!canTransition(from, to)) {
      throw new OrderDomainException(
          "INVALID_SLICE_TRANSITION", "Invalid slice status transition from " + from + " to " + to);
    }
  }
}
