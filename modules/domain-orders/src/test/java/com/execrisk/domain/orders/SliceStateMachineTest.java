package com.execrisk.domain.orders;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SliceStateMachineTest {
  @Test
  void shouldAllowForwardTransitions() {
    assertTrue(SliceStateMachine.canTransition(SliceStatus.CREATED, SliceStatus.SUBMITTED));
    assertTrue(SliceStateMachine.canTransition(SliceStatus.CREATED, SliceStatus.FAILED));
    assertTrue(
        SliceStateMachine.canTransition(SliceStatus.SUBMITTED, SliceStatus.PARTIALLY_FILLED));
    assertTrue(
        SliceStateMachine.canTransition(
            SliceStatus.PARTIALLY_FILLED, SliceStatus.PARTIALLY_FILLED));
    assertTrue(SliceStateMachine.canTransition(SliceStatus.PARTIALLY_FILLED, SliceStatus.FILLED));
    assertTrue(SliceStateMachine.canTransition(SliceStatus.SUBMITTED, SliceStatus.CANCELED));
  }

  @Test
  void shouldRejectBackwardOrTerminalTransitions() {
    assertFalse(SliceStateMachine.canTransition(SliceStatus.SUBMITTED, SliceStatus.CREATED));
    assertFalse(SliceStateMachine.canTransition(SliceStatus.FILLED, SliceStatus.CANCELED));
    assertFalse(SliceStateMachine.canTransition(SliceStatus.REJECTED, SliceStatus.SUBMITTED));
    assertFalse(SliceStateMachine.canTransition(SliceStatus.SUBMITTED, SliceStatus.FAILED));
    assertFalse(SliceStateMachine.canTransition(null, SliceStatus.SUBMITTED));
  }

  @Test
  void shouldThrowForInvalidTransition() {
    OrderDomainException ex =
        assertThrows(
            OrderDomainException.class,
            () -> SliceStateMachine.validateTransition(SliceStatus.FAILED, SliceStatus.SUBMITTED));
    assertEquals("INVALID_SLICE_TRANSITION", ex.code());
  }

  @Test
  void shouldAcceptTransitionValidationForAllowedPath() {
    assertDoesNotThrow(
        () -> SliceStateMachine.validateTransition(SliceStatus.CREATED, SliceStatus.SUBMITTED));
  }

  @Test
  void shouldReportTerminalStatuses() {
    assertTrue(SliceStatus.FILLED.isTerminal());
    assertTrue(SliceStatus.FAILED.isTerminal());
    assertFalse(SliceStatus.PARTIALLY_FILLED.isTerminal());
    assertFalse(ParentOrderStatus.WORKING.isTerminal());
    assertTrue(ParentOrderStatus.PARTIALLY_EXECUTED.isTerminal());
  }
}
