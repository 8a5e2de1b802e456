package com.execrisk.domain.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ChildOrderSliceTest {
  private static final Instant NOW = Instant.parse("2026-02-24T00:00:00Z");

  @Test
  void shouldCreateSliceFromParentAndTransition() {
    OrderIntent parent =
        OrderIntent.create(
            "BTCUSDT",
            OrderSide.BUY,
            new BigDecimal("10"),
            PacingAlgorithm.TWAP,
            PacingParameters.twap(Duration.ofMinutes(5), 2),
            NOW);

    ChildOrderSlice slice = ChildOrderSlice.createNew(parent, 0, new BigDecimal("5"), NOW);
    ChildOrderSlice submitted =
        slice.transitionTo(SliceStatus.SUBMITTED, null, "venue-1", null, NOW.plusSeconds(1));
    ChildOrderSlice partial =
        submitted.transitionTo(
            SliceStatus.PARTIALLY_FILLED, new BigDecimal("2"), null, null, NOW.plusSeconds(2));

    assertEquals(parent.id(), slice.parentId());
    assertEquals(SliceStatus.CREATED, slice.status());
    assertEquals("venue-1", partial.venueOrderId());
    assertEquals(new BigDecimal("3"), partial.remainingQty());
    assertEquals(SliceStatus.PARTIALLY_FILLED, partial.status());
  }

  @Test
  void shouldRejectFilledQuantityAboveSliceQuantity() {
    OrderIntent parent =
        OrderIntent.create(
            "BTCUSDT", OrderSide.SELL, BigDecimal.ONE, PacingAlgorithm.ICEBERG, null, NOW);
    ChildOrderSlice slice =
        ChildOrderSlice.createNew(parent, 0, BigDecimal.ONE, NOW)
            .transitionTo(SliceStatus.SUBMITTED, null, "v-1", null, NOW);

    assertThrows(
        OrderDomainException.class,
        () -> slice.transitionTo(SliceStatus.FILLED, new BigDecimal("2"), null, null, NOW));
  }

  @Test
  void shouldRejectNonPositiveIntentQuantity() {
    OrderDomainException ex =
        assertThrows(
            OrderDomainException.class,
            () ->
                OrderIntent.create(
                    "BTCUSDT", OrderSide.BUY, BigDecimal.ZERO, PacingAlgorithm.TWAP, null, NOW));
    assertEquals(OrderIntent.QTY_NOT_POSITIVE, ex.code());
  }

  @Test
  void shouldRejectInvalidPacingParameters() {
    OrderDomainException ex =
        assertThrows(OrderDomainException.class, () -> PacingParameters.twap(Duration.ZERO, 0));
    assertEquals("INVALID_PACING_PARAMETERS", ex.code());
  }
}
