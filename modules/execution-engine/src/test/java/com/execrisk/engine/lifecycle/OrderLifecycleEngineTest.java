package com.execrisk.engine.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.execrisk.domain.ledger.LedgerInconsistencyException;
import com.execrisk.domain.orders.ChildOrderSlice;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.OrderSide;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import com.execrisk.domain.orders.SliceStatus;
import com.execrisk.engine.ledger.InMemoryLedgerJournal;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.integration.venue.JitteredExponentialBackoff;
import com.execrisk.integration.venue.VenueCancelResult;
import com.execrisk.integration.venue.VenueFillListener;
import com.execrisk.integration.venue.VenueFillNotification;
import com.execrisk.integration.venue.VenueGateway;
import com.execrisk.integration.venue.VenueOrderRequest;
import com.execrisk.integration.venue.VenueRetryExecutor;
import com.execrisk.integration.venue.VenueSubmitResult;
import com.execrisk.integration.venue.VenueTransientException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrderLifecycleEngineTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  @Mock private VenueGateway venue;
  @Mock private SliceEventListener listener;

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private PositionLedger ledger;
  private OrderLifecycleEngine engine;
  private VenueFillListener fillChannel;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    ledger =
        new PositionLedger(new BigDecimal("100000"), new InMemoryLedgerJournal(), registry, clock);
    engine =
        new OrderLifecycleEngine(
            venue,
            new VenueRetryExecutor(
                2, JitteredExponentialBackoff.none(), Duration.ZERO, null, wait -> {}, registry),
            ledger,
            registry,
            clock);
    engine.addListener(listener);
    ArgumentCaptor<VenueFillListener> captor = ArgumentCaptor.forClass(VenueFillListener.class);
    verify(venue).registerFillListener(captor.capture());
    fillChannel = captor.getValue();
  }

  @Test
  void shouldTrackPartialAndFullFills() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenReturn(VenueSubmitResult.accepted("V-1"));
    ChildOrderSlice slice = newSlice("100");

    ChildOrderSlice submitted = engine.submit(slice);
    fillChannel.onFill(fill("V-1", "T-1", "40"));
    fillChannel.onFill(fill("V-1", "T-2", "60"));

    assertEquals(SliceStatus.SUBMITTED, submitted.status());
    assertEquals("V-1", submitted.venueOrderId());
    assertEquals(1, submitted.attempts());
    ChildOrderSlice done = engine.slice(slice.id()).orElseThrow();
    assertEquals(SliceStatus.FILLED, done.status());
    assertEquals(0, new BigDecimal("100").compareTo(ledger.snapshot("ETHUSDT").qty()));
    verify(listener).onSliceTerminal(done);
  }

  @Test
  void shouldMarkSliceRejectedWithoutRetry() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenReturn(VenueSubmitResult.rejected("PRICE_BAND"));

    ChildOrderSlice rejected = engine.submit(newSlice("10"));

    assertEquals(SliceStatus.REJECTED, rejected.status());
    assertEquals("PRICE_BAND", rejected.statusReason());
    verify(venue, times(1)).submit(any(VenueOrderRequest.class));
    verify(listener).onSliceTerminal(rejected);
  }

  @Test
  void shouldFailSliceWhenRetriesRunOut() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenThrow(
            new VenueTransientException(VenueTransientException.Reason.RATE_LIMITED, "429"));

    ChildOrderSlice failed = engine.submit(newSlice("10"));

    assertEquals(SliceStatus.FAILED, failed.status());
    assertEquals(2, failed.attempts());
    assertEquals("RETRIES_EXHAUSTED:RATE_LIMITED", failed.statusReason());
    assertEquals(1.0d, registry.get("venue.submit.exhausted").counter().count());
  }

  @Test
  void shouldIgnoreDuplicateFillNotifications() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenReturn(VenueSubmitResult.accepted("V-1"));
    ChildOrderSlice slice = engine.submit(newSlice("100"));

    fillChannel.onFill(fill("V-1", "T-1", "40"));
    fillChannel.onFill(fill("V-1", "T-1", "40"));

    assertEquals(0, new BigDecimal("40").compareTo(ledger.snapshot("ETHUSDT").qty()));
    ChildOrderSlice current = engine.slice(slice.id()).orElseThrow();
    assertEquals(SliceStatus.PARTIALLY_FILLED, current.status());
    assertEquals(0, new BigDecimal("40").compareTo(current.filledQty()));
    assertEquals(
        1.0d, registry.get("ledger.fills.applied").tag("outcome", "duplicate").counter().count());
  }

  @Test
  void shouldReportLedgerInconsistencyOnOverfill() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenReturn(VenueSubmitResult.accepted("V-1"));
    ChildOrderSlice slice = engine.submit(newSlice("10"));

    fillChannel.onFill(fill("V-1", "T-1", "11"));

    verify(listener).onLedgerInconsistency(eq(slice), any(LedgerInconsistencyException.class));
    assertTrue(ledger.snapshot("ETHUSDT").isFlat());
  }

  @Test
  void shouldApplyFillThatArrivesBeforeSubmitReturns() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenAnswer(
            invocation -> {
              fillChannel.onFill(fill("V-9", "T-9", "10"));
              return VenueSubmitResult.accepted("V-9");
            });

    ChildOrderSlice result = engine.submit(newSlice("10"));

    assertEquals(SliceStatus.FILLED, result.status());
    assertEquals(0, BigDecimal.TEN.compareTo(ledger.snapshot("ETHUSDT").qty()));
  }

  @Test
  void shouldCancelSliceWhenVenueConfirms() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenReturn(VenueSubmitResult.accepted("V-1"));
    when(venue.cancel("V-1")).thenReturn(VenueCancelResult.ack());
    ChildOrderSlice slice = engine.submit(newSlice("10"));

    VenueCancelResult result = engine.cancelSlice(slice.id());
    fillChannel.onCanceled("V-1", "CANCELED_BY_REQUEST");

    assertTrue(result.acknowledged());
    ChildOrderSlice canceled = engine.slice(slice.id()).orElseThrow();
    assertEquals(SliceStatus.CANCELED, canceled.status());
    verify(listener).onSliceTerminal(canceled);
  }

  @Test
  void shouldNotCancelSliceThatNeverReachedVenue() {
    when(venue.submit(any(VenueOrderRequest.class)))
        .thenReturn(VenueSubmitResult.rejected("HALTED"));
    ChildOrderSlice slice = engine.submit(newSlice("10"));

    VenueCancelResult result = engine.cancelSlice(slice.id());

    assertFalse(result.acknowledged());
    verify(venue, never()).cancel(any());
  }

  private static ChildOrderSlice newSlice(String qty) {
    OrderIntent parent =
        OrderIntent.create(
            "ETHUSDT",
            OrderSide.BUY,
            new BigDecimal(qty),
            PacingAlgorithm.ICEBERG,
            PacingParameters.none(),
            NOW);
    return ChildOrderSlice.createNew(parent, 0, new BigDecimal(qty), NOW);
  }

  private static VenueFillNotification fill(String venueOrderId, String tradeId, String qty) {
    return new VenueFillNotification(
        venueOrderId, tradeId, new BigDecimal(qty), new BigDecimal("2000"), BigDecimal.ZERO, NOW);
  }
}
