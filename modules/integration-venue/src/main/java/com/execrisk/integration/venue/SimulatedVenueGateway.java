package com.execrisk.integration.venue;

import com.execrisk.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paper venue. Accepted orders are filled at the touch (ask for buys, bid for sells) after {@code
 * fillLatency}, optionally split into several partial fills. Market orders without a quote are
 * rejected.
 */
public class SimulatedVenueGateway implements VenueGateway {
  private static final Logger log = LoggerFactory.getLogger(SimulatedVenueGateway.class);
  private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

  private final MarketDataProvider marketData;
  private final ScheduledExecutorService fillExecutor;
  private final Duration fillLatency;
  private final int fillsPerOrder;
  private final BigDecimal feeBps;
  private final Clock clock;
  private final List<VenueFillListener> listeners = new CopyOnWriteArrayList<>();
  private final Map<String, VenueOrderRequest> openOrders = new ConcurrentHashMap<>();
  private final AtomicLong orderSequence = new AtomicLong();
  private final AtomicLong tradeSequence = new AtomicLong();

  public SimulatedVenueGateway(
      MarketDataProvider marketData,
      ScheduledExecutorService fillExecutor,
      Duration fillLatency,
      int fillsPerOrder,
      BigDecimal feeBps,
      Clock clock) {
    this.marketData = Objects.requireNonNull(marketData, "marketData must not be null");
    this.fillExecutor = Objects.requireNonNull(fillExecutor, "fillExecutor must not be null");
    this.fillLatency = fillLatency == null ? Duration.ZERO : fillLatency;
    this.fillsPerOrder = Math.max(1, fillsPerOrder);
    this.feeBps = feeBps == null ? BigDecimal.ZERO : feeBps;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public VenueSubmitResult submit(VenueOrderRequest request) {
    Optional<BigDecimal> price = executionPrice(request);
    if (price.isEmpty()) {
      log.info(
          "Simulated venue rejected order clientOrderId={} instrument={} reason=NO_QUOTE",
          request.clientOrderId(),
          request.instrument());
      return VenueSubmitResult.rejected("NO_QUOTE");
    }
    String venueOrderId = "SIM-" + orderSequence.incrementAndGet();
    openOrders.put(venueOrderId, request);
    fillExecutor.schedule(
        () -> deliverFills(venueOrderId, request, price.get()),
        fillLatency.toMillis(),
        TimeUnit.MILLISECONDS);
    return VenueSubmitResult.accepted(venueOrderId);
  }

  @Override
  public VenueCancelResult cancel(String venueOrderId) {
    if (openOrders.remove(venueOrderId) == null) {
      return VenueCancelResult.error("UNKNOWN_OR_CLOSED_ORDER");
    }
    for (VenueFillListener listener : listeners) {
      listener.onCanceled(venueOrderId, "CANCELED_BY_REQUEST");
    }
    return VenueCancelResult.ack();
  }

  @Override
  public void registerFillListener(VenueFillListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
  }

  private Optional<BigDecimal> executionPrice(VenueOrderRequest request) {
    Optional<Quote> quote = marketData.latestQuote(request.instrument());
    if (quote.isEmpty()) {
      return Optional.ofNullable(request.limitPrice());
    }
    return Optional.of(request.side() == OrderSide.BUY ? quote.get().ask() : quote.get().bid());
  }

  private void deliverFills(String venueOrderId, VenueOrderRequest request, BigDecimal price) {
    BigDecimal chunk =
        request.qty().divide(BigDecimal.valueOf(fillsPerOrder), 8, RoundingMode.DOWN);
    BigDecimal delivered = BigDecimal.ZERO;
    for (int i = 1; i <= fillsPerOrder; i++) {
      if (!openOrders.containsKey(venueOrderId)) {
        return;
      }
      BigDecimal qty = i == fillsPerOrder ? request.qty().subtract(delivered) : chunk;
      if (qty.signum() <= 0) {
        continue;
      }
      delivered = delivered.add(qty);
      BigDecimal fee = qty.multiply(price).multiply(feeBps).divide(BPS, 8, RoundingMode.HALF_UP);
      VenueFillNotification notification =
          new VenueFillNotification(
              venueOrderId,
              "SIM-T-" + tradeSequence.incrementAndGet(),
              qty,
              price,
              fee,
              clock.instant());
      for (VenueFillListener listener : listeners) {
        try {
          listener.onFill(notification);
        } catch (RuntimeException ex) {
          log.error(
              "Fill listener failed venueOrderId={} tradeId={}",
              venueOrderId,
              notification.tradeId(),
              ex);
        }
      }
    }
    openOrders.remove(venueOrderId);
  }
}
