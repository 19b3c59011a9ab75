package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.Order;
import com.laddertrader.domain.orders.OrderSide;
import com.laddertrader.domain.orders.OrderStateMachine;
import com.laddertrader.domain.orders.OrderStatus;
import com.laddertrader.domain.orders.OrderTransition;
import com.laddertrader.domain.wallet.BalanceTracker;
import com.laddertrader.integration.nonkyc.ApiErrorKind;
import com.laddertrader.integration.nonkyc.AuthenticationException;
import com.laddertrader.integration.nonkyc.CancelResult;
import com.laddertrader.integration.nonkyc.NonkycApiException;
import com.laddertrader.integration.nonkyc.PlaceOrderRequest;
import com.laddertrader.integration.nonkyc.RateLimitException;
import com.laddertrader.integration.nonkyc.TransientApiException;
import com.laddertrader.integration.nonkyc.ValidationException;
import com.laddertrader.integration.nonkyc.VenueOrder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a ladder of limit orders around a reference price and replaces each filled rung with its
 * counter-order.
 *
 * <p>Every entry point that reads or mutates state runs under one lock, so the reconciliation
 * poller and the stream listener never interleave. Network calls are made while holding it.
 */
public class LadderEngine {
  static final String DRY_RUN_PREFIX = "dryrun-";
  static final String PLACEMENT_COUNTER = "ladder.placements";
  static final String FILL_COUNTER = "ladder.fills";
  static final String CLOSURE_COUNTER = "ladder.order.closures";
  static final String RECONCILE_TIMER = "ladder.reconcile";

  private static final Logger log = LoggerFactory.getLogger(LadderEngine.class);
  private static final int MAX_UNRESOLVED_MISSES = 2;

  private final LadderConfig config;
  private final LadderExchangePort exchange;
  private final BalanceTracker balanceTracker;
  private final EngineStateStore store;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Timer reconcileTimer;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final EngineState state = new EngineState();

  public LadderEngine(
      LadderConfig config,
      LadderExchangePort exchange,
      BalanceTracker balanceTracker,
      EngineStateStore store,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.config = Objects.requireNonNull(config, "config is required");
    this.exchange = Objects.requireNonNull(exchange, "exchange is required");
    this.balanceTracker = Objects.requireNonNull(balanceTracker, "balanceTracker is required");
    this.store = store;
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    this.reconcileTimer = meterRegistry.timer(RECONCILE_TIMER, "symbol", symbol());
  }

  /**
   * Resumes from the saved snapshot when it still tracks orders, otherwise validates spacing
   * against the live reference price and seeds a fresh ladder.
   *
   * @throws LadderConfigurationException when the spacing cannot be profitable
   */
  public void start() {
    lock.lock();
    try {
      if (state.running) {
        return;
      }
      stopRequested.set(false);
      Optional<EngineSnapshot> saved = store == null ? Optional.empty() : store.load();
      if (saved.isPresent() && saved.get().hasOpenOrders()) {
        resume(saved.get());
        return;
      }
      saved.ifPresent(this::restoreCounters);
      MarketSnapshot market = exchange.marketSnapshot(symbol());
      balanceTracker.reconcile(market.balances());
      BigDecimal referencePrice = market.ticker().referencePrice();
      config.validateSpacing(referencePrice);

      state.referencePrice = referencePrice;
      state.startedAt = clock.instant();
      state.lastError = null;
      state.running = true;
      log.info(
          "Starting ladder symbol={} variant={} mode={} referencePrice={} minStep={}",
          symbol(),
          config.variant(),
          config.runMode().value(),
          referencePrice,
          config.minProfitableStep().round(new MathContext(6)));

      boolean cancelled = false;
      if (config.startupCancelAll() && config.runMode() == RunMode.LIVE) {
        CancelResult result = exchange.cancelAll(symbol(), null);
        cancelled = true;
        log.info("Startup cancel-all symbol={} success={}", symbol(), result.success());
      }
      int adopted = cancelled ? 0 : adoptVenueOrders();
      if (adopted == 0) {
        seed(referencePrice);
      }
      persist();
    } catch (AuthenticationException ex) {
      haltLocked("Authentication failed during startup: " + ex.getMessage());
      throw ex;
    } finally {
      lock.unlock();
    }
  }

  /** Applies one venue order update; returns the counter-order placements it triggered. */
  public List<PlacementResult> applyOrderUpdate(VenueOrder update) {
    Objects.requireNonNull(update, "update must not be null");
    lock.lock();
    try {
      List<PlacementResult> results = applyOrderUpdateLocked(update);
      if (!results.isEmpty()) {
        persist();
      }
      return results;
    } finally {
      lock.unlock();
    }
  }

  public ReconcileReport reconcileOnce() {
    lock.lock();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      if (!state.running) {
        return ReconcileReport.notRunning();
      }
      try {
        balanceTracker.reconcile(exchange.balances());
      } catch (AuthenticationException ex) {
        haltLocked("Authentication failed while fetching balances: " + ex.getMessage());
        throw ex;
      }

      int resolved = resolveUnresolvedLocked();
      int checked = 0;
      int changes = 0;
      int placements = 0;
      for (String clientReferenceId : new ArrayList<>(state.openOrders.keySet())) {
        if (stopRequested.get() || !state.running) {
          break;
        }
        LadderOrder tracked = state.openOrders.get(clientReferenceId);
        if (tracked == null || tracked.isDryRun() || tracked.order().orderId() == null) {
          continue;
        }
        VenueOrder venueOrder;
        try {
          venueOrder = exchange.order(tracked.order().orderId());
        } catch (AuthenticationException ex) {
          haltLocked("Authentication failed while fetching orders: " + ex.getMessage());
          throw ex;
        } catch (NonkycApiException ex) {
          log.warn(
              "Order fetch failed, skipping update orderId={} kind={} message={}",
              tracked.order().orderId(),
              ex.kind(),
              ex.getMessage());
          continue;
        }
        checked++;
        OrderStatus before = tracked.order().status();
        List<PlacementResult> results = applyOrderUpdateLocked(venueOrder);
        if (venueOrder.status().isPresent() && venueOrder.status().get() != before) {
          changes++;
        }
        placements += countPlaced(results);
      }

      int retried = 0;
      if (!stopRequested.get()) {
        List<PlacementResult> deferredResults = retryDeferredLocked();
        retried = deferredResults.size();
        placements += countPlaced(deferredResults);
      }
      int refilled = 0;
      if (!stopRequested.get() && state.running) {
        refilled = refillMissingLevelsLocked();
        placements += refilled;
      }
      persist();
      ReconcileReport report =
          new ReconcileReport(checked, changes, resolved, retried, refilled, placements, false);
      log.debug(
          "Reconcile pass complete symbol={} checked={} changes={} resolved={} retried={} refilled={} placed={}",
          symbol(),
          checked,
          changes,
          resolved,
          retried,
          refilled,
          placements);
      return report;
    } finally {
      sample.stop(reconcileTimer);
      lock.unlock();
    }
  }

  /** Stops trading and records {@code reason}; the snapshot keeps the reason for the operator. */
  public void halt(String reason) {
    lock.lock();
    try {
      haltLocked(reason);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Cooperative stop: waits for the in-flight pass, makes a last attempt to resolve placements
   * with an unknown outcome and persists.
   */
  public void stop() {
    stopRequested.set(true);
    lock.lock();
    try {
      if (state.running && !state.unresolved.isEmpty()) {
        try {
          resolveUnresolvedLocked();
        } catch (NonkycApiException ex) {
          log.warn(
              "Could not resolve pending placements before stop count={} kind={}",
              state.unresolved.size(),
              ex.kind());
        }
      }
      state.running = false;
      persist();
      log.info("Ladder stopped symbol={} openOrders={}", symbol(), state.openOrders.size());
    } finally {
      lock.unlock();
    }
  }

  public boolean isRunning() {
    lock.lock();
    try {
      return state.running;
    } finally {
      lock.unlock();
    }
  }

  public EngineSnapshot snapshot() {
    lock.lock();
    try {
      return snapshotLocked();
    } finally {
      lock.unlock();
    }
  }

  public LadderConfig config() {
    return config;
  }

  private void resume(EngineSnapshot saved) {
    if (saved.referencePrice() != null) {
      config.validateSpacing(saved.referencePrice());
    }
    restoreCounters(saved);
    state.referencePrice = saved.referencePrice();
    state.lowestBuyPrice = saved.lowestBuyPrice();
    state.highestSellPrice = saved.highestSellPrice();
    state.startedAt = saved.startedAt() == null ? clock.instant() : saved.startedAt();
    for (OrderSnapshot order : saved.openOrders()) {
      Order restored = order.toOrder();
      state.openOrders.put(restored.clientReferenceId(), new LadderOrder(restored, order.costBasis()));
    }
    for (OrderSnapshot order : saved.unresolvedOrders()) {
      Order restored = order.toOrder();
      state.unresolved.put(
          restored.clientReferenceId(), new UnresolvedPlacement(restored, order.costBasis(), null, 0));
    }
    state.lastError = null;
    state.running = true;
    log.info(
        "Resumed ladder from snapshot symbol={} openOrders={} unresolved={} highestSell={}",
        symbol(),
        state.openOrders.size(),
        state.unresolved.size(),
        state.highestSellPrice);
    if (config.extendBuyLevelsOnRestart()) {
      extendBuyLevels();
    }
    persist();
  }

  /**
   * Adds buy rungs below the current lowest buy, measured from the live reference price, without
   * touching the orders already resting. Only unbounded ladders extend.
   */
  private int extendBuyLevels() {
    if (config.variant() != LadderVariant.UNBOUNDED) {
      log.info("Buy-level extension only applies to unbounded ladders symbol={}", symbol());
      return 0;
    }
    MarketSnapshot market = exchange.marketSnapshot(symbol());
    balanceTracker.reconcile(market.balances());
    BigDecimal referencePrice = market.ticker().referencePrice();
    config.validateSpacing(referencePrice);

    BigDecimal currentLowest = state.lowestBuyPrice;
    List<BigDecimal> targets = new ArrayList<>();
    for (int level = 1; level <= config.buyLevels(); level++) {
      BigDecimal price = config.priceBelow(referencePrice, level);
      if (price.signum() <= 0) {
        break;
      }
      if (currentLowest == null || price.compareTo(currentLowest) < 0) {
        targets.add(price);
      }
    }
    if (targets.isEmpty()) {
      log.info(
          "No additional buy levels needed symbol={} lowestBuy={} referencePrice={}",
          symbol(),
          currentLowest,
          referencePrice);
      return 0;
    }
    log.info(
        "Extending buy ladder symbol={} currentLowest={} targetLowest={} levels={}",
        symbol(),
        currentLowest,
        targets.get(targets.size() - 1),
        targets.size());
    int placed = 0;
    for (BigDecimal price : targets) {
      if (!state.running) {
        break;
      }
      if (place(OrderSide.BUY, price, freshQuantity(OrderSide.BUY, price), null, null, 0).isPlaced()) {
        placed++;
      }
    }
    if (placed == 0) {
      log.warn(
          "Could not place any additional buy levels symbol={} requested={}", symbol(), targets.size());
    }
    return placed;
  }

  private void restoreCounters(EngineSnapshot saved) {
    state.cumulativeSellRevenue = orZero(saved.cumulativeSellRevenueGross());
    state.realizedNetProfit = orZero(saved.realizedNetProfit());
    state.completedRoundTrips = saved.completedRoundTrips();
  }

  private int adoptVenueOrders() {
    List<VenueOrder> existing = exchange.openOrders(symbol());
    Instant now = clock.instant();
    int adopted = 0;
    for (VenueOrder venueOrder : existing) {
      if (venueOrder.orderId() == null
          || venueOrder.side() == null
          || !isPositive(venueOrder.price())
          || !isPositive(venueOrder.quantity())) {
        continue;
      }
      String clientReferenceId =
          venueOrder.clientReferenceId() == null || venueOrder.clientReferenceId().isBlank()
              ? "venue-" + venueOrder.orderId()
              : venueOrder.clientReferenceId();
      BigDecimal executed =
          venueOrder.executedQuantity() == null
              ? BigDecimal.ZERO
              : venueOrder.executedQuantity().max(BigDecimal.ZERO).min(venueOrder.quantity());
      Order order =
          Order.pending(
                  clientReferenceId,
                  symbol(),
                  venueOrder.side(),
                  venueOrder.price(),
                  venueOrder.quantity(),
                  now)
              .transitionTo(
                  executed.signum() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN,
                  venueOrder.orderId(),
                  executed,
                  now);
      state.openOrders.put(clientReferenceId, new LadderOrder(order, null));
      extendBounds(venueOrder.side(), venueOrder.price());
      adopted++;
    }
    if (adopted > 0) {
      log.info(
          "Adopted existing venue orders symbol={} count={} lowestBuy={} highestSell={}",
          symbol(),
          adopted,
          state.lowestBuyPrice,
          state.highestSellPrice);
    }
    return adopted;
  }

  private void seed(BigDecimal referencePrice) {
    List<PlacementResult> results = new ArrayList<>();
    for (int level = 1; level <= config.buyLevels(); level++) {
      BigDecimal price = config.priceBelow(referencePrice, level);
      if (price.signum() <= 0) {
        log.warn("Buy level below zero, stopping seed level={} price={}", level, price);
        break;
      }
      extendBounds(OrderSide.BUY, price);
      results.add(place(OrderSide.BUY, price, freshQuantity(OrderSide.BUY, price), null, null, 0));
    }
    for (int level = 1; level <= config.sellLevels(); level++) {
      BigDecimal price = config.priceAbove(referencePrice, level);
      extendBounds(OrderSide.SELL, price);
      results.add(place(OrderSide.SELL, price, freshQuantity(OrderSide.SELL, price), null, null, 0));
    }
    log.info(
        "Seeded ladder symbol={} requested={} placed={} lowestBuy={} highestSell={}",
        symbol(),
        results.size(),
        countPlaced(results),
        state.lowestBuyPrice,
        state.highestSellPrice);
  }

  private List<PlacementResult> applyOrderUpdateLocked(VenueOrder update) {
    String key = locate(update);
    if (key == null) {
      log.debug(
          "Ignoring update for untracked order orderId={} clientReferenceId={}",
          update.orderId(),
          update.clientReferenceId());
      return List.of();
    }
    if (update.status().isEmpty()) {
      log.warn(
          "Ignoring update with unrecognised status orderId={} rawStatus={}",
          update.orderId(),
          update.rawStatus());
      return List.of();
    }
    LadderOrder tracked = state.openOrders.get(key);
    Order current = tracked.order();
    OrderStatus next = update.status().get();
    OrderTransition transition = OrderStateMachine.classify(current.status(), next);
    if (transition == OrderTransition.UNCHANGED) {
      return List.of();
    }
    if (transition == OrderTransition.INVALID) {
      log.warn(
          "Ignoring invalid order transition clientReferenceId={} from={} to={}",
          key,
          current.status(),
          next);
      return List.of();
    }
    Order updated = current.transitionTo(next, update.orderId(), executedQuantity(update, current), clock.instant());

    if (transition == OrderTransition.FILL) {
      state.openOrders.remove(key);
      return onFilled(new LadderOrder(updated, tracked.costBasis()));
    }
    if (transition == OrderTransition.WITHDRAWAL) {
      state.openOrders.remove(key);
      balanceTracker.release(key);
      meterRegistry.counter(CLOSURE_COUNTER, "status", next.name().toLowerCase(Locale.ROOT)).increment();
      log.info(
          "Order closed without fill clientReferenceId={} orderId={} side={} price={} status={}",
          key,
          updated.orderId(),
          updated.side(),
          updated.price(),
          next);
      return List.of();
    }
    state.openOrders.put(key, tracked.withOrder(updated));
    return List.of();
  }

  private String locate(VenueOrder update) {
    LadderOrder byOrderId = state.findByOrderId(update.orderId());
    if (byOrderId != null) {
      return byOrderId.order().clientReferenceId();
    }
    String clientReferenceId = update.clientReferenceId();
    if (clientReferenceId == null) {
      return null;
    }
    if (state.openOrders.containsKey(clientReferenceId)) {
      return clientReferenceId;
    }
    UnresolvedPlacement unresolved = state.unresolved.remove(clientReferenceId);
    if (unresolved != null && update.orderId() != null) {
      Order acknowledged = unresolved.order().acknowledge(update.orderId(), clock.instant());
      state.openOrders.put(clientReferenceId, new LadderOrder(acknowledged, unresolved.costBasis()));
      extendBounds(acknowledged.side(), acknowledged.price());
      log.info(
          "Resolved placement from venue update clientReferenceId={} orderId={}",
          clientReferenceId,
          update.orderId());
      return clientReferenceId;
    }
    if (unresolved != null) {
      state.unresolved.put(clientReferenceId, unresolved);
    }
    return null;
  }

  private List<PlacementResult> onFilled(LadderOrder filled) {
    Order order = filled.order();
    BigDecimal price = order.price();
    BigDecimal quantity = order.quantity();
    String fillKey = "fill-" + order.clientReferenceId();
    meterRegistry.counter(FILL_COUNTER, "side", order.side().apiValue()).increment();
    log.info(
        "Order filled clientReferenceId={} orderId={} side={} price={} quantity={}",
        order.clientReferenceId(),
        order.orderId(),
        order.side(),
        price,
        quantity);

    List<PlacementResult> results = new ArrayList<>();
    if (order.side() == OrderSide.BUY) {
      if (!filled.isDryRun()) {
        balanceTracker.applyPending(fillKey, config.symbol().base(), quantity);
      }
      results.add(place(OrderSide.SELL, config.priceAbove(price, 1), quantity, price, price, 0));
      return results;
    }

    BigDecimal proceeds = price.multiply(quantity);
    state.cumulativeSellRevenue = state.cumulativeSellRevenue.add(proceeds);
    if (filled.costBasis() != null) {
      state.realizedNetProfit =
          state.realizedNetProfit.add(
              ProfitMath.roundTripNet(filled.costBasis(), price, quantity, config.feeRate()));
      state.completedRoundTrips++;
    }
    if (!filled.isDryRun()) {
      balanceTracker.applyPending(
          fillKey, config.symbol().quote(), proceeds.multiply(BigDecimal.ONE.subtract(config.feeRate())));
    }

    BigDecimal buyBack = config.priceBelow(price, 1);
    if (config.variant() == LadderVariant.BOUNDED) {
      results.add(place(OrderSide.BUY, buyBack, quantity, price, null, 0));
      results.add(place(OrderSide.SELL, config.priceAbove(price, 1), quantity, buyBack, null, 0));
      return results;
    }

    BigDecimal top = state.highestSellPrice == null ? price : state.highestSellPrice;
    BigDecimal extension = config.priceAbove(top, 1);
    PlacementResult extended =
        place(OrderSide.SELL, extension, freshQuantity(OrderSide.SELL, extension), null, null, 0);
    results.add(extended);
    if (extended.isPlaced()) {
      log.info("Extended sell ladder symbol={} highestSell={}", symbol(), state.highestSellPrice);
    }
    if (state.lowestBuyPrice == null || buyBack.compareTo(state.lowestBuyPrice) >= 0) {
      results.add(place(OrderSide.BUY, buyBack, quantity, price, null, 0));
    } else {
      log.info(
          "Buy-back below lower limit, not placed fillPrice={} buyBack={} lowestBuy={}",
          price,
          buyBack,
          state.lowestBuyPrice);
    }
    return results;
  }

  private PlacementResult place(
      OrderSide side,
      BigDecimal rawPrice,
      BigDecimal rawQuantity,
      BigDecimal pairedPrice,
      BigDecimal costBasis,
      int attempts) {
    if (!state.running) {
      return record(side, PlacementResult.skipped("halted"));
    }
    BigDecimal price = config.roundPrice(rawPrice);
    BigDecimal quantity = config.roundQuantity(rawQuantity);
    if (price.signum() <= 0) {
      return record(side, PlacementResult.skipped("non_positive"));
    }
    if (price.multiply(quantity).compareTo(config.minNotional()) < 0) {
      quantity = quantity.max(minNotionalQuantity(price));
      if (price.multiply(quantity).compareTo(config.minNotional()) < 0) {
        return record(side, PlacementResult.skipped("below_min_notional"));
      }
    }
    if (quantity.signum() <= 0) {
      return record(side, PlacementResult.skipped("non_positive"));
    }
    if (!isProfitable(side, price, pairedPrice)) {
      log.warn(
          "Skipping unprofitable rung side={} price={} pairedPrice={} minStep={}",
          side,
          price,
          pairedPrice,
          config.minProfitableStep());
      return record(side, PlacementResult.skipped("unprofitable"));
    }
    if (!hasBalance(side, price, quantity)) {
      log.warn(
          "Insufficient balance for rung side={} price={} quantity={} available={}",
          side,
          price,
          quantity,
          balanceTracker.get(requiredAsset(side)));
      defer(new DeferredPlacement(side, price, quantity, pairedPrice, costBasis, attempts, "insufficient_balance"));
      return record(side, PlacementResult.skipped("insufficient_balance"));
    }
    if (isRungOccupied(side, price)) {
      return record(side, PlacementResult.skipped("rung_occupied"));
    }
    return switch (config.runMode()) {
      case MONITOR -> {
        log.info("Monitor mode, not placing side={} price={} quantity={}", side, price, quantity);
        yield record(side, PlacementResult.skipped("monitor_mode"));
      }
      case DRY_RUN -> record(side, placeDryRun(side, price, quantity, costBasis));
      case LIVE -> record(side, placeLive(side, price, quantity, pairedPrice, costBasis, attempts));
    };
  }

  private PlacementResult placeDryRun(
      OrderSide side, BigDecimal price, BigDecimal quantity, BigDecimal costBasis) {
    Instant now = clock.instant();
    String clientReferenceId = DRY_RUN_PREFIX + side.apiValue() + "-" + shortId();
    Order order =
        Order.pending(clientReferenceId, symbol(), side, price, quantity, now)
            .acknowledge(DRY_RUN_PREFIX + shortId(), now);
    state.openOrders.put(clientReferenceId, new LadderOrder(order, costBasis));
    log.info("Dry run, simulated placement side={} price={} quantity={}", side, price, quantity);
    return PlacementResult.placed(order);
  }

  private PlacementResult placeLive(
      OrderSide side,
      BigDecimal price,
      BigDecimal quantity,
      BigDecimal pairedPrice,
      BigDecimal costBasis,
      int attempts) {
    String clientReferenceId = "ladder-" + side.apiValue() + "-" + shortId();
    Order pending = Order.pending(clientReferenceId, symbol(), side, price, quantity, clock.instant());
    try {
      VenueOrder acknowledged =
          exchange.place(new PlaceOrderRequest(symbol(), side, price, quantity, clientReferenceId));
      if (acknowledged.orderId() == null || acknowledged.orderId().isBlank()) {
        markUnresolved(pending, costBasis, pairedPrice);
        return PlacementResult.failed(ApiErrorKind.TRANSIENT, "missing_order_id");
      }
      Order placed = pending.acknowledge(acknowledged.orderId(), clock.instant());
      state.openOrders.put(clientReferenceId, new LadderOrder(placed, costBasis));
      debit(clientReferenceId, side, price, quantity);
      log.info(
          "Placed ladder order clientReferenceId={} orderId={} side={} price={} quantity={}",
          clientReferenceId,
          placed.orderId(),
          side,
          price,
          quantity);
      return PlacementResult.placed(placed);
    } catch (AuthenticationException ex) {
      haltLocked("Authentication failed while placing order: " + ex.getMessage());
      return PlacementResult.failed(ApiErrorKind.AUTHENTICATION, ex.errorCode());
    } catch (TransientApiException ex) {
      log.warn(
          "Placement outcome unknown clientReferenceId={} side={} price={} message={}",
          clientReferenceId,
          side,
          price,
          ex.getMessage());
      markUnresolved(pending, costBasis, pairedPrice);
      return PlacementResult.failed(ApiErrorKind.TRANSIENT, ex.errorCode());
    } catch (ValidationException ex) {
      String reason = rejectionReason(ex);
      log.warn(
          "Venue rejected placement side={} price={} quantity={} reason={} message={}",
          side,
          price,
          quantity,
          reason,
          ex.venueMessage());
      defer(new DeferredPlacement(side, price, quantity, pairedPrice, costBasis, attempts, reason));
      return PlacementResult.failed(ApiErrorKind.VALIDATION, reason);
    } catch (RateLimitException ex) {
      log.warn("Rate limited while placing side={} price={}, deferring", side, price);
      defer(new DeferredPlacement(side, price, quantity, pairedPrice, costBasis, attempts, "rate_limit"));
      return PlacementResult.failed(ApiErrorKind.RATE_LIMIT, "rate_limit");
    }
  }

  private void markUnresolved(Order pending, BigDecimal costBasis, BigDecimal pairedPrice) {
    state.unresolved.put(
        pending.clientReferenceId(), new UnresolvedPlacement(pending, costBasis, pairedPrice, 0));
    debit(pending.clientReferenceId(), pending.side(), pending.price(), pending.quantity());
  }

  private int resolveUnresolvedLocked() {
    if (state.unresolved.isEmpty()) {
      return 0;
    }
    List<VenueOrder> open;
    try {
      open = exchange.openOrders(symbol());
    } catch (AuthenticationException ex) {
      haltLocked("Authentication failed while resolving placements: " + ex.getMessage());
      throw ex;
    }
    Map<String, VenueOrder> byClientReference = new HashMap<>();
    for (VenueOrder venueOrder : open) {
      if (venueOrder.clientReferenceId() != null) {
        byClientReference.put(venueOrder.clientReferenceId(), venueOrder);
      }
    }
    int resolved = 0;
    for (UnresolvedPlacement unresolved : new ArrayList<>(state.unresolved.values())) {
      String key = unresolved.order().clientReferenceId();
      VenueOrder found = byClientReference.get(key);
      if (found != null && found.orderId() != null) {
        state.unresolved.remove(key);
        Order acknowledged = unresolved.order().acknowledge(found.orderId(), clock.instant());
        state.openOrders.put(key, new LadderOrder(acknowledged, unresolved.costBasis()));
        extendBounds(acknowledged.side(), acknowledged.price());
        resolved++;
        log.info("Resolved placement clientReferenceId={} orderId={}", key, found.orderId());
        continue;
      }
      UnresolvedPlacement missed = unresolved.missed();
      if (missed.misses() < MAX_UNRESOLVED_MISSES) {
        state.unresolved.put(key, missed);
        continue;
      }
      state.unresolved.remove(key);
      balanceTracker.release(key);
      Order order = unresolved.order();
      log.warn(
          "Placement not found on venue, scheduling re-placement clientReferenceId={} side={} price={}",
          key,
          order.side(),
          order.price());
      defer(
          new DeferredPlacement(
              order.side(),
              order.price(),
              order.quantity(),
              unresolved.pairedPrice(),
              unresolved.costBasis(),
              0,
              "not_found_on_venue"));
    }
    return resolved;
  }

  private List<PlacementResult> retryDeferredLocked() {
    if (state.deferred.isEmpty()) {
      return List.of();
    }
    List<DeferredPlacement> due = new ArrayList<>(state.deferred);
    state.deferred.clear();
    List<PlacementResult> results = new ArrayList<>();
    for (DeferredPlacement placement : due) {
      if (!state.running) {
        state.deferred.add(placement);
        continue;
      }
      results.add(
          place(
              placement.side(),
              placement.price(),
              placement.quantity(),
              placement.pairedPrice(),
              placement.costBasis(),
              placement.attempts() + 1));
    }
    return results;
  }

  /**
   * Tops a bounded ladder back up to its configured level counts from the current reference
   * price, walking outwards and skipping rungs that are tracked, unresolved or deferred. Rungs
   * lost to cancellation, rejection or expiry come back this way.
   */
  private int refillMissingLevelsLocked() {
    if (config.variant() != LadderVariant.BOUNDED || config.runMode() == RunMode.MONITOR) {
      return 0;
    }
    int missingBuys = config.buyLevels() - rungCount(OrderSide.BUY);
    int missingSells = config.sellLevels() - rungCount(OrderSide.SELL);
    if (missingBuys <= 0 && missingSells <= 0) {
      return 0;
    }
    BigDecimal referencePrice;
    try {
      referencePrice = exchange.ticker(symbol()).referencePrice();
    } catch (AuthenticationException ex) {
      haltLocked("Authentication failed while fetching ticker: " + ex.getMessage());
      throw ex;
    } catch (NonkycApiException ex) {
      log.warn("Ticker fetch failed, skipping level refill symbol={} kind={}", symbol(), ex.kind());
      return 0;
    }
    return refillSide(OrderSide.BUY, missingBuys, referencePrice)
        + refillSide(OrderSide.SELL, missingSells, referencePrice);
  }

  private int refillSide(OrderSide side, int missing, BigDecimal referencePrice) {
    if (missing <= 0) {
      return 0;
    }
    log.info(
        "Refilling missing ladder levels symbol={} side={} missing={} referencePrice={}",
        symbol(),
        side,
        missing,
        referencePrice);
    int attempted = 0;
    int placed = 0;
    for (int level = 1; attempted < missing && state.running; level++) {
      BigDecimal price =
          side == OrderSide.BUY
              ? config.priceBelow(referencePrice, level)
              : config.priceAbove(referencePrice, level);
      if (price.signum() <= 0) {
        break;
      }
      if (isRungOccupied(side, price) || isRungDeferred(side, price)) {
        continue;
      }
      attempted++;
      if (place(side, price, freshQuantity(side, price), null, null, 0).isPlaced()) {
        placed++;
      }
    }
    return placed;
  }

  private int rungCount(OrderSide side) {
    int count = 0;
    for (LadderOrder tracked : state.openOrders.values()) {
      if (tracked.order().side() == side) {
        count++;
      }
    }
    for (UnresolvedPlacement placement : state.unresolved.values()) {
      if (placement.order().side() == side) {
        count++;
      }
    }
    for (DeferredPlacement placement : state.deferred) {
      if (placement.side() == side) {
        count++;
      }
    }
    return count;
  }

  private boolean isRungDeferred(OrderSide side, BigDecimal price) {
    for (DeferredPlacement placement : state.deferred) {
      if (placement.side() == side && placement.price().compareTo(price) == 0) {
        return true;
      }
    }
    return false;
  }

  private void defer(DeferredPlacement placement) {
    if (placement.attempts() >= config.maxDeferredAttempts()) {
      log.warn(
          "Dropping rung after repeated failures side={} price={} attempts={} reason={}",
          placement.side(),
          placement.price(),
          placement.attempts(),
          placement.reason());
      return;
    }
    state.deferred.add(placement);
  }

  private void haltLocked(String reason) {
    state.running = false;
    state.lastError = reason;
    log.error("Ladder halted symbol={} reason={}", symbol(), reason);
    persist();
  }

  private void persist() {
    if (store == null) {
      return;
    }
    try {
      store.save(snapshotLocked());
    } catch (EngineStateStoreException ex) {
      log.error("Failed to persist ladder state path={}", store.path(), ex);
    }
  }

  private EngineSnapshot snapshotLocked() {
    List<OrderSnapshot> open = new ArrayList<>();
    state.openOrders.values().forEach(tracked -> open.add(OrderSnapshot.of(tracked.order(), tracked.costBasis())));
    List<OrderSnapshot> unresolved = new ArrayList<>();
    state.unresolved
        .values()
        .forEach(placement -> unresolved.add(OrderSnapshot.of(placement.order(), placement.costBasis())));
    return new EngineSnapshot(
        symbol(),
        config.variant(),
        state.running,
        state.lastError,
        state.referencePrice,
        state.lowestBuyPrice,
        state.highestSellPrice,
        state.cumulativeSellRevenue,
        state.realizedNetProfit,
        state.completedRoundTrips,
        open,
        unresolved,
        config.describe(),
        state.startedAt,
        clock.instant());
  }

  private boolean isProfitable(OrderSide side, BigDecimal price, BigDecimal pairedPrice) {
    if (side == OrderSide.BUY) {
      BigDecimal sell = pairedPrice != null ? pairedPrice : config.priceAbove(price, 1);
      return sell.compareTo(ProfitMath.minProfitableSellPrice(price, config.feeRate(), config.feeBuffer())) >= 0;
    }
    BigDecimal buy = pairedPrice != null ? pairedPrice : config.priceBelow(price, 1);
    return buy.compareTo(ProfitMath.maxProfitableBuyPrice(price, config.feeRate(), config.feeBuffer())) <= 0;
  }

  private boolean hasBalance(OrderSide side, BigDecimal price, BigDecimal quantity) {
    if (!balanceTracker.hasFetched()) {
      return true;
    }
    BigDecimal required = side == OrderSide.BUY ? price.multiply(quantity) : quantity;
    return balanceTracker.get(requiredAsset(side)).compareTo(required) >= 0;
  }

  private boolean isRungOccupied(OrderSide side, BigDecimal price) {
    for (LadderOrder tracked : state.openOrders.values()) {
      if (tracked.order().side() == side && tracked.order().price().compareTo(price) == 0) {
        return true;
      }
    }
    for (UnresolvedPlacement placement : state.unresolved.values()) {
      if (placement.order().side() == side && placement.order().price().compareTo(price) == 0) {
        return true;
      }
    }
    return false;
  }

  private void debit(String key, OrderSide side, BigDecimal price, BigDecimal quantity) {
    if (side == OrderSide.BUY) {
      balanceTracker.applyPending(key, config.symbol().quote(), price.multiply(quantity).negate());
    } else {
      balanceTracker.applyPending(key, config.symbol().base(), quantity.negate());
    }
  }

  private BigDecimal minNotionalQuantity(BigDecimal price) {
    BigDecimal target =
        config.minNotional()
            .multiply(BigDecimal.ONE.add(config.feeBuffer()))
            .divide(price, MathContext.DECIMAL64);
    BigDecimal step = config.quantityStep();
    if (step.signum() <= 0) {
      return target;
    }
    return target.divide(step, 0, RoundingMode.CEILING).multiply(step);
  }

  private void extendBounds(OrderSide side, BigDecimal price) {
    if (side == OrderSide.BUY) {
      state.lowestBuyPrice = state.lowestBuyPrice == null ? price : state.lowestBuyPrice.min(price);
    } else {
      state.highestSellPrice = state.highestSellPrice == null ? price : state.highestSellPrice.max(price);
    }
  }

  private String requiredAsset(OrderSide side) {
    return side == OrderSide.BUY ? config.symbol().quote() : config.symbol().base();
  }

  private PlacementResult record(OrderSide side, PlacementResult result) {
    meterRegistry
        .counter(PLACEMENT_COUNTER, "outcome", result.outcome().metricTag(), "side", side.apiValue())
        .increment();
    if (result.isPlaced()) {
      extendBounds(side, result.order().price());
    }
    return result;
  }

  private BigDecimal freshQuantity(OrderSide side, BigDecimal price) {
    return config.orderQuantity(side, config.roundPrice(price), state.referencePrice);
  }

  private String symbol() {
    return config.symbol().venueSymbol();
  }

  private static BigDecimal executedQuantity(VenueOrder update, Order current) {
    BigDecimal executed = update.executedQuantity();
    if (executed == null || executed.signum() < 0) {
      return current.filledQuantity();
    }
    return executed.min(current.quantity()).max(current.filledQuantity());
  }

  private static String rejectionReason(ValidationException ex) {
    if (ex.isInsufficientFunds()) {
      return "insufficient_funds";
    }
    if (ex.isMinNotionalViolation()) {
      return "min_notional";
    }
    return ex.errorCode();
  }

  private static int countPlaced(List<PlacementResult> results) {
    int placed = 0;
    for (PlacementResult result : results) {
      if (result.isPlaced()) {
        placed++;
      }
    }
    return placed;
  }

  private static String shortId() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }

  private static boolean isPositive(BigDecimal value) {
    return value != null && value.signum() > 0;
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value == null ? BigDecimal.ZERO : value;
  }
}
