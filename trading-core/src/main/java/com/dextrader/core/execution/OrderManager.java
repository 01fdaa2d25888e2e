package com.dextrader.core.execution;

import com.dextrader.core.error.ExchangeException;
import com.dextrader.core.error.ExchangeRejectionException;
import com.dextrader.core.error.LiveOrderExistsException;
import com.dextrader.core.error.TransientTransportException;
import com.dextrader.core.error.UnknownOrderException;
import com.dextrader.core.exchange.ExchangeClient;
import com.dextrader.core.exchange.ExchangeOrder;
import com.dextrader.core.exchange.ExchangeSnapshot;
import com.dextrader.core.exchange.OrderAck;
import com.dextrader.core.exchange.RetryPolicy;
import com.dextrader.core.model.FillEvent;
import com.dextrader.core.model.Order;
import com.dextrader.core.model.OrderRequest;
import com.dextrader.core.model.OrderStatus;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.position.PositionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owns the lifecycle of every order the engine places.
 *
 * <ul>
 *   <li>Submission is idempotent on the client order id: a known id returns the existing order and
 *       never reaches the exchange again.</li>
 *   <li>At most one live order exists per (symbol, strategy) pair.</li>
 *   <li>Transient transport failures are retried through the {@link RetryPolicy}; when attempts run out
 *       the order is REJECTED and reported. Exchange rejections are terminal at once.</li>
 *   <li>Reconciliation overwrites local order and position state with the exchange snapshot. Every
 *       acknowledgement takes a sequence number; a snapshot fetched before an order's acknowledgement
 *       leaves that order, and the position of its symbol, alone.</li>
 * </ul>
 */
public final class OrderManager {
    private static final Logger logger = LoggerFactory.getLogger(OrderManager.class);
    private static final double SIZE_EPSILON = 1e-9;
    private static final String EXTERNAL_STRATEGY = "external";

    private final ExchangeClient exchange;
    private final RetryPolicy retryPolicy;
    private final PositionTracker positions;
    private final Clock clock;
    private final Duration maxOrderAge;
    private final Duration fillLookback;

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<PairKey, String> liveByPair = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final List<OrderEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock reconcileLock = new ReentrantLock();
    private final AtomicLong acknowledgements = new AtomicLong();
    private final Map<String, Long> acknowledgedAt = new ConcurrentHashMap<>();
    private long appliedEpoch;

    public OrderManager(ExchangeClient exchange, RetryPolicy retryPolicy, PositionTracker positions,
                        Clock clock, Duration maxOrderAge) {
        this.exchange = exchange;
        this.retryPolicy = retryPolicy;
        this.positions = positions;
        this.clock = clock;
        this.maxOrderAge = maxOrderAge;
        this.fillLookback = maxOrderAge.multipliedBy(2).compareTo(Duration.ofHours(1)) > 0
            ? maxOrderAge.multipliedBy(2)
            : Duration.ofHours(1);
    }

    public void addListener(OrderEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Submits an order, or returns the existing one if its client order id is already known.
     *
     * @throws LiveOrderExistsException if the pair already has a different live order
     */
    public Order submit(OrderRequest request) {
        String id = request.clientOrderId();
        Order existing = orders.get(id);
        if (existing != null) {
            logger.debug("{}: duplicate submission ignored, order is {}", id, existing.status());
            return existing;
        }

        Order[] prior = new Order[1];
        liveByPair.compute(request.pair(), (pair, current) -> {
            prior[0] = orders.get(id);
            if (prior[0] != null) {
                return current;
            }
            if (current != null) {
                Order live = orders.get(current);
                if (live != null && live.isLive()) {
                    throw new LiveOrderExistsException(pair, current);
                }
            }
            inFlight.add(id);
            orders.put(id, Order.pending(request, clock.instant()));
            return id;
        });
        if (prior[0] != null) {
            return prior[0];
        }

        logger.atInfo()
            .addKeyValue("clientOrderId", id)
            .addKeyValue("symbol", request.symbol())
            .log("{}: submitting {} {} {} size={} price={} reduceOnly={}", request.pair(), request.type(),
                request.side(), request.symbol(), request.size(), request.price(), request.reduceOnly());

        try {
            OrderAck ack = retryPolicy.execute(() -> exchange.submitOrder(request));
            markAcknowledged(id);
            publish(update(id, order -> applyAck(order, ack)));
        } catch (ExchangeRejectionException e) {
            logger.warn("{}: rejected by exchange: {}", id, e.getMessage());
            publish(update(id, order -> order.transitionTo(OrderStatus.REJECTED, clock.instant(), e.getMessage())));
        } catch (TransientTransportException e) {
            logger.error("{}: submission failed after {} attempts, marking REJECTED", id,
                retryPolicy.settings().maxAttempts(), e);
            publish(update(id, order -> order.transitionTo(OrderStatus.REJECTED, clock.instant(),
                "transport retries exhausted: " + e.getMessage())));
        } finally {
            inFlight.remove(id);
        }

        reconcileNow();
        return orders.get(id);
    }

    /**
     * Cancels a live order. Cancelling a terminal order returns it unchanged.
     *
     * @throws UnknownOrderException if the id was never submitted
     */
    public Order cancel(String clientOrderId) {
        Order order = orders.get(clientOrderId);
        if (order == null) {
            throw new UnknownOrderException(clientOrderId);
        }
        if (!order.isLive()) {
            return order;
        }
        if (order.status() == OrderStatus.PENDING && order.exchangeOrderId() == null) {
            if (inFlight.contains(clientOrderId)) {
                logger.info("{}: submission in flight, cancel deferred to reconciliation", clientOrderId);
                return order;
            }
            publish(update(clientOrderId, o -> o.transitionTo(OrderStatus.CANCELLED, clock.instant(),
                "cancelled before acknowledgement")));
            return orders.get(clientOrderId);
        }

        try {
            OrderAck ack = retryPolicy.execute(() -> exchange.cancelOrder(order.symbol(), clientOrderId));
            markAcknowledged(clientOrderId);
            publish(update(clientOrderId, o -> applyAck(o, ack)));
            logger.info("{}: cancel acknowledged, status {}", clientOrderId, orders.get(clientOrderId).status());
        } catch (ExchangeRejectionException e) {
            logger.warn("{}: cancel refused ({}), reconciling", clientOrderId, e.getMessage());
        } catch (TransientTransportException e) {
            logger.error("{}: cancel failed after retries, reconciliation will settle it", clientOrderId, e);
        }
        reconcileNow();
        return orders.get(clientOrderId);
    }

    private void markAcknowledged(String clientOrderId) {
        acknowledgedAt.put(clientOrderId, acknowledgements.incrementAndGet());
    }

    private boolean acknowledgedAfter(String clientOrderId, long epoch) {
        Long sequence = acknowledgedAt.get(clientOrderId);
        return sequence != null && sequence > epoch;
    }

    private Order applyAck(Order order, OrderAck ack) {
        Instant now = clock.instant();
        Order updated = order;
        if (ack.exchangeOrderId() != null && !ack.exchangeOrderId().equals(order.exchangeOrderId())) {
            updated = updated.withExchangeOrderId(ack.exchangeOrderId(), now);
        }
        updated = updated.withCumulativeFill(ack.cumulativeFilled(), ack.averagePrice(), now);
        OrderStatus next = ack.status();
        if (next == OrderStatus.OPEN && updated.filledSize() > 0.0) {
            next = OrderStatus.PARTIALLY_FILLED;
        }
        if (next != OrderStatus.PENDING && next != updated.status() && updated.status().canTransitionTo(next)) {
            updated = updated.transitionTo(next, now, ack.message());
        }
        return updated;
    }

    /**
     * Pulls an exchange snapshot and reconciles against it. Failures are logged; the next periodic
     * reconciliation retries.
     */
    public Optional<ReconciliationReport> reconcileNow() {
        Instant now = clock.instant();
        long epoch = acknowledgements.get();
        ExchangeSnapshot snapshot;
        try {
            snapshot = new ExchangeSnapshot(
                exchange.getOpenOrders(),
                exchange.getPositions(),
                exchange.getRecentFills(now.minus(fillLookback)),
                now);
        } catch (ExchangeException e) {
            logger.warn("Reconciliation skipped, exchange snapshot unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        return reconcile(snapshot, epoch);
    }

    /**
     * Corrects local orders and positions to match a snapshot fetched after every acknowledgement seen
     * so far. Orders whose submission is still in flight are left alone.
     */
    public ReconciliationReport reconcile(ExchangeSnapshot snapshot) {
        return reconcile(snapshot, acknowledgements.get())
            .orElseThrow(() -> new IllegalStateException("Snapshot is older than the last reconciliation"));
    }

    /**
     * @param epoch acknowledgement sequence observed before the snapshot was fetched; orders acknowledged
     *              later, and their symbols' positions, are newer than the snapshot and are skipped
     * @return empty when a snapshot fetched after this one has already been applied
     */
    private Optional<ReconciliationReport> reconcile(ExchangeSnapshot snapshot, long epoch) {
        reconcileLock.lock();
        try {
            if (epoch < appliedEpoch) {
                logger.debug("Discarding snapshot from {}, a newer one was already applied", snapshot.takenAt());
                return Optional.empty();
            }
            List<ReconciliationMismatch> mismatches = new ArrayList<>();
            List<OrderChange> changes = new ArrayList<>();
            Set<String> unsettled = new HashSet<>();

            for (Order local : new ArrayList<>(orders.values())) {
                String id = local.clientOrderId();
                if (inFlight.contains(id) || acknowledgedAfter(id, epoch)) {
                    unsettled.add(local.symbol());
                    continue;
                }
                if (!local.isLive()) {
                    continue;
                }
                OrderChange change = reconcileOrder(local, snapshot, mismatches);
                if (change != null) {
                    changes.add(change);
                }
            }

            for (ExchangeOrder remote : snapshot.openOrders()) {
                String id = remote.clientOrderId() != null ? remote.clientOrderId() : "ext:" + remote.exchangeOrderId();
                Order local = orders.get(id);
                if (local == null) {
                    adopt(id, remote, snapshot.takenAt());
                    mismatches.add(new ReconciliationMismatch(ReconciliationMismatch.Kind.UNKNOWN_ORDER,
                        remote.symbol(), id, "none", remote.side() + " " + remote.size()));
                } else if (!local.isLive() && !acknowledgedAfter(id, epoch)) {
                    mismatches.add(new ReconciliationMismatch(ReconciliationMismatch.Kind.ORPHANED_ORDER,
                        remote.symbol(), id, local.status().name(), "resting"));
                    cancelOrphan(remote, id);
                }
            }

            for (OrderChange change : changes) {
                applyFill(change);
            }
            mismatches.addAll(positions.reconcile(snapshot.positions(), snapshot.takenAt(), unsettled));
            for (OrderChange change : changes) {
                notifyListeners(change);
            }

            for (ReconciliationMismatch mismatch : mismatches) {
                logger.atWarn()
                    .addKeyValue("kind", mismatch.kind())
                    .addKeyValue("symbol", mismatch.symbol())
                    .log("Reconciliation mismatch corrected: {}", mismatch);
            }
            appliedEpoch = epoch;
            acknowledgedAt.values().removeIf(sequence -> sequence <= epoch);
            return Optional.of(new ReconciliationReport(snapshot.takenAt(), mismatches));
        } finally {
            reconcileLock.unlock();
        }
    }

    private OrderChange reconcileOrder(Order local, ExchangeSnapshot snapshot, List<ReconciliationMismatch> mismatches) {
        String id = local.clientOrderId();
        Instant now = snapshot.takenAt();
        double reportedFill = snapshot.filledSize(id);
        double averagePrice = snapshot.averageFillPrice(id);
        Optional<ExchangeOrder> resting = snapshot.openOrder(id);

        if (resting.isPresent()) {
            ExchangeOrder remote = resting.get();
            double filled = Math.max(Math.max(local.filledSize(), remote.filledSize()), reportedFill);
            OrderStatus target = filled > SIZE_EPSILON ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            boolean differs = local.status() != target
                || Math.abs(local.filledSize() - filled) > SIZE_EPSILON
                || (remote.exchangeOrderId() != null && !remote.exchangeOrderId().equals(local.exchangeOrderId()));
            if (!differs) {
                return null;
            }
            mismatches.add(new ReconciliationMismatch(ReconciliationMismatch.Kind.ORDER_STATE, local.symbol(), id,
                local.status() + "/" + local.filledSize(), target + "/" + filled));
            return update(id, order -> {
                Order updated = order;
                if (remote.exchangeOrderId() != null) {
                    updated = updated.withExchangeOrderId(remote.exchangeOrderId(), now);
                }
                updated = updated.withCumulativeFill(filled, averagePrice, now);
                return updated.status() == target ? updated : updated.transitionTo(target, now, "reconciled");
            });
        }

        double filled = Math.max(local.filledSize(), reportedFill);
        OrderStatus target = filled >= local.size() - SIZE_EPSILON ? OrderStatus.FILLED : OrderStatus.CANCELLED;
        mismatches.add(new ReconciliationMismatch(ReconciliationMismatch.Kind.ORDER_MISSING, local.symbol(), id,
            local.status() + "/" + local.filledSize(), target + "/" + filled));
        return update(id, order -> order
            .withCumulativeFill(filled, averagePrice, now)
            .transitionTo(target, now, "not resting on exchange"));
    }

    private void adopt(String id, ExchangeOrder remote, Instant now) {
        PairKey pair = ClientOrderIds.pairOf(id).orElse(new PairKey(remote.symbol(), EXTERNAL_STRATEGY));
        OrderRequest request = new OrderRequest(id, remote.symbol(), pair.strategyId(), remote.side(), remote.type(),
            remote.price() > 0.0 ? remote.price() : null, remote.size(), false, false);
        Order adopted = Order.pending(request, now)
            .withExchangeOrderId(remote.exchangeOrderId(), now)
            .withCumulativeFill(remote.filledSize(), 0.0, now)
            .transitionTo(remote.filledSize() > SIZE_EPSILON ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN,
                now, "adopted from exchange");
        orders.put(id, adopted);
        liveByPair.put(pair, id);
    }

    private void cancelOrphan(ExchangeOrder remote, String id) {
        try {
            exchange.cancelOrder(remote.symbol(), id);
            logger.warn("{}: cancelled orphaned exchange order {}", id, remote.exchangeOrderId());
        } catch (ExchangeException e) {
            logger.error("{}: failed to cancel orphaned exchange order {}", id, remote.exchangeOrderId(), e);
        }
    }

    /**
     * Cancels working orders older than the maximum age and rejects submissions that never got an
     * exchange acknowledgement.
     *
     * @return number of orders swept
     */
    public int sweepStaleOrders() {
        Instant cutoff = clock.instant().minus(maxOrderAge);
        int swept = 0;
        for (Order order : new ArrayList<>(orders.values())) {
            if (!order.isLive() || !order.createdAt().isBefore(cutoff) || inFlight.contains(order.clientOrderId())) {
                continue;
            }
            swept++;
            if (order.status() == OrderStatus.PENDING && order.exchangeOrderId() == null) {
                logger.warn("{}: never acknowledged, marking REJECTED", order.clientOrderId());
                publish(update(order.clientOrderId(), o -> o.transitionTo(OrderStatus.REJECTED, clock.instant(),
                    "stale unacknowledged submission")));
            } else {
                logger.info("{}: older than {}s, cancelling", order.clientOrderId(), maxOrderAge.toSeconds());
                cancel(order.clientOrderId());
            }
        }
        return swept;
    }

    /**
     * Re-registers orders persisted before a restart. Live ones are verified by the next reconciliation.
     */
    public void restore(Collection<Order> restored) {
        for (Order order : restored) {
            orders.putIfAbsent(order.clientOrderId(), order);
            if (order.isLive()) {
                liveByPair.put(order.pair(), order.clientOrderId());
            }
        }
    }

    public Optional<Order> get(String clientOrderId) {
        return Optional.ofNullable(orders.get(clientOrderId));
    }

    public Optional<Order> liveOrder(PairKey pair) {
        String id = liveByPair.get(pair);
        if (id == null) {
            return Optional.empty();
        }
        Order order = orders.get(id);
        return order != null && order.isLive() ? Optional.of(order) : Optional.empty();
    }

    public List<Order> liveOrders() {
        return orders.values().stream().filter(Order::isLive).toList();
    }

    public boolean hasInFlightSubmissions() {
        return !inFlight.isEmpty();
    }

    private OrderChange update(String clientOrderId, UnaryOperator<Order> change) {
        Order[] before = new Order[1];
        Order after = orders.computeIfPresent(clientOrderId, (id, current) -> {
            before[0] = current;
            return change.apply(current);
        });
        if (after == null) {
            throw new UnknownOrderException(clientOrderId);
        }
        return new OrderChange(before[0], after);
    }

    private void publish(OrderChange change) {
        applyFill(change);
        notifyListeners(change);
    }

    private void applyFill(OrderChange change) {
        change.fill().ifPresent(positions::applyFill);
    }

    private void notifyListeners(OrderChange change) {
        Order after = change.after();
        if (after.status() != change.before().status()) {
            logger.atInfo()
                .addKeyValue("clientOrderId", after.clientOrderId())
                .addKeyValue("status", after.status())
                .log("{}: {} -> {}{}", after.clientOrderId(), change.before().status(), after.status(),
                    after.statusReason() != null ? " (" + after.statusReason() + ")" : "");
        }
        if (after.status().isTerminal()) {
            liveByPair.remove(after.pair(), after.clientOrderId());
        }
        change.fill().ifPresent(fill -> listeners.forEach(l -> l.onFill(after, fill)));
        if (after.status().isTerminal() && !change.before().status().isTerminal()) {
            listeners.forEach(l -> l.onTerminal(after));
        }
    }

    private record OrderChange(Order before, Order after) {
        /** Fill for the size added by this change, priced so that cumulative value is preserved. */
        Optional<FillEvent> fill() {
            double delta = after.filledSize() - before.filledSize();
            if (delta <= SIZE_EPSILON) {
                return Optional.empty();
            }
            double value = after.filledSize() * after.averageFillPrice() - before.filledSize() * before.averageFillPrice();
            double price = value > 0.0 ? value / delta : after.averageFillPrice();
            if (!(price > 0.0)) {
                return Optional.empty();
            }
            return Optional.of(new FillEvent(after.clientOrderId(), after.symbol(), after.side(), delta, price,
                after.updatedAt()));
        }
    }
}
