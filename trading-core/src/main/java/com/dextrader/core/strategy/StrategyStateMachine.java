package com.dextrader.core.strategy;

import com.dextrader.core.model.Direction;
import com.dextrader.core.model.Intent;
import com.dextrader.core.model.IntentPurpose;
import com.dextrader.core.model.Order;
import com.dextrader.core.model.OrderStatus;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.Position;
import com.dextrader.core.model.Side;
import com.dextrader.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Turns signals into entry and exit intents for one (symbol, strategy) pair.
 *
 * <p>Entries need a signal strictly stronger than the threshold, repeated for the configured number
 * of confirmation bars. Exits fire on an opposing signal, the stop-loss or take-profit distance from
 * the entry price, or a signal-supplied stop distance. Grid strategies trade each level of an anchor
 * at most once.
 *
 * <p>Order outcomes are fed back through {@link #onOrderUpdate(Order, Position)}; the exchange position
 * is authoritative and {@link #syncWithPosition(Position, Optional)} realigns the state with it.
 */
public final class StrategyStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(StrategyStateMachine.class);

    private final PairKey pair;
    private final PositionRules rules;

    private StrategyState state = StrategyState.FLAT;
    private double entryPrice;
    private double entryStopDistance = Double.NaN;
    private String pendingClientOrderId;
    private int consecutiveRejections;

    private Direction confirmingDirection = Direction.FLAT;
    private int confirmationCount;
    private Direction pendingDirection = Direction.FLAT;
    private double pendingStopDistance = Double.NaN;

    private Instant gridAnchor;
    private final Set<Double> consumedGridLevels = new HashSet<>();

    public StrategyStateMachine(PairKey pair, PositionRules rules) {
        this.pair = pair;
        this.rules = rules;
    }

    /**
     * Evaluates a signal against the current position.
     *
     * @param price latest price, used for exit distances and as the intent's reference price
     * @return an intent when the signal moves the pair out of FLAT or IN_POSITION
     */
    public synchronized Optional<Intent> onSignal(Signal signal, Position position, double price, Instant now) {
        switch (state) {
            case FLAT:
                return entryIntent(signal, price, now);
            case IN_POSITION:
                resetConfirmation();
                return exitIntent(signal, position, price, now);
            default:
                logger.debug("{}: {} with order {} pending, ignoring {}", pair, state, pendingClientOrderId,
                    signal.direction());
                return Optional.empty();
        }
    }

    private Optional<Intent> entryIntent(Signal signal, double price, Instant now) {
        if (!qualifiesForEntry(signal)) {
            resetConfirmation();
            return Optional.empty();
        }
        if (signal.direction() == confirmingDirection) {
            confirmationCount++;
        } else {
            confirmingDirection = signal.direction();
            confirmationCount = 1;
        }
        if (confirmationCount < rules.confirmationBars()) {
            logger.info("{}: {} signal {}/{} confirmation bars", pair, signal.direction(), confirmationCount,
                rules.confirmationBars());
            return Optional.empty();
        }
        if (signal.hasLevel() && !consumeGridLevel(signal)) {
            logger.debug("{}: grid level {} already traded for anchor {}", pair, signal.levelPrice(), gridAnchor);
            return Optional.empty();
        }

        resetConfirmation();
        pendingDirection = signal.direction();
        pendingStopDistance = signal.stopDistance();
        double notional = rules.positionSizeUsd() * signal.strength();
        Intent intent = new Intent(pair.symbol(), Side.opening(signal.direction()), notional,
            signal.reason(), pair.strategyId(), now, IntentPurpose.ENTRY, price);
        transition(StrategyState.ENTERING, "entry signal " + signal.direction());
        return Optional.of(intent);
    }

    private boolean qualifiesForEntry(Signal signal) {
        if (signal.direction() == Direction.SHORT && !rules.allowShort()) {
            return false;
        }
        return !signal.isFlat() && signal.strength() > rules.signalThreshold();
    }

    private Optional<Intent> exitIntent(Signal signal, Position position, double price, Instant now) {
        if (position.isFlat()) {
            transition(StrategyState.FLAT, "position already flat");
            return Optional.empty();
        }
        Direction held = position.direction();
        String reason = exitReason(signal, held, price);
        if (reason == null) {
            return Optional.empty();
        }
        if (signal.hasLevel()) {
            consumeGridLevel(signal);
        }
        Intent intent = new Intent(pair.symbol(), Side.opening(held).opposite(), position.notionalAt(price),
            reason, pair.strategyId(), now, IntentPurpose.EXIT, price);
        transition(StrategyState.EXITING, reason);
        return Optional.of(intent);
    }

    private String exitReason(Signal signal, Direction held, double price) {
        if (signal.direction() == held.opposite() && signal.strength() > rules.signalThreshold()) {
            return "Opposing signal: " + signal.reason();
        }
        if (entryPrice <= 0.0) {
            return null;
        }
        double move = held == Direction.LONG ? price - entryPrice : entryPrice - price;
        double movePercent = move / entryPrice * 100.0;
        if (rules.stopLossPercent() > 0.0 && movePercent <= -rules.stopLossPercent()) {
            return String.format("Stop loss: %.2f%% from entry %.4f", movePercent, entryPrice);
        }
        if (rules.takeProfitPercent() > 0.0 && movePercent >= rules.takeProfitPercent()) {
            return String.format("Take profit: %.2f%% from entry %.4f", movePercent, entryPrice);
        }
        if (!Double.isNaN(entryStopDistance) && entryStopDistance > 0.0 && move <= -entryStopDistance) {
            return String.format("Stop distance %.4f breached from entry %.4f", entryStopDistance, entryPrice);
        }
        return null;
    }

    private boolean consumeGridLevel(Signal signal) {
        if (signal.levelAnchor() != null && !signal.levelAnchor().equals(gridAnchor)) {
            gridAnchor = signal.levelAnchor();
            consumedGridLevels.clear();
        }
        return consumedGridLevels.add(signal.levelPrice());
    }

    /**
     * Exit intent for the whole position regardless of signals, used when flattening on shutdown.
     */
    public synchronized Optional<Intent> forceExit(Position position, double price, Instant now, String reason) {
        if (position.isFlat() || state.awaitingOrder()) {
            return Optional.empty();
        }
        Intent intent = new Intent(pair.symbol(), Side.opening(position.direction()).opposite(),
            position.notionalAt(price), reason, pair.strategyId(), now, IntentPurpose.EXIT, price);
        transition(StrategyState.EXITING, reason);
        return Optional.of(intent);
    }

    /**
     * Binds the order about to be submitted for the current intent.
     */
    public synchronized void awaitOrder(String clientOrderId) {
        if (!state.awaitingOrder()) {
            throw new IllegalStateException(pair + " is " + state + ", no intent awaiting an order");
        }
        pendingClientOrderId = clientOrderId;
    }

    /**
     * The intent was dropped before an order reached the exchange (risk rejection, live order conflict,
     * sizing below the minimum).
     */
    public synchronized void abandonIntent(String reason) {
        if (state == StrategyState.ENTERING) {
            clearPending();
            transition(StrategyState.FLAT, "entry abandoned: " + reason);
        } else if (state == StrategyState.EXITING) {
            clearPending();
            transition(StrategyState.IN_POSITION, "exit abandoned: " + reason);
        }
    }

    /**
     * Applies an order change for this pair. Updates for orders other than the pending one are ignored.
     *
     * @param position the pair's position after the update
     */
    public synchronized void onOrderUpdate(Order order, Position position) {
        if (pendingClientOrderId == null || !pendingClientOrderId.equals(order.clientOrderId())) {
            return;
        }
        if (order.filledSize() > 0.0) {
            consecutiveRejections = 0;
        }
        if (state == StrategyState.ENTERING) {
            // the symbol position is shared, so only this order's own fill proves the entry
            if (order.filledSize() > 0.0 && !position.isFlat()) {
                entryPrice = position.entryPrice();
                entryStopDistance = pendingStopDistance;
                if (order.status().isTerminal()) {
                    clearPending();
                }
                transition(StrategyState.IN_POSITION, "entry filled at " + entryPrice);
            } else if (order.status().isTerminal()) {
                clearPending();
                transition(StrategyState.FLAT, "entry order " + order.status());
            }
        } else if (state == StrategyState.EXITING) {
            if (position.isFlat()) {
                clearPending();
                clearEntry();
                transition(StrategyState.FLAT, "exit filled");
            } else if (order.status().isTerminal()) {
                clearPending();
                transition(StrategyState.IN_POSITION, "exit order " + order.status());
            }
        } else if (state == StrategyState.IN_POSITION && order.status().isTerminal()) {
            clearPending();
        }

        if (order.status() == OrderStatus.REJECTED) {
            consecutiveRejections++;
            if (consecutiveRejections >= rules.maxConsecutiveRejections()) {
                logger.warn("{}: {} consecutive order rejections, falling back to FLAT", pair, consecutiveRejections);
                consecutiveRejections = 0;
                clearPending();
                clearEntry();
                transition(StrategyState.FLAT, "repeated rejections");
            }
        }
    }

    /**
     * Realigns with the reconciled position and the pending order, if any. A pending order that is terminal
     * is settled as if its final update had been received; an entry order that is no longer tracked is
     * treated as never filled. A FLAT machine never takes over a symbol position it did not open.
     */
    public synchronized void syncWithPosition(Position position, Optional<Order> pendingOrder) {
        if (state.awaitingOrder()) {
            if (pendingClientOrderId != null && pendingOrder.isPresent()) {
                Order order = pendingOrder.get();
                if (order.status().isTerminal()) {
                    onOrderUpdate(order, position);
                }
                return;
            }
            boolean exiting = state == StrategyState.EXITING;
            clearPending();
            if (exiting && !position.isFlat()) {
                transition(StrategyState.IN_POSITION, "pending exit no longer tracked");
            } else {
                clearEntry();
                transition(StrategyState.FLAT, "pending order no longer tracked");
            }
            return;
        }
        if (state == StrategyState.IN_POSITION && position.isFlat()) {
            clearEntry();
            transition(StrategyState.FLAT, "exchange position is flat");
        } else if (state == StrategyState.IN_POSITION && entryPrice <= 0.0) {
            entryPrice = position.entryPrice();
        }
    }

    private void transition(StrategyState next, String reason) {
        if (next != state) {
            logger.atInfo()
                .addKeyValue("pair", pair)
                .addKeyValue("from", state)
                .addKeyValue("to", next)
                .log("{}: {} -> {} ({})", pair, state, next, reason);
            state = next;
        }
    }

    private void resetConfirmation() {
        confirmingDirection = Direction.FLAT;
        confirmationCount = 0;
    }

    private void clearPending() {
        pendingClientOrderId = null;
    }

    private void clearEntry() {
        entryPrice = 0.0;
        entryStopDistance = Double.NaN;
    }

    public synchronized StrategyState state() {
        return state;
    }

    public synchronized Optional<String> pendingClientOrderId() {
        return Optional.ofNullable(pendingClientOrderId);
    }

    public synchronized double entryPrice() {
        return entryPrice;
    }

    public PairKey pair() {
        return pair;
    }

    public synchronized StrategySnapshot snapshot() {
        return new StrategySnapshot(state, entryPrice, entryStopDistance, pendingClientOrderId,
            consecutiveRejections, gridAnchor, consumedGridLevels);
    }

    /**
     * Restores persisted fields after a restart. The next reconciliation corrects anything stale.
     */
    public synchronized void restore(StrategySnapshot snapshot) {
        state = snapshot.state();
        entryPrice = snapshot.entryPrice();
        entryStopDistance = snapshot.entryStopDistance();
        pendingClientOrderId = snapshot.pendingClientOrderId();
        consecutiveRejections = snapshot.consecutiveRejections();
        gridAnchor = snapshot.gridAnchor();
        consumedGridLevels.clear();
        consumedGridLevels.addAll(snapshot.consumedGridLevels());
        resetConfirmation();
        logger.info("{}: restored {} (entry {}, pending order {})", pair, state, entryPrice, pendingClientOrderId);
    }
}
