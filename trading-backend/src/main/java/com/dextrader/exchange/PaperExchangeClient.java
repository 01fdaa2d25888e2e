package com.dextrader.exchange;

import com.dextrader.core.error.ExchangeRejectionException;
import com.dextrader.core.exchange.AccountSnapshot;
import com.dextrader.core.exchange.ExchangeClient;
import com.dextrader.core.exchange.ExchangeFill;
import com.dextrader.core.exchange.ExchangeOrder;
import com.dextrader.core.exchange.ExchangePosition;
import com.dextrader.core.exchange.OrderAck;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.OrderRequest;
import com.dextrader.core.model.OrderStatus;
import com.dextrader.core.model.OrderType;
import com.dextrader.core.model.Side;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory exchange for paper trading on live market data.
 *
 * Market orders fill at the mid price. Post-only limit orders rest until a candle closing after their
 * submission trades through the limit price, and then fill at the limit. Positions are netted per symbol
 * and equity is the starting balance plus realized and unrealized PnL.
 *
 * Market data is fetched outside the monitor guarding the book, so a slow request never blocks other
 * callers; state is re-checked once the data is in hand.
 */
public final class PaperExchangeClient implements ExchangeClient {
    private static final Logger logger = LoggerFactory.getLogger(PaperExchangeClient.class);

    private final MarketDataSource marketData;
    private final Timeframe timeframe;
    private final double startingEquity;
    private final double marginLeverage;
    private final Clock clock;

    private final Map<String, RestingOrder> resting = new LinkedHashMap<>();
    private final Map<String, OrderAck> outcomes = new HashMap<>();
    private final Map<String, PaperPosition> positions = new HashMap<>();
    private final Map<String, Double> marks = new HashMap<>();
    private final List<ExchangeFill> fills = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private double realizedPnl;

    /**
     * @param marginLeverage leverage used to derive margin usage from open notional
     */
    public PaperExchangeClient(MarketDataSource marketData, Timeframe timeframe, double startingEquity,
                               double marginLeverage, Clock clock) {
        this.marketData = marketData;
        this.timeframe = timeframe;
        this.startingEquity = startingEquity;
        this.marginLeverage = marginLeverage;
        this.clock = clock;
        logger.info("Paper exchange started with ${} equity", String.format("%.2f", startingEquity));
    }

    @Override
    public List<Candle> getCandles(String symbol, Timeframe timeframe, int lookback) {
        return marketData.getCandles(symbol, timeframe, lookback);
    }

    @Override
    public Ticker getTicker(String symbol) {
        Ticker ticker = marketData.getTicker(symbol);
        synchronized (this) {
            marks.put(symbol, ticker.mid());
        }
        return ticker;
    }

    @Override
    public MarketInfo getMarketInfo(String symbol) {
        return marketData.getMarketInfo(symbol);
    }

    @Override
    public synchronized AccountSnapshot getAccountState() {
        double unrealized = 0.0;
        double notional = 0.0;
        for (PaperPosition position : positions.values()) {
            double mark = marks.getOrDefault(position.symbol, position.entryPrice);
            unrealized += position.netSize * (mark - position.entryPrice);
            notional += Math.abs(position.netSize) * mark;
        }
        double equity = startingEquity + realizedPnl + unrealized;
        double marginUsed = notional / marginLeverage;
        return new AccountSnapshot(equity, marginUsed, equity - marginUsed);
    }

    @Override
    public OrderAck submitOrder(OrderRequest request) {
        String clientOrderId = request.clientOrderId();
        synchronized (this) {
            OrderAck known = knownOutcome(clientOrderId);
            if (known != null) {
                return known;
            }
            checkReduceOnly(request);
        }
        boolean needsQuote = request.type() == OrderType.MARKET || request.postOnly();
        Ticker ticker = needsQuote ? marketData.getTicker(request.symbol()) : null;

        synchronized (this) {
            OrderAck known = knownOutcome(clientOrderId);
            if (known != null) {
                return known;
            }
            double size = checkReduceOnly(request);
            String exchangeOrderId = "paper-" + sequence.incrementAndGet();

            if (request.type() == OrderType.MARKET) {
                marks.put(request.symbol(), ticker.mid());
                execute(clientOrderId, exchangeOrderId, request.symbol(), request.side(), size, ticker.mid());
                OrderAck ack = OrderAck.filled(clientOrderId, exchangeOrderId, size, ticker.mid());
                outcomes.put(clientOrderId, ack);
                return ack;
            }

            double price = request.price();
            if (request.postOnly()) {
                boolean crosses = request.side() == Side.BUY ? price >= ticker.ask() : price <= ticker.bid();
                if (crosses) {
                    OrderAck rejected = new OrderAck(clientOrderId, exchangeOrderId, OrderStatus.REJECTED, 0.0, 0.0,
                        "Post-only order would cross the book");
                    outcomes.put(clientOrderId, rejected);
                    throw new ExchangeRejectionException(clientOrderId, rejected.message());
                }
            }
            resting.put(clientOrderId, new RestingOrder(request, exchangeOrderId, size, clock.instant()));
            logger.info("Paper {} limit {} {} @ {} resting ({})", request.side(), size, request.symbol(), price,
                clientOrderId);
            return OrderAck.resting(clientOrderId, exchangeOrderId);
        }
    }

    /** The stored outcome or resting acknowledgement for a client order id seen before, else null. */
    private OrderAck knownOutcome(String clientOrderId) {
        OrderAck known = outcomes.get(clientOrderId);
        if (known != null) {
            logger.debug("Duplicate submission of {}, returning {}", clientOrderId, known.status());
            return known;
        }
        RestingOrder existing = resting.get(clientOrderId);
        return existing != null ? OrderAck.resting(clientOrderId, existing.exchangeOrderId) : null;
    }

    /**
     * @return the size the order may trade: reduce-only orders are capped at the open position
     * @throws ExchangeRejectionException if a reduce-only order would open or grow a position
     */
    private double checkReduceOnly(OrderRequest request) {
        if (!request.reduceOnly()) {
            return request.size();
        }
        PaperPosition position = positions.get(request.symbol());
        if (position == null || position.netSize == 0.0 || Math.signum(position.netSize) == request.side().sign()) {
            throw new ExchangeRejectionException(request.clientOrderId(), "Reduce-only order would increase position");
        }
        return Math.min(request.size(), Math.abs(position.netSize));
    }

    @Override
    public synchronized OrderAck cancelOrder(String symbol, String clientOrderId) {
        RestingOrder order = resting.remove(clientOrderId);
        if (order == null) {
            OrderAck known = outcomes.get(clientOrderId);
            if (known != null) {
                return known;
            }
            throw new ExchangeRejectionException(clientOrderId, "Unknown order " + clientOrderId);
        }
        OrderAck ack = OrderAck.cancelled(clientOrderId, order.exchangeOrderId, 0.0, 0.0);
        outcomes.put(clientOrderId, ack);
        logger.info("Paper order {} cancelled", clientOrderId);
        return ack;
    }

    @Override
    public List<ExchangeOrder> getOpenOrders() {
        matchRestingOrders();
        synchronized (this) {
            List<ExchangeOrder> result = new ArrayList<>();
            for (RestingOrder order : resting.values()) {
                OrderRequest request = order.request;
                result.add(new ExchangeOrder(request.clientOrderId(), order.exchangeOrderId, request.symbol(),
                    request.side(), request.type(), request.price(), order.size, 0.0));
            }
            return result;
        }
    }

    @Override
    public synchronized List<ExchangePosition> getPositions() {
        List<ExchangePosition> result = new ArrayList<>();
        for (PaperPosition position : positions.values()) {
            if (position.netSize != 0.0) {
                result.add(new ExchangePosition(position.symbol, position.netSize, position.entryPrice,
                    position.realizedPnl, marks.getOrDefault(position.symbol, position.entryPrice)));
            }
        }
        return result;
    }

    @Override
    public synchronized List<ExchangeFill> getRecentFills(Instant since) {
        return fills.stream().filter(f -> !f.time().isBefore(since)).toList();
    }

    /**
     * Fills resting limit orders whose price was traded through by a candle that closed after submission.
     */
    void matchRestingOrders() {
        Map<String, List<RestingOrder>> candidatesBySymbol;
        synchronized (this) {
            candidatesBySymbol = resting.values().stream()
                .collect(Collectors.groupingBy(order -> order.request.symbol(), LinkedHashMap::new, Collectors.toList()));
        }
        for (Map.Entry<String, List<RestingOrder>> entry : candidatesBySymbol.entrySet()) {
            List<Candle> candles = marketData.getCandles(entry.getKey(), timeframe, 2);
            fillTradedThrough(entry.getKey(), entry.getValue(), candles);
        }
    }

    private void fillTradedThrough(String symbol, List<RestingOrder> candidates, List<Candle> candles) {
        Instant now = clock.instant();
        for (RestingOrder order : candidates) {
            double limit = order.request.price();
            boolean traded = candles.stream()
                .filter(c -> c.openTime().plus(timeframe.duration()).isAfter(order.submittedAt))
                .filter(c -> !c.openTime().plus(timeframe.duration()).isAfter(now))
                .anyMatch(c -> order.request.side() == Side.BUY ? c.low() <= limit : c.high() >= limit);
            if (!traded) {
                continue;
            }
            synchronized (this) {
                if (resting.remove(order.request.clientOrderId()) == null) {
                    continue;
                }
                execute(order.request.clientOrderId(), order.exchangeOrderId, symbol, order.request.side(),
                    order.size, limit);
                outcomes.put(order.request.clientOrderId(),
                    OrderAck.filled(order.request.clientOrderId(), order.exchangeOrderId, order.size, limit));
            }
        }
    }

    private void execute(String clientOrderId, String exchangeOrderId, String symbol, Side side, double size,
                         double price) {
        PaperPosition position = positions.computeIfAbsent(symbol, PaperPosition::new);
        double realized = position.apply(side.sign() * size, price);
        realizedPnl += realized;
        Instant now = clock.instant();
        fills.add(new ExchangeFill("fill-" + sequence.incrementAndGet(), clientOrderId, exchangeOrderId, symbol,
            side, size, price, now));
        logger.atInfo()
            .addKeyValue("symbol", symbol)
            .addKeyValue("side", side)
            .addKeyValue("size", size)
            .addKeyValue("price", price)
            .log("Paper fill {} {} {} @ {} (realized {})", side, size, symbol, price,
                String.format("%.2f", realized));
    }

    private static final class RestingOrder {
        final OrderRequest request;
        final String exchangeOrderId;
        final double size;
        final Instant submittedAt;

        RestingOrder(OrderRequest request, String exchangeOrderId, double size, Instant submittedAt) {
            this.request = request;
            this.exchangeOrderId = exchangeOrderId;
            this.size = size;
            this.submittedAt = submittedAt;
        }
    }

    private static final class PaperPosition {
        final String symbol;
        double netSize;
        double entryPrice;
        double realizedPnl;

        PaperPosition(String symbol) {
            this.symbol = symbol;
        }

        /** Applies a signed size change and returns the PnL it realized. */
        double apply(double signedSize, double price) {
            double realized = 0.0;
            if (netSize == 0.0 || Math.signum(netSize) == Math.signum(signedSize)) {
                double total = netSize + signedSize;
                entryPrice = (Math.abs(netSize) * entryPrice + Math.abs(signedSize) * price) / Math.abs(total);
                netSize = total;
                return 0.0;
            }
            double closing = Math.min(Math.abs(signedSize), Math.abs(netSize));
            realized = closing * (price - entryPrice) * Math.signum(netSize);
            realizedPnl += realized;
            double remaining = netSize + signedSize;
            if (Math.abs(remaining) < 1e-12) {
                netSize = 0.0;
                entryPrice = 0.0;
            } else if (Math.signum(remaining) != Math.signum(netSize)) {
                netSize = remaining;
                entryPrice = price;
            } else {
                netSize = remaining;
            }
            return realized;
        }
    }
}
