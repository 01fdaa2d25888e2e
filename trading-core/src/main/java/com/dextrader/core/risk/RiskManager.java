package com.dextrader.core.risk;

import com.dextrader.core.model.AccountState;
import com.dextrader.core.model.Intent;
import com.dextrader.core.model.Position;
import com.dextrader.core.model.RejectionReason;
import com.dextrader.core.model.RiskDecision;
import com.dextrader.core.model.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts, sizes down or rejects intents against account-level limits. Pure: no I/O, no state.
 *
 * Entry checks run in order and stop at the first failure:
 * 1. leverage: resulting open notional / equity must stay within max leverage
 * 2. position cap: resulting position notional must stay within max position USD
 * 3. daily loss: realized PnL today at or below -max daily loss blocks entries
 * 4. drawdown: drawdown from peak at or above max drawdown blocks entries
 *
 * An entry that passes is sized down to the largest notional satisfying 1 and 2. Exits are always
 * approved, capped at the position's notional.
 */
public final class RiskManager {
    private static final Logger logger = LoggerFactory.getLogger(RiskManager.class);

    public RiskDecision evaluate(Intent intent, Position position, AccountState account, RiskLimits limits) {
        if (intent == null || !(intent.requestedNotional() > 0.0) || !(intent.referencePrice() > 0.0)) {
            return reject(intent, RejectionReason.INVALID_INTENT, "Intent needs positive notional and reference price");
        }
        if (intent.isExit()) {
            return evaluateExit(intent, position);
        }
        return evaluateEntry(intent, position, account, limits);
    }

    private RiskDecision evaluateExit(Intent intent, Position position) {
        if (position.isFlat()) {
            return reject(intent, RejectionReason.INVALID_INTENT, "No position to exit");
        }
        Side reducing = position.netSize() > 0 ? Side.SELL : Side.BUY;
        if (intent.side() != reducing) {
            return reject(intent, RejectionReason.INVALID_INTENT, "Exit side " + intent.side() + " would add exposure");
        }
        double positionNotional = position.notionalAt(intent.referencePrice());
        double sized = Math.min(intent.requestedNotional(), positionNotional);
        return RiskDecision.approve(sized, "Exit approved");
    }

    private RiskDecision evaluateEntry(Intent intent, Position position, AccountState account, RiskLimits limits) {
        double equity = account.equity();
        if (!(equity > 0.0)) {
            return reject(intent, RejectionReason.LEVERAGE, String.format("Non-positive equity %.2f", equity));
        }
        double price = intent.referencePrice();
        double positionNotional = position.netSize() * price;
        double otherNotional = Math.max(0.0, account.openNotional() - Math.abs(positionNotional));

        double leverageCapacity = limits.maxLeverage() * equity - otherNotional;
        double leverageHeadroom = headroom(positionNotional, intent.side(), leverageCapacity);
        if (leverageHeadroom <= 0.0) {
            return reject(intent, RejectionReason.LEVERAGE, String.format(
                "Leverage limit %.1fx reached (open %.2f, equity %.2f)", limits.maxLeverage(),
                account.openNotional(), equity));
        }

        double capHeadroom = headroom(positionNotional, intent.side(), limits.maxPositionUsd());
        if (capHeadroom <= 0.0) {
            return reject(intent, RejectionReason.POSITION_CAP, String.format(
                "Position notional %.2f at cap %.2f", Math.abs(positionNotional), limits.maxPositionUsd()));
        }

        if (account.realizedPnlToday() <= -limits.maxDailyLossUsd()) {
            return reject(intent, RejectionReason.DAILY_LOSS, String.format(
                "Daily realized PnL %.2f breaches -%.2f", account.realizedPnlToday(), limits.maxDailyLossUsd()));
        }

        double drawdownPercent = account.drawdown() * 100.0;
        if (drawdownPercent >= limits.maxDrawdownPercent()) {
            return reject(intent, RejectionReason.DRAWDOWN, String.format(
                "Drawdown %.2f%% at or above %.2f%%", drawdownPercent, limits.maxDrawdownPercent()));
        }

        double sized = Math.min(intent.requestedNotional(), Math.min(leverageHeadroom, capHeadroom));
        if (sized < limits.minOrderNotionalUsd()) {
            return reject(intent, RejectionReason.SIZE_TOO_SMALL, String.format(
                "Sized notional %.2f below minimum %.2f", sized, limits.minOrderNotionalUsd()));
        }
        if (sized < intent.requestedNotional()) {
            logger.info("{}: intent sized down from {} to {}", intent.symbol(),
                String.format("%.2f", intent.requestedNotional()), String.format("%.2f", sized));
        }
        return RiskDecision.approve(sized, sized < intent.requestedNotional() ? "Sized down to limits" : "Approved");
    }

    /**
     * Largest notional that can be added on {@code side} while keeping |position| within {@code capacity}.
     */
    private static double headroom(double signedPositionNotional, Side side, double capacity) {
        return side == Side.BUY ? capacity - signedPositionNotional : capacity + signedPositionNotional;
    }

    private static RiskDecision reject(Intent intent, RejectionReason reason, String detail) {
        logger.warn("{}: risk rejection {} - {}", intent != null ? intent.symbol() : "?", reason, detail);
        return RiskDecision.reject(reason, detail);
    }

    /**
     * Current account figures and which limits are breached.
     */
    public RiskSummary summarize(AccountState account, RiskLimits limits) {
        double equity = account.equity();
        double leverage = account.leverage();
        double marginRatio = equity > 0.0 ? account.marginUsed() / equity : 0.0;
        double drawdownPercent = account.drawdown() * 100.0;
        return new RiskSummary(
            equity,
            account.openNotional(),
            leverage,
            marginRatio,
            drawdownPercent,
            account.realizedPnlToday(),
            equity <= 0.0 || leverage >= limits.maxLeverage(),
            account.realizedPnlToday() <= -limits.maxDailyLossUsd(),
            drawdownPercent >= limits.maxDrawdownPercent());
    }
}
