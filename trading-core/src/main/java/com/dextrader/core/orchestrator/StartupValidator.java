package com.dextrader.core.orchestrator;

import com.dextrader.core.risk.RiskLimits;
import com.dextrader.core.strategy.PositionRules;

import java.util.ArrayList;
import java.util.List;

/**
 * Sanity checks of sizing against limits and account equity, run once before trading starts.
 * Problems are reported as warnings; none of them stops the engine.
 */
public final class StartupValidator {

    private StartupValidator() {
    }

    public static List<String> validate(EngineSettings settings, double equity) {
        List<String> warnings = new ArrayList<>();
        PositionRules rules = settings.positionRules();
        RiskLimits limits = settings.riskLimits();
        double smallestEntry = rules.positionSizeUsd() * Math.min(1.0, rules.signalThreshold());

        if (rules.positionSizeUsd() < limits.minOrderNotionalUsd()) {
            warnings.add(String.format("Position size $%.2f is below the exchange minimum $%.2f; every entry will be rejected",
                rules.positionSizeUsd(), limits.minOrderNotionalUsd()));
        } else if (smallestEntry < limits.minOrderNotionalUsd()) {
            warnings.add(String.format("Weak signals size entries down to $%.2f, below the exchange minimum $%.2f",
                smallestEntry, limits.minOrderNotionalUsd()));
        }
        if (rules.positionSizeUsd() > limits.maxPositionUsd()) {
            warnings.add(String.format("Position size $%.2f exceeds the position cap $%.2f; entries will be sized down",
                rules.positionSizeUsd(), limits.maxPositionUsd()));
        }
        if (equity <= 0.0) {
            warnings.add(String.format("Account equity is $%.2f; no entries can be approved", equity));
        } else {
            double capacity = equity * limits.maxLeverage();
            double required = rules.positionSizeUsd() * settings.symbols().size();
            if (required > capacity) {
                warnings.add(String.format(
                    "Equity $%.2f at %.1fx leverage supports $%.2f of exposure, %d symbols at $%.2f need $%.2f",
                    equity, limits.maxLeverage(), capacity, settings.symbols().size(), rules.positionSizeUsd(),
                    required));
            }
        }
        return warnings;
    }
}
