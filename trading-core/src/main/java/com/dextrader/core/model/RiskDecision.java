package com.dextrader.core.model;

import java.util.Optional;

/**
 * Outcome of a risk evaluation. Never mutates the evaluated intent.
 */
public record RiskDecision(
    boolean approved,
    double sizedNotional,
    RejectionReason rejectionReason,
    String detail
) {
    public static RiskDecision approve(double sizedNotional, String detail) {
        return new RiskDecision(true, sizedNotional, null, detail);
    }

    public static RiskDecision reject(RejectionReason reason, String detail) {
        return new RiskDecision(false, 0.0, reason, detail);
    }

    public Optional<RejectionReason> rejection() {
        return Optional.ofNullable(rejectionReason);
    }
}
