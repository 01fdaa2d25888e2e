package com.dextrader.core.execution;

/**
 * One difference between local and exchange state, corrected in favour of the exchange.
 *
 * @param subject client order id for order mismatches, symbol for position mismatches
 */
public record ReconciliationMismatch(Kind kind, String symbol, String subject, String local, String exchange) {

    public enum Kind {
        /** Local order status or fill differs from the exchange. */
        ORDER_STATE,
        /** Local live order is no longer resting on the exchange. */
        ORDER_MISSING,
        /** Exchange has a resting order the engine did not know. */
        UNKNOWN_ORDER,
        /** Exchange has a resting order the engine already considers terminal. */
        ORPHANED_ORDER,
        /** Net size or entry price differs. */
        POSITION_SIZE,
        /** Local position has no counterpart on the exchange. */
        POSITION_MISSING,
        /** Exchange position was unknown locally. */
        POSITION_UNKNOWN
    }

    @Override
    public String toString() {
        return String.format("%s %s %s: local=%s exchange=%s", kind, symbol, subject, local, exchange);
    }
}
