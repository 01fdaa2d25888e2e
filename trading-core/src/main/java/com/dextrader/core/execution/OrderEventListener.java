package com.dextrader.core.execution;

import com.dextrader.core.model.FillEvent;
import com.dextrader.core.model.Order;

/**
 * Callbacks from {@link OrderManager}. Invoked on the thread that observed the change, after the
 * position tracker has been updated.
 */
public interface OrderEventListener {

    default void onFill(Order order, FillEvent fill) {
    }

    default void onTerminal(Order order) {
    }
}
