package com.dextrader.core.model;

/**
 * Whether an intent opens exposure or reduces it. Risk limits on new exposure never block exits.
 */
public enum IntentPurpose {
    ENTRY,
    EXIT
}
