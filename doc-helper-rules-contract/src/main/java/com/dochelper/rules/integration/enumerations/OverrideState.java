package com.dochelper.rules.integration.enumerations;

/**
 * Lifecycle states of an override captured from an externally edited document.
 */
public enum OverrideState {
    PENDING,
    ACCEPTED,
    INVALID,
    SYNCED,
    SYNCED_FORMULA;

    public boolean isActive() {
        return this != INVALID;
    }
}
