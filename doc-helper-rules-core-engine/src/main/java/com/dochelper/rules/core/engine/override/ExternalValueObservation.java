package com.dochelper.rules.core.engine.override;

/**
 * What recording an externally observed value did.
 */
public record ExternalValueObservation(Outcome outcome, OverrideRecord override, OverrideConflict conflict) {

    public enum Outcome {
        /** Observed value equals the system value, nothing recorded. */
        MATCHES_SYSTEM,
        /** A new PENDING override was created. */
        CREATED,
        /** The field already carries an override with this observed value. */
        UNCHANGED,
        /** A different value competes with an existing override. */
        CONFLICT
    }
}
