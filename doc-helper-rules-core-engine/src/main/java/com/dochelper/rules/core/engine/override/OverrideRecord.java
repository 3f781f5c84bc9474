package com.dochelper.rules.core.engine.override;

import com.dochelper.rules.integration.enumerations.OverrideState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * A value observed in an externally edited document that differs from the
 * system value of its field. State changes go through {@link OverrideReconciler}.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
public class OverrideRecord {
    private final String id;
    private final String entityInstanceId;
    private final String fieldId;
    private final boolean formulaField;
    private final Instant createdAt;
    private Object observedValue;
    private Object systemValue;
    private OverrideState state;
    private boolean useInGeneration;
    private List<String> validationErrors;
    private int syncedAtGeneration;
    private Instant updatedAt;

    OverrideRecord(String id,
                   String entityInstanceId,
                   String fieldId,
                   boolean formulaField,
                   Object observedValue,
                   Object systemValue,
                   Instant createdAt) {
        this.id = id;
        this.entityInstanceId = entityInstanceId;
        this.fieldId = fieldId;
        this.formulaField = formulaField;
        this.observedValue = observedValue;
        this.systemValue = systemValue;
        this.state = OverrideState.PENDING;
        this.useInGeneration = true;
        this.validationErrors = List.of();
        this.syncedAtGeneration = -1;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean isActive() {
        return state.isActive();
    }

    /**
     * Whether value resolution should take this override over the system value.
     */
    public boolean isEffectiveForResolution() {
        return useInGeneration && (state == OverrideState.ACCEPTED
                || state == OverrideState.SYNCED
                || state == OverrideState.SYNCED_FORMULA);
    }
}
