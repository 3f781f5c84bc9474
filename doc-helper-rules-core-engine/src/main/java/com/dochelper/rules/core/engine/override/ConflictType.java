package com.dochelper.rules.core.engine.override;

/**
 * What an override disagrees with.
 */
public enum ConflictType {
    /** Different external values were observed for the same field. */
    VALUE,
    /** The override differs from the value the field's formula computes. */
    FORMULA,
    /** The override differs from the value a control rule set. */
    CONTROL,
    /** The override differs from both the formula value and a control rule value. */
    FORMULA_CONTROL;

    /**
     * Only competing observed values keep an override from being accepted.
     */
    public boolean blocksAcceptance() {
        return this == VALUE;
    }
}
