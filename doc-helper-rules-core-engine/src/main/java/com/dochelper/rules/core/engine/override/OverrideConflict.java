package com.dochelper.rules.core.engine.override;

import com.dochelper.rules.core.util.CastUtil;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Open disagreement on one field. {@code candidateValues} holds the observed
 * values in insertion order, the first one being the override's. The formula
 * and control values are only meaningful while {@link #isFormulaConflict()}
 * respectively {@link #isControlConflict()} hold. Conflicts are never resolved
 * automatically.
 */
@Getter
@ToString
public class OverrideConflict {
    private final String fieldId;
    private final Instant detectedAt;
    private final List<Object> candidateValues;
    private boolean formulaConflict;
    private Object computedValue;
    private boolean controlConflict;
    private Object controlValue;

    OverrideConflict(String fieldId, Instant detectedAt, List<Object> initialCandidates) {
        this.fieldId = fieldId;
        this.detectedAt = detectedAt;
        this.candidateValues = new ArrayList<>();
        initialCandidates.forEach(this::addCandidate);
    }

    public ConflictType getType() {
        if (candidateValues.size() > 1) {
            return ConflictType.VALUE;
        }
        if (formulaConflict && controlConflict) {
            return ConflictType.FORMULA_CONTROL;
        }
        if (formulaConflict) {
            return ConflictType.FORMULA;
        }
        return controlConflict ? ConflictType.CONTROL : ConflictType.VALUE;
    }

    public boolean isBlocking() {
        return getType().blocksAcceptance();
    }

    public Object getOverrideValue() {
        return candidateValues.isEmpty() ? null : candidateValues.get(0);
    }

    public List<Object> getCandidateValues() {
        return Collections.unmodifiableList(candidateValues);
    }

    public boolean hasCandidate(Object value) {
        return candidateValues.stream().anyMatch(existing -> CastUtil.sameValue(existing, value));
    }

    void addCandidate(Object value) {
        if (!hasCandidate(value)) {
            candidateValues.add(value);
        }
    }

    void recordComputedValue(Object value) {
        this.formulaConflict = true;
        this.computedValue = value;
    }

    void clearComputedValue() {
        this.formulaConflict = false;
        this.computedValue = null;
    }

    void recordControlValue(Object value) {
        this.controlConflict = true;
        this.controlValue = value;
    }

    void clearControlValue() {
        this.controlConflict = false;
        this.controlValue = null;
    }

    boolean isSettled() {
        return candidateValues.size() <= 1 && !formulaConflict && !controlConflict;
    }
}
