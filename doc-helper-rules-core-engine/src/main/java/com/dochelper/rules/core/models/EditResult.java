package com.dochelper.rules.core.models;

import com.dochelper.rules.core.engine.control.AppliedControlEffect;
import com.dochelper.rules.core.engine.control.ControlPropagationError;
import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationError;
import com.dochelper.rules.core.engine.override.OverrideConflict;
import com.dochelper.rules.core.engine.override.OverrideRecord;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.util.CastUtil;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one edit pass changed.
 *
 * <p>{@link #getChanges()} lists every field whose value, visibility or
 * enabled state changed, not only the edited one. {@link #getPreviousRawValues()}
 * holds the raw value each changed raw field had before the pass; undo
 * resubmits those values through the same edit entry point.</p>
 */
@Getter
@Builder
@ToString
public class EditResult {
    private final String fieldId;
    private final boolean accepted;
    private final DocHelperRulesErrorCodes rejectionCode;
    private final String rejectionMessage;
    @Builder.Default
    private final List<FieldChange> changes = List.of();
    @Builder.Default
    private final Map<String, Object> previousRawValues = Map.of();
    @Builder.Default
    private final Map<String, FormulaEvaluationError> formulaErrors = Map.of();
    @Builder.Default
    private final List<ControlPropagationError> controlErrors = List.of();
    @Builder.Default
    private final List<AppliedControlEffect> appliedEffects = List.of();
    @Builder.Default
    private final List<OverrideRecord> obsoleteOverrides = List.of();
    @Builder.Default
    private final List<OverrideConflict> overrideConflicts = List.of();

    public static EditResult rejected(String fieldId, DocHelperRulesErrorCodes code, String message) {
        return EditResult.builder()
                .fieldId(fieldId)
                .accepted(false)
                .rejectionCode(code)
                .rejectionMessage(message)
                .build();
    }

    /**
     * Diffs two captures of the same context.
     */
    public static List<FieldChange> diff(Map<String, FieldValueState> before, Map<String, FieldValueState> after) {
        List<FieldChange> changes = new ArrayList<>();
        after.forEach((fieldId, current) -> {
            FieldValueState previous = before.get(fieldId);
            if (previous == null) {
                return;
            }
            FieldChange change = FieldChange.between(previous, current);
            if (change.isValueChanged() || change.isVisibilityChanged() || change.isEnabledChanged()) {
                changes.add(change);
            }
        });
        return changes;
    }

    public static Map<String, Object> previousRawValues(Map<String, FieldValueState> before, Map<String, FieldValueState> after) {
        Map<String, Object> previous = new LinkedHashMap<>();
        after.forEach((fieldId, current) -> {
            FieldValueState prior = before.get(fieldId);
            if (prior != null && !current.isFormulaDerived() && !CastUtil.sameValue(prior.getRawValue(), current.getRawValue())) {
                previous.put(fieldId, prior.getRawValue());
            }
        });
        return previous;
    }

    public Set<String> getChangedFieldIds() {
        Set<String> ids = new LinkedHashSet<>();
        changes.forEach(change -> ids.add(change.fieldId()));
        return ids;
    }

    public FieldChange getChange(String fieldId) {
        return changes.stream()
                .filter(change -> change.fieldId().equals(fieldId))
                .findFirst()
                .orElse(null);
    }

    public boolean hasErrors() {
        return !formulaErrors.isEmpty() || !controlErrors.isEmpty();
    }
}
