package com.dochelper.rules.core.engine.override;

import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.models.EditResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of asking the engine to accept an override. {@code editResult} is the
 * cascade the accepted value caused, null unless the outcome is ACCEPTED.
 * {@code conflict} is the field's open conflict after the attempt, if any; an
 * accepted override of a formula field may still disagree with its formula.
 */
public record OverrideAcceptance(Outcome outcome, OverrideRecord override, EditResult editResult, OverrideConflict conflict) {

    @Getter
    @AllArgsConstructor
    public enum Outcome {
        ACCEPTED(null),
        INVALID(DocHelperRulesErrorCodes.OVERRIDE_VALIDATION_FAILED),
        BLOCKED_BY_CONFLICT(DocHelperRulesErrorCodes.OVERRIDE_CONFLICT_UNRESOLVED);

        private final DocHelperRulesErrorCodes errorCode;
    }
}
