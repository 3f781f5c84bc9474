package com.dochelper.rules.core.engine.control;

import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;

import java.util.List;

/**
 * Why a control rule chain stopped or a rule could not be applied.
 * {@code fieldPath} lists the fields from the originating edit to the
 * rejected target.
 */
public record ControlPropagationError(DocHelperRulesErrorCodes errorCode,
                                      String ruleId,
                                      List<String> fieldPath,
                                      String message) {

    public ControlPropagationError {
        fieldPath = List.copyOf(fieldPath);
    }
}
