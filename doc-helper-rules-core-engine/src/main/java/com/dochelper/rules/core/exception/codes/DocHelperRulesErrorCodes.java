package com.dochelper.rules.core.exception.codes;

import com.dochelper.rules.integration.contract.IDocHelperErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum DocHelperRulesErrorCodes implements IDocHelperErrorInfo {

    FIELD_NOT_FOUND(
            "DOCHELPER_ERR_0001",
            "formula.field.not.found",
            "formula.field.not.found.resolution"
    ),

    TYPE_MISMATCH(
            "DOCHELPER_ERR_0002",
            "formula.type.mismatch",
            "formula.type.mismatch.resolution"
    ),

    UNKNOWN_FUNCTION(
            "DOCHELPER_ERR_0003",
            "formula.unknown.function",
            "formula.unknown.function.resolution"
    ),

    INVALID_ARGUMENT_COUNT(
            "DOCHELPER_ERR_0004",
            "formula.invalid.argument.count",
            "formula.invalid.argument.count.resolution"
    ),

    DIVISION_BY_ZERO(
            "DOCHELPER_ERR_0005",
            "formula.division.by.zero",
            "formula.division.by.zero.resolution"
    ),

    FUNCTION_EXECUTION_FAILED(
            "DOCHELPER_ERR_0006",
            "formula.function.execution.failed",
            "formula.function.execution.failed.resolution"
    ),

    CYCLE_DETECTED(
            "DOCHELPER_ERR_0007",
            "formula.cycle.detected",
            "formula.cycle.detected.resolution"
    ),

    CHAIN_DEPTH_EXCEEDED(
            "DOCHELPER_ERR_0008",
            "control.chain.depth.exceeded",
            "control.chain.depth.exceeded.resolution"
    ),

    FORMULA_FIELD_NOT_EDITABLE(
            "DOCHELPER_ERR_0009",
            "field.formula.not.editable",
            "field.formula.not.editable.resolution"
    ),

    OVERRIDE_CONFLICT_UNRESOLVED(
            "DOCHELPER_ERR_0010",
            "override.conflict.unresolved",
            "override.conflict.unresolved.resolution"
    ),

    OVERRIDE_VALIDATION_FAILED(
            "DOCHELPER_ERR_0011",
            "override.validation.failed",
            "override.validation.failed.resolution"
    )

    ;

    private final String errorCode;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
