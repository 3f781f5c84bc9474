package com.dochelper.rules.core.exception.context;

import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import com.dochelper.rules.core.models.DocHelperConstraintViolation;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when a rule set definition cannot be read or violates its
 * structural constraints.
 */
@Getter
public class RuleSetDefinitionException extends DocHelperRulesRuntimeException {

    private final List<DocHelperConstraintViolation> violations;

    public RuleSetDefinitionException(String message) {
        super(message);
        this.violations = List.of();
    }

    public RuleSetDefinitionException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public RuleSetDefinitionException(String message, List<DocHelperConstraintViolation> violations) {
        super(message + ". Violations: " + violations);
        this.violations = List.copyOf(violations);
    }

    public static RuleSetDefinitionException duplicateField(String ruleSetId, String fieldId) {
        return new RuleSetDefinitionException(
                String.format("Rule set [%s] declares field [%s] more than once", ruleSetId, fieldId));
    }

    public static RuleSetDefinitionException unknownRuleField(String ruleId, String fieldId) {
        return new RuleSetDefinitionException(
                String.format("Control rule [%s] references unknown field [%s]", ruleId, fieldId));
    }

    public static RuleSetDefinitionException duplicateRule(String ruleSetId, String ruleId) {
        return new RuleSetDefinitionException(
                String.format("Rule set [%s] declares control rule [%s] more than once", ruleSetId, ruleId));
    }
}
