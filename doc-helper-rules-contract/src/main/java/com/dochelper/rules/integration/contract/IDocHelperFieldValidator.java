package com.dochelper.rules.integration.contract;

import com.dochelper.rules.integration.models.schema.FieldDefinition;
import com.dochelper.rules.integration.models.validation.FieldValidationResult;

/**
 * Validates a candidate value against the constraints of a field definition.
 * Used when an external override is validated before it can be accepted.
 */
public interface IDocHelperFieldValidator {
    FieldValidationResult validate(FieldDefinition fieldDefinition, Object value);
}
