package com.dochelper.rules.core.engine.validation;

import com.dochelper.rules.core.util.CastUtil;
import com.dochelper.rules.core.util.CommonUtil;
import com.dochelper.rules.integration.contract.IDocHelperFieldValidator;
import com.dochelper.rules.integration.enumerations.FieldType;
import com.dochelper.rules.integration.models.schema.FieldConstraintsDefinition;
import com.dochelper.rules.integration.models.schema.FieldDefinition;
import com.dochelper.rules.integration.models.validation.FieldValidationResult;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a value against the type and {@link FieldConstraintsDefinition} of a
 * field. An empty value only fails when the field is required.
 */
public class ConstraintFieldValidator implements IDocHelperFieldValidator {

    @Override
    public FieldValidationResult validate(FieldDefinition fieldDefinition, Object value) {
        FieldConstraintsDefinition constraints = fieldDefinition.getConstraints() != null
                ? fieldDefinition.getConstraints()
                : new FieldConstraintsDefinition();
        List<String> violations = new ArrayList<>();

        if (isEmpty(value)) {
            if (constraints.isRequired()) {
                violations.add("Field [" + fieldDefinition.getId() + "] is required");
            }
            return violations.isEmpty() ? FieldValidationResult.ok() : FieldValidationResult.failed(violations);
        }

        String text = CastUtil.castAsString(value);
        BigDecimal number = value instanceof Boolean ? null : CastUtil.toDecimal(value);

        if (fieldDefinition.getType() == FieldType.NUMBER && number == null) {
            violations.add("Value [" + text + "] is not a number");
        }
        if (fieldDefinition.getType() == FieldType.DATE && !isIsoDate(text)) {
            violations.add("Value [" + text + "] is not an ISO-8601 date");
        }
        if (constraints.getMinValue() != null || constraints.getMaxValue() != null) {
            if (number == null) {
                violations.add("Value [" + text + "] must be numeric to check its range");
            } else {
                if (constraints.getMinValue() != null && number.compareTo(constraints.getMinValue()) < 0) {
                    violations.add("Value " + text + " is below minimum " + constraints.getMinValue().toPlainString());
                }
                if (constraints.getMaxValue() != null && number.compareTo(constraints.getMaxValue()) > 0) {
                    violations.add("Value " + text + " is above maximum " + constraints.getMaxValue().toPlainString());
                }
            }
        }
        if (constraints.getMinLength() != null && text.length() < constraints.getMinLength()) {
            violations.add("Value length " + text.length() + " is below minimum length " + constraints.getMinLength());
        }
        if (constraints.getMaxLength() != null && text.length() > constraints.getMaxLength()) {
            violations.add("Value length " + text.length() + " is above maximum length " + constraints.getMaxLength());
        }
        if (CommonUtil.isNotBlank(constraints.getPattern())) {
            try {
                if (!Pattern.compile(constraints.getPattern()).matcher(text).matches()) {
                    violations.add("Value [" + text + "] does not match pattern " + constraints.getPattern());
                }
            } catch (PatternSyntaxException e) {
                violations.add("Field [" + fieldDefinition.getId() + "] declares an invalid pattern: " + e.getDescription());
            }
        }
        if (CommonUtil.isNotEmpty(constraints.getAllowedValues())
                && constraints.getAllowedValues().stream().noneMatch(allowed -> CastUtil.sameValue(allowed, value))) {
            violations.add("Value [" + text + "] is not one of " + constraints.getAllowedValues());
        }

        return violations.isEmpty() ? FieldValidationResult.ok() : FieldValidationResult.failed(violations);
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof String text && text.isBlank());
    }

    private static boolean isIsoDate(String text) {
        try {
            LocalDate.parse(text.trim());
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
