package com.dochelper.rules.core.engine.validation;

import com.dochelper.rules.core.exception.context.RuleSetDefinitionException;
import com.dochelper.rules.core.models.DocHelperConstraintViolation;
import com.dochelper.rules.integration.models.schema.FieldDefinition;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of rule set definitions: Jakarta constraints declared on
 * the definition models plus unique field ids.
 */
@Slf4j
public class RuleSetDefinitionValidator {

    private final ValidatorFactory validatorFactory;

    public RuleSetDefinitionValidator() {
        this.validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
    }

    public void validate(RuleSetDefinition ruleSet) {
        if (ruleSet == null) {
            throw new RuleSetDefinitionException("Rule set definition is missing");
        }
        Set<ConstraintViolation<RuleSetDefinition>> violations = validatorFactory.getValidator().validate(ruleSet);
        if (!violations.isEmpty()) {
            List<DocHelperConstraintViolation> constraintViolations = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> {
                        Map<String, String> templateVariables = new LinkedHashMap<>();
                        violation.getConstraintDescriptor()
                                .getAttributes()
                                .forEach((key, value) -> templateVariables.put(key, String.valueOf(value)));

                        return new DocHelperConstraintViolation(
                                violation.getRootBeanClass(),
                                violation.getPropertyPath().toString(),
                                violation.getMessage(),
                                Collections.unmodifiableMap(templateVariables)
                        );
                    })
                    .toList();
            log.warn("Rule set [{}] failed validation with {} violation(s)", ruleSet.getId(), constraintViolations.size());
            throw new RuleSetDefinitionException("Invalid rule set definition [" + ruleSet.getId() + "]", constraintViolations);
        }

        Set<String> fieldIds = new HashSet<>();
        for (FieldDefinition field : ruleSet.getFields()) {
            if (!fieldIds.add(field.getId())) {
                throw RuleSetDefinitionException.duplicateField(ruleSet.getId(), field.getId());
            }
        }
    }
}
