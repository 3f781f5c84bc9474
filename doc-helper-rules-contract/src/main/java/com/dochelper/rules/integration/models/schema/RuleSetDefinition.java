package com.dochelper.rules.integration.models.schema;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Field, formula and control rule definitions of one entity type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleSetDefinition {
    @NotBlank(message = "{rule.set.id.blank}")
    private String id;
    private String name;
    private String version;
    @NotEmpty(message = "{rule.set.fields.empty}")
    @Valid
    @Builder.Default
    private List<FieldDefinition> fields = new ArrayList<>();
    @Valid
    @Builder.Default
    private List<ControlRuleDefinition> controlRules = new ArrayList<>();

    public Optional<FieldDefinition> findField(String fieldId) {
        return fields.stream()
                .filter(field -> field.getId().equals(fieldId))
                .findFirst();
    }
}
