package com.dochelper.rules.integration.models.schema;

import com.dochelper.rules.integration.enumerations.ControlEffectType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A control rule maps a key to an effect on its target field. Without a
 * {@code condition} the key is the source field's value; with one, the key is
 * the value of the condition formula (for example {@code field1 > 50} yields
 * {@code true} or {@code false}) and the rule reruns whenever the source or
 * any field the condition reads changes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlRuleDefinition {
    @NotBlank(message = "{control.rule.id.blank}")
    private String id;
    @NotBlank(message = "{control.rule.source.blank}")
    private String sourceFieldId;
    @NotBlank(message = "{control.rule.target.blank}")
    private String targetFieldId;
    @NotNull(message = "{control.rule.effect.null}")
    private ControlEffectType effectType;
    @NotNull(message = "{control.rule.mapping.null}")
    @Valid
    private ControlEffectMapping mapping;
    @Builder.Default
    private boolean enabled = true;
    private int priority;
    private String condition;
    private String description;
}
