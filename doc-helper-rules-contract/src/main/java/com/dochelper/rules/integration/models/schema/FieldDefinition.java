package com.dochelper.rules.integration.models.schema;

import com.dochelper.rules.integration.enumerations.FieldType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schema definition of a single field. A field with a non blank formula is
 * formula derived: its value is computed and never edited directly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDefinition {
    @NotBlank(message = "{field.definition.id.blank}")
    private String id;
    private String label;
    @NotNull(message = "{field.definition.type.null}")
    private FieldType type;
    private String formula;
    private Object defaultValue;
    @Valid
    private FieldConstraintsDefinition constraints;

    @JsonIgnore
    public boolean isFormulaField() {
        return formula != null && !formula.trim().isEmpty();
    }
}
