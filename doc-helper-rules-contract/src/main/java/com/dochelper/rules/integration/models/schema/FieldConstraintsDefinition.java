package com.dochelper.rules.integration.models.schema;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldConstraintsDefinition {
    private boolean required;
    private BigDecimal minValue;
    private BigDecimal maxValue;
    @PositiveOrZero
    private Integer minLength;
    @PositiveOrZero
    private Integer maxLength;
    private String pattern;
    private List<String> allowedValues;
}
