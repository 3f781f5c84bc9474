package com.dochelper.rules.core.engine.formula.functions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

public class MaxFunction extends AbstractNumericAggregateFunction {

    @Override
    public String getFunctionName() {
        return "max";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "max({{depth_a}}, {{depth_b}})",
                "max(10, {{limit}}, 3)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireAtLeast(this, arguments, 1);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        return numericArguments(arguments).stream()
                .max(BigDecimal::compareTo)
                .orElse(null);
    }

}
