package com.dochelper.rules.core.engine.formula.functions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

public class MinFunction extends AbstractNumericAggregateFunction {

    @Override
    public String getFunctionName() {
        return "min";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "min({{depth_a}}, {{depth_b}})",
                "min(10, {{limit}}, 3)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireAtLeast(this, arguments, 1);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        return numericArguments(arguments).stream()
                .min(BigDecimal::compareTo)
                .orElse(null);
    }

}
