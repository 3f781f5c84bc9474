package com.dochelper.rules.core.engine.formula.functions;

import java.math.MathContext;
import java.util.List;
import java.util.Objects;

public class CoalesceFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "coalesce";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "coalesce({{contact_phone}}, {{office_phone}}, 'n/a')"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireAtLeast(this, arguments, 1);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        return arguments.stream()
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

}
