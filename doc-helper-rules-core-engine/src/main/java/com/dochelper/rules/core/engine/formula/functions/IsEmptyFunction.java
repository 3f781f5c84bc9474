package com.dochelper.rules.core.engine.formula.functions;

import java.math.MathContext;
import java.util.List;

public class IsEmptyFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "is_empty";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "is_empty({{site_address}})"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireCount(this, arguments, 1);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        Object value = arguments.get(0);
        return value == null || (value instanceof String text && text.isBlank());
    }

}
