package com.dochelper.rules.core.engine.formula.functions;

import com.dochelper.rules.core.util.CastUtil;

import java.math.MathContext;
import java.util.List;
import java.util.Locale;

public class LowerFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "lower";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "lower({{email}})"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireCount(this, arguments, 1);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        Object value = arguments.get(0);
        if (value == null) {
            return null;
        }
        return CastUtil.castAsString(value).toLowerCase(Locale.ROOT);
    }

}
