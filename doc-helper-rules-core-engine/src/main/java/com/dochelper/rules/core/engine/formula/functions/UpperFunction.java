package com.dochelper.rules.core.engine.formula.functions;

import com.dochelper.rules.core.util.CastUtil;

import java.math.MathContext;
import java.util.List;
import java.util.Locale;

public class UpperFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "upper";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "upper({{project_code}})"
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
        return CastUtil.castAsString(value).toUpperCase(Locale.ROOT);
    }

}
