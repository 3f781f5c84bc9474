package com.dochelper.rules.core.engine.formula.functions;

import com.dochelper.rules.core.util.CastUtil;

import java.math.MathContext;
import java.util.List;

public class IfElseFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "if_else";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "if_else({{depth}} > 10, 'deep', 'shallow')"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireCount(this, arguments, 3);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        return CastUtil.isTruthy(arguments.get(0)) ? arguments.get(1) : arguments.get(2);
    }

}
