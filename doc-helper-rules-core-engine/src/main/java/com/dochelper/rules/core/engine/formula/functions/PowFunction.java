package com.dochelper.rules.core.engine.formula.functions;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaValues;

import java.math.MathContext;
import java.util.List;

public class PowFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "pow";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "pow({{radius}}, 2)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireCount(this, arguments, 2);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        if (arguments.get(0) == null || arguments.get(1) == null) {
            return null;
        }
        return FormulaValues.power(
                FormulaValues.requireNumber("pow", arguments.get(0)),
                FormulaValues.requireNumber("pow", arguments.get(1)),
                mathContext);
    }

}
