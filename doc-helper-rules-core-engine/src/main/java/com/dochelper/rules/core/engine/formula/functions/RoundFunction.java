package com.dochelper.rules.core.engine.formula.functions;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationException;
import com.dochelper.rules.core.engine.formula.evaluator.FormulaValues;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.util.CastUtil;

import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Rounds half to even, to the given number of decimal places (default 0).
 */
public class RoundFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "round";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "round({{area}})",
                "round({{area}} * 1.15, 2)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException {
        InvalidFormulaFunctionInputException.requireRange(this, arguments, 1, 2);
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        Object value = arguments.get(0);
        if (value == null) {
            return null;
        }
        int places = arguments.size() > 1 && arguments.get(1) != null
                ? FormulaValues.requireInteger("round", arguments.get(1))
                : 0;
        if (places > CastUtil.MAX_PLAIN_EXPONENT || places < -CastUtil.MAX_PLAIN_EXPONENT) {
            throw new FormulaEvaluationException(
                    DocHelperRulesErrorCodes.FUNCTION_EXECUTION_FAILED,
                    "round supports at most " + CastUtil.MAX_PLAIN_EXPONENT + " decimal places but got " + places);
        }
        return FormulaValues.requireNumber("round", value).setScale(places, RoundingMode.HALF_EVEN);
    }

}
