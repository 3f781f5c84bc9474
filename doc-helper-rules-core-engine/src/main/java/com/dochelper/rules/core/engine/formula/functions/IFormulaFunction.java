package com.dochelper.rules.core.engine.formula.functions;

import java.math.MathContext;
import java.util.List;

/**
 * A whitelisted function callable from formulas. Arguments arrive already
 * evaluated, numbers as BigDecimal.
 */
public interface IFormulaFunction {
    String getFunctionName();
    List<String> getSampleUsage();

    void validate(List<Object> arguments) throws InvalidFormulaFunctionInputException;
    Object execute(List<Object> arguments, MathContext mathContext);
}
