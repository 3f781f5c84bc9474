package com.dochelper.rules.core.engine.formula.functions;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaValues;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base for aggregates over a variable number of numeric arguments. Null
 * arguments are skipped.
 */
public abstract class AbstractNumericAggregateFunction implements IFormulaFunction {

    protected List<BigDecimal> numericArguments(List<Object> arguments) {
        List<BigDecimal> numbers = new ArrayList<>();
        arguments.stream()
                .filter(Objects::nonNull)
                .forEach(argument -> numbers.add(FormulaValues.requireNumber(getFunctionName(), argument)));
        return numbers;
    }
}
