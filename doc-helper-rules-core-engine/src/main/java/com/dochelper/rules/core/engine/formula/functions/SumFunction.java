package com.dochelper.rules.core.engine.formula.functions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

public class SumFunction extends AbstractNumericAggregateFunction {

    @Override
    public String getFunctionName() {
        return "sum";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "sum({{fee_a}}, {{fee_b}}, {{fee_c}})"
        );
    }

    @Override
    public void validate(List<Object> arguments) {
        // any number of arguments, sum() is zero
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal number : numericArguments(arguments)) {
            total = total.add(number, mathContext);
        }
        return total;
    }

}
