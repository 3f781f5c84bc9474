package com.dochelper.rules.core.engine.formula.functions;

import com.dochelper.rules.core.util.CastUtil;

import java.math.MathContext;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Joins the text form of every argument. Null renders as empty text.
 */
public class ConcatFunction implements IFormulaFunction {

    @Override
    public String getFunctionName() {
        return "concat";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "concat({{first_name}}, ' ', {{last_name}})"
        );
    }

    @Override
    public void validate(List<Object> arguments) {
    }

    @Override
    public Object execute(List<Object> arguments, MathContext mathContext) {
        return arguments.stream()
                .map(CastUtil::castAsString)
                .collect(Collectors.joining());
    }

}
