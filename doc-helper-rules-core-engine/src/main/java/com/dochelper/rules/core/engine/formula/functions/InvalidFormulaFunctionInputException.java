package com.dochelper.rules.core.engine.formula.functions;

import java.util.List;

public class InvalidFormulaFunctionInputException extends Exception {

    public InvalidFormulaFunctionInputException(String message, IFormulaFunction function, List<Object> arguments) {
        super(
                String.format(
                        "Error Message: [%s], Invalid input for formula function %s. Arguments : %s, Sample usage : %s",
                        message,
                        function.getFunctionName(),
                        arguments,
                        function.getSampleUsage()
                )
        );
    }

    static void requireCount(IFormulaFunction function, List<Object> arguments, int expected) throws InvalidFormulaFunctionInputException {
        if (arguments.size() != expected) {
            throw new InvalidFormulaFunctionInputException(
                    "Function requires exactly " + expected + " argument(s), got " + arguments.size(), function, arguments);
        }
    }

    static void requireRange(IFormulaFunction function, List<Object> arguments, int min, int max) throws InvalidFormulaFunctionInputException {
        if (arguments.size() < min || arguments.size() > max) {
            throw new InvalidFormulaFunctionInputException(
                    String.format("Function requires between %d and %d arguments, got %d", min, max, arguments.size()),
                    function, arguments);
        }
    }

    static void requireAtLeast(IFormulaFunction function, List<Object> arguments, int min) throws InvalidFormulaFunctionInputException {
        if (arguments.size() < min) {
            throw new InvalidFormulaFunctionInputException(
                    "Function requires at least " + min + " argument(s), got " + arguments.size(), function, arguments);
        }
    }
}
