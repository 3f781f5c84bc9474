package com.dochelper.rules.core.engine.formula.functions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of functions formulas may call. Names are matched case
 * insensitively. Nothing outside this registry is reachable from a formula.
 */
public class FormulaFunctionRegistry {
    private final Map<String, IFormulaFunction> functionRegistry;

    private FormulaFunctionRegistry() {
        functionRegistry = new LinkedHashMap<>();
        this.register(new AbsFunction());
        this.register(new MinFunction());
        this.register(new MaxFunction());
        this.register(new RoundFunction());
        this.register(new SumFunction());
        this.register(new PowFunction());
        this.register(new UpperFunction());
        this.register(new LowerFunction());
        this.register(new StripFunction());
        this.register(new ConcatFunction());
        this.register(new IfElseFunction());
        this.register(new IsEmptyFunction());
        this.register(new CoalesceFunction());
    }

    private static class SingletonHolder {
        private static final FormulaFunctionRegistry INSTANCE = new FormulaFunctionRegistry();
    }

    public static FormulaFunctionRegistry getInstance() {
        return SingletonHolder.INSTANCE;
    }

    private void register(IFormulaFunction function) {
        this.functionRegistry.put(function.getFunctionName(), function);
    }

    public Optional<IFormulaFunction> findFunction(String functionName) {
        return Optional.ofNullable(this.functionRegistry.get(functionName.toLowerCase(Locale.ROOT)));
    }

    public Map<String, IFormulaFunction> getAllFunctions() {
        return Collections.unmodifiableMap(functionRegistry);
    }

}
