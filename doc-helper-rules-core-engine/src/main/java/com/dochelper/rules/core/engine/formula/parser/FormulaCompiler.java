package com.dochelper.rules.core.engine.formula.parser;

import com.dochelper.rules.core.engine.formula.dependency.FormulaDependencyExtractor;
import com.dochelper.rules.core.engine.formula.ast.FormulaNode;
import com.dochelper.rules.core.exception.formula.FormulaParseException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses formula text into {@link CompiledFormula} instances and caches them by
 * expression text. Compiled formulas are immutable and safe to share between
 * entity instances.
 */
@Slf4j
public class FormulaCompiler {

    private final Map<String, CompiledFormula> cache;
    private final FormulaDependencyExtractor dependencyExtractor;

    public FormulaCompiler() {
        this.cache = new ConcurrentHashMap<>();
        this.dependencyExtractor = new FormulaDependencyExtractor();
    }

    public CompiledFormula compile(String expression) throws FormulaParseException {
        CompiledFormula cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        CompiledFormula compiled = parse(expression);
        cache.putIfAbsent(expression, compiled);
        log.debug("Compiled formula [{}], references: {}", expression, compiled.fieldReferences());
        return compiled;
    }

    /**
     * Parses without reading or filling the cache. Used for ad hoc text such
     * as formulas typed at authoring time.
     */
    public CompiledFormula parse(String expression) throws FormulaParseException {
        FormulaNode root = new FormulaParser(expression).parse();
        return new CompiledFormula(
                expression,
                root,
                Collections.unmodifiableSet(new LinkedHashSet<>(dependencyExtractor.extract(root))));
    }

    public int cacheSize() {
        return cache.size();
    }
}
