package com.dochelper.rules.core.engine.formula.parser;

import com.dochelper.rules.core.engine.formula.ast.FormulaNode;

import java.util.Set;

/**
 * A parsed formula together with the field ids it reads, in order of first
 * appearance.
 */
public record CompiledFormula(String expression, FormulaNode root, Set<String> fieldReferences) {
}
