package com.dochelper.rules.core.engine.formula.ast;

/**
 * Node of a parsed formula. Trees are immutable and may be shared between
 * evaluations.
 */
public interface FormulaNode {
    <R> R accept(IFormulaNodeVisitor<R> visitor);
}
