package com.dochelper.rules.core.engine.formula.ast;

/**
 * Number, string, boolean or null constant. Numbers are held as BigDecimal.
 */
public record LiteralNode(Object value) implements FormulaNode {
    @Override
    public <R> R accept(IFormulaNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
