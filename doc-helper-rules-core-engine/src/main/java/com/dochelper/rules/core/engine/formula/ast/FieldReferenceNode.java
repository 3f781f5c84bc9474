package com.dochelper.rules.core.engine.formula.ast;

public record FieldReferenceNode(String fieldId) implements FormulaNode {
    @Override
    public <R> R accept(IFormulaNodeVisitor<R> visitor) {
        return visitor.visitFieldReference(this);
    }
}
