package com.dochelper.rules.core.engine.formula.dependency;

import com.dochelper.rules.core.engine.formula.ast.BinaryOperationNode;
import com.dochelper.rules.core.engine.formula.ast.FieldReferenceNode;
import com.dochelper.rules.core.engine.formula.ast.FormulaNode;
import com.dochelper.rules.core.engine.formula.ast.FunctionCallNode;
import com.dochelper.rules.core.engine.formula.ast.IFormulaNodeVisitor;
import com.dochelper.rules.core.engine.formula.ast.LiteralNode;
import com.dochelper.rules.core.engine.formula.ast.UnaryOperationNode;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the field ids a formula reads, in order of first appearance.
 */
public class FormulaDependencyExtractor {

    public Set<String> extract(FormulaNode root) {
        Set<String> references = new LinkedHashSet<>();
        root.accept(new ReferenceCollector(references));
        return references;
    }

    private static final class ReferenceCollector implements IFormulaNodeVisitor<Void> {
        private final Set<String> references;

        private ReferenceCollector(Set<String> references) {
            this.references = references;
        }

        @Override
        public Void visitLiteral(LiteralNode node) {
            return null;
        }

        @Override
        public Void visitFieldReference(FieldReferenceNode node) {
            references.add(node.fieldId());
            return null;
        }

        @Override
        public Void visitBinaryOperation(BinaryOperationNode node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitUnaryOperation(UnaryOperationNode node) {
            node.operand().accept(this);
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCallNode node) {
            node.arguments().forEach(argument -> argument.accept(this));
            return null;
        }
    }
}
