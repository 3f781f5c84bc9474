package com.dochelper.rules.core.engine.formula;

import com.dochelper.rules.core.engine.formula.ast.BinaryOperationNode;
import com.dochelper.rules.core.engine.formula.ast.FieldReferenceNode;
import com.dochelper.rules.core.engine.formula.ast.FunctionCallNode;
import com.dochelper.rules.core.engine.formula.ast.IFormulaNodeVisitor;
import com.dochelper.rules.core.engine.formula.ast.LiteralNode;
import com.dochelper.rules.core.engine.formula.ast.UnaryOperationNode;
import com.dochelper.rules.core.engine.formula.functions.FormulaFunctionRegistry;
import com.dochelper.rules.core.engine.formula.functions.IFormulaFunction;
import com.dochelper.rules.core.engine.formula.functions.InvalidFormulaFunctionInputException;
import com.dochelper.rules.core.engine.formula.parser.CompiledFormula;
import com.dochelper.rules.core.engine.formula.parser.FormulaCompiler;
import com.dochelper.rules.core.exception.formula.FormulaParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks formula text while a schema is being authored: syntax, unknown
 * functions, argument counts and references to fields the schema lacks.
 */
public class FormulaValidator {

    private final FormulaCompiler compiler;
    private final FormulaFunctionRegistry functionRegistry;

    public FormulaValidator(FormulaCompiler compiler, FormulaFunctionRegistry functionRegistry) {
        this.compiler = compiler;
        this.functionRegistry = functionRegistry;
    }

    public FormulaValidationReport validate(String expression, Set<String> knownFieldIds) {
        CompiledFormula compiled;
        try {
            compiled = compiler.parse(expression);
        } catch (FormulaParseException e) {
            return new FormulaValidationReport(expression, List.of(e.getMessage()), Set.of());
        }

        List<String> errors = new ArrayList<>();
        compiled.root().accept(new FunctionCallChecker(errors));
        for (String reference : compiled.fieldReferences()) {
            if (!knownFieldIds.contains(reference)) {
                errors.add("Unknown field reference [" + reference + "]");
            }
        }
        return new FormulaValidationReport(expression, Collections.unmodifiableList(errors), compiled.fieldReferences());
    }

    private final class FunctionCallChecker implements IFormulaNodeVisitor<Void> {
        private final List<String> errors;

        private FunctionCallChecker(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public Void visitLiteral(LiteralNode node) {
            return null;
        }

        @Override
        public Void visitFieldReference(FieldReferenceNode node) {
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
            Optional<IFormulaFunction> function = functionRegistry.findFunction(node.functionName());
            if (function.isEmpty()) {
                errors.add("Unknown function [" + node.functionName() + "]");
            } else {
                List<Object> placeholders = new ArrayList<>(Collections.nCopies(node.arguments().size(), null));
                try {
                    function.get().validate(placeholders);
                } catch (InvalidFormulaFunctionInputException e) {
                    errors.add(e.getMessage());
                }
            }
            node.arguments().forEach(argument -> argument.accept(this));
            return null;
        }
    }
}
