package com.dochelper.rules.core.engine.formula.scheduler;

import com.dochelper.rules.core.engine.formula.dependency.FormulaDependencyGraph;
import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationError;
import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationResult;
import com.dochelper.rules.core.engine.formula.evaluator.SafeFormulaEvaluator;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.util.CastUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Recomputes formula fields in dependency order.
 *
 * <p>The scheduler works on a private copy of the value snapshot: each field
 * is evaluated after every formula it depends on, and sees their fresh values.
 * A failing field keeps its last valid value and its dependents still run
 * against that value. Fields on or downstream of a dependency cycle are not
 * evaluated and report {@link DocHelperRulesErrorCodes#CYCLE_DETECTED}.</p>
 *
 * <p>Given the same graph and snapshot, the evaluated fields, their order and
 * their values are always the same.</p>
 */
@Slf4j
public class FormulaScheduler {

    private final SafeFormulaEvaluator evaluator;

    public FormulaScheduler(SafeFormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Recomputes the formula fields affected by the given changed fields: the
     * changed fields themselves when they are formulas and all transitive
     * dependents.
     */
    public FormulaRecomputeResult recompute(FormulaDependencyGraph graph,
                                            Collection<String> changedFieldIds,
                                            Map<String, Object> snapshot) {
        Set<String> affected = graph.getAffectedFormulaFields(changedFieldIds);
        if (affected.isEmpty()) {
            return FormulaRecomputeResult.empty();
        }
        return run(graph, graph.inEvaluationOrder(affected), cyclicAmong(graph, affected), snapshot);
    }

    /**
     * Recomputes every formula field of the graph.
     */
    public FormulaRecomputeResult recomputeAll(FormulaDependencyGraph graph, Map<String, Object> snapshot) {
        return run(graph, graph.getEvaluationOrder(), new TreeSet<>(graph.getCyclicFields()), snapshot);
    }

    private FormulaRecomputeResult run(FormulaDependencyGraph graph,
                                       List<String> order,
                                       Set<String> cyclic,
                                       Map<String, Object> snapshot) {
        Map<String, Object> working = new HashMap<>(snapshot);
        Map<String, FormulaFieldOutcome> outcomes = new LinkedHashMap<>();

        for (String fieldId : order) {
            Object previous = working.get(fieldId);
            FormulaEvaluationResult result = evaluator.evaluate(graph.getFormula(fieldId).root(), working);
            if (result.isSuccess()) {
                Object value = result.getValue();
                working.put(fieldId, value);
                outcomes.put(fieldId, new FormulaFieldOutcome(
                        fieldId, previous, value, null, !CastUtil.sameValue(previous, value)));
            } else {
                log.debug("Formula field [{}] failed, keeping last value [{}]: {}", fieldId, previous, result.getError());
                outcomes.put(fieldId, new FormulaFieldOutcome(fieldId, previous, previous, result.getError(), false));
            }
        }

        for (String fieldId : cyclic) {
            Object previous = working.get(fieldId);
            FormulaEvaluationError error = FormulaEvaluationError.of(
                    DocHelperRulesErrorCodes.CYCLE_DETECTED,
                    "Field [" + fieldId + "] is part of or depends on a circular formula dependency");
            outcomes.put(fieldId, new FormulaFieldOutcome(fieldId, previous, previous, error, false));
        }
        return new FormulaRecomputeResult(outcomes);
    }

    private Set<String> cyclicAmong(FormulaDependencyGraph graph, Set<String> affected) {
        Set<String> cyclic = new TreeSet<>(affected);
        cyclic.retainAll(graph.getCyclicFields());
        return cyclic;
    }
}
