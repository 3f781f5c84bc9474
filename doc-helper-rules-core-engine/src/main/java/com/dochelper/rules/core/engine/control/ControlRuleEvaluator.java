package com.dochelper.rules.core.engine.control;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationResult;
import com.dochelper.rules.core.engine.formula.evaluator.SafeFormulaEvaluator;
import com.dochelper.rules.core.engine.formula.parser.CompiledFormula;
import com.dochelper.rules.core.engine.formula.scheduler.FormulaRecomputeResult;
import com.dochelper.rules.core.engine.formula.scheduler.FormulaScheduler;
import com.dochelper.rules.core.engine.override.OverrideConflictDetector;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.core.models.FieldValueState;
import com.dochelper.rules.core.util.CastUtil;
import com.dochelper.rules.integration.enumerations.ControlEffectType;
import com.dochelper.rules.integration.models.schema.ControlEffectMapping;
import com.dochelper.rules.integration.models.schema.ControlRuleDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Applies control rules when source field values change.
 *
 * <p>Rules for a source run in priority order. A {@code VALUE_SET} effect that
 * actually changes its target recomputes the formulas depending on the target
 * and propagates further from the target and from any formula field whose
 * value changed. Each such hop adds one to the chain depth; a hop beyond the
 * configured maximum is rejected with
 * {@link DocHelperRulesErrorCodes#CHAIN_DEPTH_EXCEEDED} while effects already
 * applied are kept. {@code VISIBILITY} and {@code ENABLE} effects never
 * propagate.</p>
 *
 * <p>A rule with a condition looks its mapping up by the condition's value
 * instead of the source value. A condition that fails to evaluate is reported
 * with the formula's error code and the rule is skipped.</p>
 *
 * <p>Setting a value on a field that holds an override is checked with the
 * {@link OverrideConflictDetector}; the effect still applies.</p>
 */
@Slf4j
public class ControlRuleEvaluator {

    private final FormulaScheduler formulaScheduler;
    private final SafeFormulaEvaluator conditionEvaluator;
    private final OverrideConflictDetector conflictDetector;
    private final int maxChainDepth;

    public ControlRuleEvaluator(FormulaScheduler formulaScheduler,
                                SafeFormulaEvaluator conditionEvaluator,
                                OverrideConflictDetector conflictDetector,
                                int maxChainDepth) {
        this.formulaScheduler = formulaScheduler;
        this.conditionEvaluator = conditionEvaluator;
        this.conflictDetector = conflictDetector;
        this.maxChainDepth = maxChainDepth;
    }

    /**
     * Propagates control effects from each changed field, in the given order.
     */
    public ControlPropagationResult propagate(EntityRuleContext context, Collection<String> changedFieldIds) {
        ControlPropagationResult result = new ControlPropagationResult();
        for (String fieldId : changedFieldIds) {
            List<String> path = new ArrayList<>();
            path.add(fieldId);
            propagateFrom(context, fieldId, 0, path, result);
        }
        if (result.hasErrors()) {
            log.warn("Control propagation for entity [{}] finished with errors: {}",
                    context.getEntityInstanceId(), result.getErrors());
        }
        return result;
    }

    /**
     * Applies the visibility and enable rules of every source field against the
     * current values. Value setting rules are left to edits.
     */
    public ControlPropagationResult applyPresentationRules(EntityRuleContext context) {
        ControlPropagationResult result = new ControlPropagationResult();
        Set<String> applied = new HashSet<>();
        for (String sourceFieldId : context.getFields().keySet()) {
            for (ControlRuleDefinition rule : context.getControlRuleTable().getRulesForSource(sourceFieldId)) {
                if (rule.getEffectType() != ControlEffectType.VALUE_SET && applied.add(rule.getId())) {
                    applyPresentationEffect(context, rule, lookup(context, rule, List.of(sourceFieldId), result), 0, result);
                }
            }
        }
        if (result.hasErrors()) {
            log.warn("Presentation rules for entity [{}] finished with errors: {}",
                    context.getEntityInstanceId(), result.getErrors());
        }
        return result;
    }

    private void propagateFrom(EntityRuleContext context,
                               String sourceFieldId,
                               int depth,
                               List<String> path,
                               ControlPropagationResult result) {
        for (ControlRuleDefinition rule : context.getControlRuleTable().getRulesForSource(sourceFieldId)) {
            Optional<ControlEffectMapping.MappedValue> mapped = lookup(context, rule, path, result);
            if (mapped.isEmpty()) {
                continue;
            }
            int hop = depth + 1;
            if (hop > maxChainDepth) {
                List<String> rejectedPath = new ArrayList<>(path);
                rejectedPath.add(rule.getTargetFieldId());
                result.addError(new ControlPropagationError(
                        DocHelperRulesErrorCodes.CHAIN_DEPTH_EXCEEDED,
                        rule.getId(),
                        rejectedPath,
                        String.format("Control rule chain exceeded maximum depth %d at rule [%s]", maxChainDepth, rule.getId())));
                return;
            }

            if (rule.getEffectType() == ControlEffectType.VALUE_SET) {
                applyValueEffect(context, rule, mapped.get(), hop, path, result);
            } else {
                applyPresentationEffect(context, rule, mapped, hop, result);
            }
        }
    }

    private void applyValueEffect(EntityRuleContext context,
                                  ControlRuleDefinition rule,
                                  ControlEffectMapping.MappedValue mapped,
                                  int hop,
                                  List<String> path,
                                  ControlPropagationResult result) {
        FieldValueState target = context.requireField(rule.getTargetFieldId());
        if (target.isFormulaDerived()) {
            conflictDetector.detectFormulaControlConflict(context, target.getFieldId(), target.getFormulaValue(), mapped.value())
                    .ifPresent(result::addOverrideConflict);
            List<String> rejectedPath = new ArrayList<>(path);
            rejectedPath.add(target.getFieldId());
            result.addError(new ControlPropagationError(
                    DocHelperRulesErrorCodes.FORMULA_FIELD_NOT_EDITABLE,
                    rule.getId(),
                    rejectedPath,
                    String.format("Control rule [%s] cannot set formula field [%s]", rule.getId(), target.getFieldId())));
            return;
        }
        Object previous = target.getRawValue();
        if (CastUtil.sameValue(previous, mapped.value())) {
            return;
        }
        target.setRawValue(mapped.value());
        conflictDetector.detectControlConflict(context, target.getFieldId(), mapped.value())
                .ifPresent(result::addOverrideConflict);
        result.addEffect(new AppliedControlEffect(
                rule.getId(), rule.getSourceFieldId(), target.getFieldId(),
                ControlEffectType.VALUE_SET, previous, mapped.value(), hop));
        log.debug("Control rule [{}] set [{}] from [{}] to [{}] at depth {}",
                rule.getId(), target.getFieldId(), previous, mapped.value(), hop);

        FormulaRecomputeResult recompute = formulaScheduler.recompute(
                context.getDependencyGraph(), Set.of(target.getFieldId()), context.getValueSnapshot());
        Set<String> changedFormulas = context.applyFormulaResults(recompute);
        result.addFormulaResult(recompute);

        Set<String> next = new LinkedHashSet<>();
        next.add(target.getFieldId());
        next.addAll(changedFormulas);
        for (String nextSource : next) {
            List<String> nextPath = new ArrayList<>(path);
            nextPath.add(nextSource);
            propagateFrom(context, nextSource, hop, nextPath, result);
        }
    }

    private void applyPresentationEffect(EntityRuleContext context,
                                         ControlRuleDefinition rule,
                                         Optional<ControlEffectMapping.MappedValue> mapped,
                                         int hop,
                                         ControlPropagationResult result) {
        if (mapped.isEmpty()) {
            return;
        }
        FieldValueState target = context.requireField(rule.getTargetFieldId());
        boolean flag = CastUtil.castAsBoolean(mapped.get().value());
        boolean previous = rule.getEffectType() == ControlEffectType.VISIBILITY ? target.isVisible() : target.isEnabled();
        if (previous == flag) {
            return;
        }
        if (rule.getEffectType() == ControlEffectType.VISIBILITY) {
            target.setVisible(flag);
        } else {
            target.setEnabled(flag);
        }
        result.addEffect(new AppliedControlEffect(
                rule.getId(), rule.getSourceFieldId(), target.getFieldId(),
                rule.getEffectType(), previous, flag, hop));
    }

    private Optional<ControlEffectMapping.MappedValue> lookup(EntityRuleContext context,
                                                              ControlRuleDefinition rule,
                                                              List<String> path,
                                                              ControlPropagationResult result) {
        Optional<CompiledFormula> condition = context.getControlRuleTable().getCondition(rule.getId());
        if (condition.isEmpty()) {
            Object sourceValue = context.requireField(rule.getSourceFieldId()).getEffectiveValue();
            return rule.getMapping().lookup(CastUtil.canonical(sourceValue));
        }

        FormulaEvaluationResult evaluation = conditionEvaluator.evaluate(condition.get().root(), context.getValueSnapshot());
        if (evaluation.isFailure()) {
            List<String> failedPath = new ArrayList<>(path);
            failedPath.add(rule.getTargetFieldId());
            result.addError(new ControlPropagationError(
                    evaluation.getError().errorCode(),
                    rule.getId(),
                    failedPath,
                    String.format("Condition of control rule [%s] failed: %s", rule.getId(), evaluation.getError().message())));
            return Optional.empty();
        }
        return rule.getMapping().lookup(CastUtil.canonical(evaluation.getValue()));
    }
}
