package com.dochelper.rules.core.engine;

import com.dochelper.rules.core.engine.config.DocHelperRulesEngineConfig;
import com.dochelper.rules.core.engine.control.ControlPropagationResult;
import com.dochelper.rules.core.engine.control.ControlRuleEvaluator;
import com.dochelper.rules.core.engine.control.ControlRuleTable;
import com.dochelper.rules.core.engine.formula.FormulaValidationReport;
import com.dochelper.rules.core.engine.formula.FormulaValidator;
import com.dochelper.rules.core.engine.formula.dependency.FormulaDependencyGraph;
import com.dochelper.rules.core.engine.formula.dependency.FormulaDependencyGraphBuilder;
import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationError;
import com.dochelper.rules.core.engine.formula.evaluator.SafeFormulaEvaluator;
import com.dochelper.rules.core.engine.formula.functions.FormulaFunctionRegistry;
import com.dochelper.rules.core.engine.formula.parser.CompiledFormula;
import com.dochelper.rules.core.engine.formula.parser.FormulaCompiler;
import com.dochelper.rules.core.engine.formula.scheduler.FormulaRecomputeResult;
import com.dochelper.rules.core.engine.formula.scheduler.FormulaScheduler;
import com.dochelper.rules.core.engine.message.DocHelperErrorDescription;
import com.dochelper.rules.core.engine.message.DocHelperMessageSource;
import com.dochelper.rules.core.engine.message.IDocHelperMessageSource;
import com.dochelper.rules.core.engine.override.ExternalValueObservation;
import com.dochelper.rules.core.engine.override.GenerationSyncResult;
import com.dochelper.rules.core.engine.override.OverrideAcceptance;
import com.dochelper.rules.core.engine.override.OverrideConflict;
import com.dochelper.rules.core.engine.override.OverrideConflictDetector;
import com.dochelper.rules.core.engine.override.OverrideReconciler;
import com.dochelper.rules.core.engine.override.OverrideRecord;
import com.dochelper.rules.core.engine.resolution.ResolvedFieldValue;
import com.dochelper.rules.core.engine.resolution.ValueResolutionCoordinator;
import com.dochelper.rules.core.engine.validation.ConstraintFieldValidator;
import com.dochelper.rules.core.engine.validation.RuleSetDefinitionValidator;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.exception.formula.FormulaCycleException;
import com.dochelper.rules.core.exception.formula.FormulaParseException;
import com.dochelper.rules.core.exception.override.OverrideNotFoundException;
import com.dochelper.rules.core.models.EditResult;
import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.core.models.FieldValueState;
import com.dochelper.rules.integration.contract.IDocHelperErrorInfo;
import com.dochelper.rules.integration.contract.IDocHelperFieldValidator;
import com.dochelper.rules.integration.enumerations.OverrideState;
import com.dochelper.rules.integration.models.schema.FieldDefinition;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Wires the formula scheduler, control rule evaluator, override reconciler and
 * value resolution coordinator into one synchronous engine.
 *
 * <p>An edit stores the raw value, recomputes the formulas depending on it,
 * propagates control rules from the edited field and from every formula whose
 * value changed, and finally lets the override reconciler observe the fields
 * whose value changed. The engine keeps no per entity state; it only holds its
 * configuration and the formula parse cache.</p>
 */
@Slf4j
public class DocHelperRulesEngine implements IDocHelperRulesEngine {

    @Getter
    private final DocHelperRulesEngineConfig config;
    private final IDocHelperFieldValidator fieldValidator;
    private final FormulaCompiler formulaCompiler;
    private final FormulaDependencyGraphBuilder graphBuilder;
    private final FormulaScheduler formulaScheduler;
    private final ControlRuleEvaluator controlRuleEvaluator;
    private final OverrideConflictDetector conflictDetector;
    private final OverrideReconciler overrideReconciler;
    private final ValueResolutionCoordinator resolutionCoordinator;
    private final RuleSetDefinitionValidator ruleSetValidator;
    private final FormulaValidator formulaValidator;
    @Getter
    private final IDocHelperMessageSource messageSource;

    public DocHelperRulesEngine(DocHelperRulesEngineConfig config, IDocHelperFieldValidator fieldValidator) {
        this.config = config;
        this.fieldValidator = fieldValidator;
        this.formulaCompiler = new FormulaCompiler();
        this.graphBuilder = new FormulaDependencyGraphBuilder();
        SafeFormulaEvaluator evaluator = new SafeFormulaEvaluator(FormulaFunctionRegistry.getInstance(), config.getMathContext());
        this.formulaScheduler = new FormulaScheduler(evaluator);
        this.conflictDetector = new OverrideConflictDetector(config.getClock());
        this.controlRuleEvaluator = new ControlRuleEvaluator(
                formulaScheduler,
                evaluator,
                conflictDetector,
                config.getMaxControlChainDepth());
        this.overrideReconciler = new OverrideReconciler(config.getClock(), conflictDetector);
        this.resolutionCoordinator = new ValueResolutionCoordinator();
        this.ruleSetValidator = new RuleSetDefinitionValidator();
        this.formulaValidator = new FormulaValidator(formulaCompiler, FormulaFunctionRegistry.getInstance());
        this.messageSource = new DocHelperMessageSource();
    }

    public DocHelperRulesEngine(DocHelperRulesEngineConfig config) {
        this(config, new ConstraintFieldValidator());
    }

    private static final class SingletonHelper {
        private static final IDocHelperRulesEngine INSTANCE = new DocHelperRulesEngine(DocHelperRulesEngineConfig.load());
    }

    public static IDocHelperRulesEngine getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public EntityRuleContext createContext(String entityInstanceId,
                                           RuleSetDefinition ruleSet,
                                           Map<String, Object> persistedValues) throws FormulaParseException, FormulaCycleException {
        ruleSetValidator.validate(ruleSet);

        Map<String, CompiledFormula> formulas = new LinkedHashMap<>();
        for (FieldDefinition field : ruleSet.getFields()) {
            if (field.isFormulaField()) {
                try {
                    formulas.put(field.getId(), formulaCompiler.compile(field.getFormula()));
                } catch (FormulaParseException e) {
                    throw e.forField(field.getId());
                }
            }
        }
        FormulaDependencyGraph graph = graphBuilder.build(formulas);

        Set<String> fieldIds = new LinkedHashSet<>();
        ruleSet.getFields().forEach(field -> fieldIds.add(field.getId()));
        ControlRuleTable controlRuleTable = ControlRuleTable.from(ruleSet, fieldIds, formulaCompiler);

        Map<String, Object> values = persistedValues == null ? Map.of() : persistedValues;
        values.keySet().stream()
                .filter(fieldId -> !fieldIds.contains(fieldId))
                .forEach(fieldId -> log.warn("Ignoring persisted value for unknown field [{}] of entity [{}]", fieldId, entityInstanceId));

        List<FieldValueState> states = new ArrayList<>();
        for (FieldDefinition field : ruleSet.getFields()) {
            Object raw = values.containsKey(field.getId()) ? values.get(field.getId()) : field.getDefaultValue();
            states.add(new FieldValueState(field, field.isFormulaField() ? null : raw));
        }

        EntityRuleContext context = new EntityRuleContext(entityInstanceId, ruleSet, graph, controlRuleTable, states);
        FormulaRecomputeResult initial = formulaScheduler.recomputeAll(graph, context.getValueSnapshot());
        context.applyFormulaResults(initial);
        controlRuleEvaluator.applyPresentationRules(context);

        log.info("Created rule context for entity [{}] with rule set [{}]: {} field(s), {} formula(s)",
                entityInstanceId, ruleSet.getId(), states.size(), formulas.size());
        return context;
    }

    @Override
    public EditResult applyEdit(EntityRuleContext context, String fieldId, Object rawValue) {
        FieldValueState field = context.requireField(fieldId);
        if (field.isFormulaDerived()) {
            log.debug("Rejected edit of formula field [{}] of entity [{}]", fieldId, context.getEntityInstanceId());
            return EditResult.rejected(fieldId, DocHelperRulesErrorCodes.FORMULA_FIELD_NOT_EDITABLE,
                    "Field [" + fieldId + "] is computed by a formula and cannot be edited");
        }
        return cascade(context, field, rawValue);
    }

    @Override
    public List<EditResult> applyEdits(EntityRuleContext context, Map<String, Object> rawValues) {
        List<EditResult> results = new ArrayList<>();
        rawValues.forEach((fieldId, rawValue) -> results.add(applyEdit(context, fieldId, rawValue)));
        return results;
    }

    @Override
    public ResolvedFieldValue resolve(EntityRuleContext context, String fieldId) {
        return resolutionCoordinator.resolve(context, fieldId);
    }

    @Override
    public Map<String, ResolvedFieldValue> resolveAll(EntityRuleContext context) {
        return resolutionCoordinator.resolveAll(context);
    }

    @Override
    public ExternalValueObservation recordExternalValue(EntityRuleContext context, String fieldId, Object observedValue) {
        Object systemValue = resolutionCoordinator.resolveSystemValue(context.requireField(fieldId)).value();
        return overrideReconciler.recordExternalValue(context, fieldId, systemValue, observedValue);
    }

    @Override
    public OverrideAcceptance acceptOverride(EntityRuleContext context, String overrideId) {
        OverrideRecord record = context.findOverride(overrideId)
                .orElseThrow(() -> new OverrideNotFoundException(overrideId));
        Optional<OverrideConflict> blocking = context.findConflict(record.getFieldId()).filter(OverrideConflict::isBlocking);
        if (blocking.isPresent()) {
            log.warn("Override [{}] cannot be accepted while field [{}] has an open conflict",
                    overrideId, record.getFieldId());
            return new OverrideAcceptance(OverrideAcceptance.Outcome.BLOCKED_BY_CONFLICT, record, null, blocking.get());
        }

        overrideReconciler.validate(context, overrideId, fieldValidator);
        if (record.getState() == OverrideState.INVALID) {
            return new OverrideAcceptance(OverrideAcceptance.Outcome.INVALID, record, null,
                    context.findConflict(record.getFieldId()).orElse(null));
        }

        FieldValueState field = context.requireField(record.getFieldId());
        EditResult editResult;
        if (field.isFormulaDerived()) {
            editResult = EditResult.builder().fieldId(field.getFieldId()).accepted(true).build();
            conflictDetector.detectFormulaConflict(context, field.getFieldId(), field.getFormulaValue());
        } else {
            editResult = cascade(context, field, record.getObservedValue());
        }
        log.debug("Accepted override [{}] for field [{}]", overrideId, record.getFieldId());
        return new OverrideAcceptance(OverrideAcceptance.Outcome.ACCEPTED, record, editResult,
                context.findConflict(record.getFieldId()).orElse(null));
    }

    @Override
    public OverrideRecord resolveConflict(EntityRuleContext context, String fieldId, Object chosenValue) {
        return overrideReconciler.resolveConflict(context, fieldId, chosenValue);
    }

    @Override
    public void rejectOverride(EntityRuleContext context, String overrideId) {
        overrideReconciler.reject(context, overrideId);
    }

    @Override
    public OverrideRecord setOverrideUseInGeneration(EntityRuleContext context, String overrideId, boolean useInGeneration) {
        return overrideReconciler.setUseInGeneration(context, overrideId, useInGeneration);
    }

    @Override
    public List<OverrideRecord> markGenerated(EntityRuleContext context) {
        return overrideReconciler.markGenerated(context);
    }

    @Override
    public int cleanupAfterGeneration(EntityRuleContext context) {
        return overrideReconciler.cleanupAfterGeneration(context);
    }

    @Override
    public GenerationSyncResult completeGeneration(EntityRuleContext context) {
        List<OverrideRecord> transitioned = overrideReconciler.markGenerated(context);
        int removed = overrideReconciler.cleanupAfterGeneration(context);
        return new GenerationSyncResult(context.getGenerationCount(), transitioned, removed);
    }

    @Override
    public FormulaValidationReport validateFormula(String expression, Set<String> knownFieldIds) {
        return formulaValidator.validate(expression, knownFieldIds);
    }

    @Override
    public DocHelperErrorDescription describeError(IDocHelperErrorInfo errorInfo, Locale locale, Map<String, String> templateVariables) {
        return DocHelperErrorDescription.of(errorInfo, messageSource, locale, templateVariables);
    }

    private EditResult cascade(EntityRuleContext context, FieldValueState field, Object rawValue) {
        Map<String, FieldValueState> before = context.captureFieldStates();

        field.setRawValue(rawValue);
        FormulaRecomputeResult recompute = formulaScheduler.recompute(
                context.getDependencyGraph(), Set.of(field.getFieldId()), context.getValueSnapshot());
        Set<String> changedFormulas = context.applyFormulaResults(recompute);

        List<String> sources = new ArrayList<>();
        sources.add(field.getFieldId());
        sources.addAll(changedFormulas);
        ControlPropagationResult control = controlRuleEvaluator.propagate(context, sources);

        Map<String, FieldValueState> after = context.getFields();
        EditResult.EditResultBuilder result = EditResult.builder()
                .fieldId(field.getFieldId())
                .accepted(true)
                .changes(EditResult.diff(before, after))
                .previousRawValues(EditResult.previousRawValues(before, after))
                .controlErrors(control.getErrors())
                .appliedEffects(control.getAppliedEffects())
                .overrideConflicts(control.getOverrideConflicts());

        Set<String> recomputed = new LinkedHashSet<>(recompute.getEvaluatedFieldIds());
        recomputed.addAll(control.getRecomputedFormulaFields());
        Map<String, FormulaEvaluationError> formulaErrors = new LinkedHashMap<>();
        for (String fieldId : recomputed) {
            FieldValueState state = context.requireField(fieldId);
            if (state.isFormulaFailed()) {
                formulaErrors.put(fieldId, state.getFormulaError());
            }
        }
        result.formulaErrors(formulaErrors);

        EditResult partial = result.build();
        List<OverrideRecord> obsolete = overrideReconciler.observeSystemValues(
                context,
                partial.getChangedFieldIds(),
                fieldId -> resolutionCoordinator.resolveSystemValue(context.requireField(fieldId)).value());
        return result.obsoleteOverrides(obsolete).build();
    }
}
