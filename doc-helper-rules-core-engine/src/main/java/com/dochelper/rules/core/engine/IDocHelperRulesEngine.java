package com.dochelper.rules.core.engine;

import com.dochelper.rules.core.engine.formula.FormulaValidationReport;
import com.dochelper.rules.core.engine.message.DocHelperErrorDescription;
import com.dochelper.rules.core.engine.override.ExternalValueObservation;
import com.dochelper.rules.core.engine.override.GenerationSyncResult;
import com.dochelper.rules.core.engine.override.OverrideAcceptance;
import com.dochelper.rules.core.engine.override.OverrideRecord;
import com.dochelper.rules.core.engine.resolution.ResolvedFieldValue;
import com.dochelper.rules.core.exception.formula.FormulaCycleException;
import com.dochelper.rules.core.exception.formula.FormulaParseException;
import com.dochelper.rules.core.models.EditResult;
import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.integration.contract.IDocHelperErrorInfo;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the rule engine for UI, undo and document generation
 * collaborators. All per entity state lives in the {@link EntityRuleContext}
 * passed to each call.
 */
public interface IDocHelperRulesEngine {

    /**
     * Builds the context of one entity instance and computes every formula.
     *
     * @param persistedValues stored raw values by field id; missing fields take
     *                        the definition default
     */
    EntityRuleContext createContext(String entityInstanceId,
                                    RuleSetDefinition ruleSet,
                                    Map<String, Object> persistedValues) throws FormulaParseException, FormulaCycleException;

    /**
     * Stores a raw value and cascades formulas and control rules. Also the undo
     * entry point: undo resubmits the previous raw value.
     */
    EditResult applyEdit(EntityRuleContext context, String fieldId, Object rawValue);

    /**
     * Applies edits one after the other, in iteration order.
     */
    List<EditResult> applyEdits(EntityRuleContext context, Map<String, Object> rawValues);

    ResolvedFieldValue resolve(EntityRuleContext context, String fieldId);

    Map<String, ResolvedFieldValue> resolveAll(EntityRuleContext context);

    ExternalValueObservation recordExternalValue(EntityRuleContext context, String fieldId, Object observedValue);

    OverrideAcceptance acceptOverride(EntityRuleContext context, String overrideId);

    OverrideRecord resolveConflict(EntityRuleContext context, String fieldId, Object chosenValue);

    void rejectOverride(EntityRuleContext context, String overrideId);

    OverrideRecord setOverrideUseInGeneration(EntityRuleContext context, String overrideId, boolean useInGeneration);

    List<OverrideRecord> markGenerated(EntityRuleContext context);

    int cleanupAfterGeneration(EntityRuleContext context);

    /**
     * {@link #markGenerated(EntityRuleContext)} followed by
     * {@link #cleanupAfterGeneration(EntityRuleContext)}, the call to make after
     * a document was generated successfully.
     */
    GenerationSyncResult completeGeneration(EntityRuleContext context);

    FormulaValidationReport validateFormula(String expression, Set<String> knownFieldIds);

    /**
     * Renders the message and resolution hint of an error code.
     */
    DocHelperErrorDescription describeError(IDocHelperErrorInfo errorInfo, Locale locale, Map<String, String> templateVariables);
}
