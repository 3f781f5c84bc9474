package com.dochelper.rules.core.engine.control;

import com.dochelper.rules.core.engine.formula.parser.CompiledFormula;
import com.dochelper.rules.core.engine.formula.parser.FormulaCompiler;
import com.dochelper.rules.core.exception.context.RuleSetDefinitionException;
import com.dochelper.rules.core.exception.formula.FormulaParseException;
import com.dochelper.rules.core.util.CommonUtil;
import com.dochelper.rules.integration.models.schema.ControlRuleDefinition;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Enabled control rules of a rule set indexed by trigger field. A rule is
 * triggered by its source field and by every field its condition reads. Rules
 * for one trigger apply in descending priority, then by rule id.
 */
@Slf4j
public class ControlRuleTable {

    private static final Comparator<ControlRuleDefinition> APPLICATION_ORDER = Comparator
            .comparingInt(ControlRuleDefinition::getPriority).reversed()
            .thenComparing(ControlRuleDefinition::getId);

    private final Map<String, List<ControlRuleDefinition>> rulesByTrigger;
    private final Map<String, CompiledFormula> conditionsByRuleId;

    private ControlRuleTable(Map<String, List<ControlRuleDefinition>> rulesByTrigger,
                             Map<String, CompiledFormula> conditionsByRuleId) {
        this.rulesByTrigger = rulesByTrigger;
        this.conditionsByRuleId = conditionsByRuleId;
    }

    public static ControlRuleTable from(RuleSetDefinition ruleSet,
                                        Set<String> fieldIds,
                                        FormulaCompiler compiler) throws FormulaParseException {
        Map<String, List<ControlRuleDefinition>> byTrigger = new HashMap<>();
        Map<String, CompiledFormula> conditions = new HashMap<>();
        Set<String> ruleIds = new HashSet<>();
        for (ControlRuleDefinition rule : ruleSet.getControlRules()) {
            if (!ruleIds.add(rule.getId())) {
                throw RuleSetDefinitionException.duplicateRule(ruleSet.getId(), rule.getId());
            }
            if (!fieldIds.contains(rule.getSourceFieldId())) {
                throw RuleSetDefinitionException.unknownRuleField(rule.getId(), rule.getSourceFieldId());
            }
            if (!fieldIds.contains(rule.getTargetFieldId())) {
                throw RuleSetDefinitionException.unknownRuleField(rule.getId(), rule.getTargetFieldId());
            }

            Set<String> triggers = new LinkedHashSet<>();
            triggers.add(rule.getSourceFieldId());
            if (!CommonUtil.isNullOrBlank(rule.getCondition())) {
                CompiledFormula condition;
                try {
                    condition = compiler.compile(rule.getCondition());
                } catch (FormulaParseException e) {
                    throw e.forControlRule(rule.getId());
                }
                for (String reference : condition.fieldReferences()) {
                    if (!fieldIds.contains(reference)) {
                        throw RuleSetDefinitionException.unknownRuleField(rule.getId(), reference);
                    }
                }
                triggers.addAll(condition.fieldReferences());
                conditions.put(rule.getId(), condition);
            }

            if (!rule.isEnabled()) {
                log.debug("Control rule [{}] is disabled and will not be applied", rule.getId());
                continue;
            }
            triggers.forEach(trigger -> byTrigger.computeIfAbsent(trigger, key -> new ArrayList<>()).add(rule));
        }
        byTrigger.replaceAll((trigger, rules) -> {
            rules.sort(APPLICATION_ORDER);
            return Collections.unmodifiableList(rules);
        });
        return new ControlRuleTable(Collections.unmodifiableMap(byTrigger), Collections.unmodifiableMap(conditions));
    }

    /**
     * Rules to rerun when the given field changes.
     */
    public List<ControlRuleDefinition> getRulesForSource(String fieldId) {
        return rulesByTrigger.getOrDefault(fieldId, List.of());
    }

    public Optional<CompiledFormula> getCondition(String ruleId) {
        return Optional.ofNullable(conditionsByRuleId.get(ruleId));
    }
}
