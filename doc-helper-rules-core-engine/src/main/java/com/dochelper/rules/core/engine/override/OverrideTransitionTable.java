package com.dochelper.rules.core.engine.override;

import com.dochelper.rules.core.exception.override.OverrideStateTransitionException;
import com.dochelper.rules.integration.enumerations.OverrideState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal override state transitions. SYNCED_FORMULA is additionally restricted
 * to overrides of formula derived fields.
 */
public final class OverrideTransitionTable {

    private static final Map<OverrideState, Set<OverrideState>> TRANSITIONS = new EnumMap<>(OverrideState.class);

    static {
        TRANSITIONS.put(OverrideState.PENDING, EnumSet.of(OverrideState.ACCEPTED, OverrideState.INVALID));
        TRANSITIONS.put(OverrideState.ACCEPTED, EnumSet.of(OverrideState.SYNCED));
        TRANSITIONS.put(OverrideState.SYNCED, EnumSet.of(OverrideState.SYNCED_FORMULA));
        TRANSITIONS.put(OverrideState.INVALID, EnumSet.noneOf(OverrideState.class));
        TRANSITIONS.put(OverrideState.SYNCED_FORMULA, EnumSet.noneOf(OverrideState.class));
    }

    private OverrideTransitionTable() {
    }

    public static boolean isAllowed(OverrideState from, OverrideState to, boolean formulaField) {
        if (to == OverrideState.SYNCED_FORMULA && !formulaField) {
            return false;
        }
        return TRANSITIONS.get(from).contains(to);
    }

    public static Set<OverrideState> allowedTargets(OverrideState from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    static void transition(OverrideRecord record, OverrideState to) {
        if (!isAllowed(record.getState(), to, record.isFormulaField())) {
            throw new OverrideStateTransitionException(record.getId(), record.getState(), to);
        }
        record.setState(to);
    }
}
