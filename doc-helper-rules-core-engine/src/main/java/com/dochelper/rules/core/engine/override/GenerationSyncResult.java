package com.dochelper.rules.core.engine.override;

import java.util.List;

/**
 * Override bookkeeping after one successful document generation.
 */
public record GenerationSyncResult(int generation, List<OverrideRecord> transitioned, int removedOverrides) {
}
