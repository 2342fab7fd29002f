package com.firm.provenance.registry;

import java.util.Set;

/**
 * Purity of one registered tree's target.
 *
 * @param targetResult         Registered name.
 * @param pure                 True when the target consumes no empirical input.
 * @param contaminationSources Empirical inputs reaching the target, empty when pure.
 */
public record AuditEntry(String targetResult, boolean pure, Set<String> contaminationSources) {
    public AuditEntry {
        contaminationSources = Set.copyOf(contaminationSources);
    }
}
