package com.firm.provenance.api;

import java.util.Set;

/**
 * Raised under a strict purity policy when the target's dependency closure
 * consumes empirical inputs.
 */
public class ContaminatedTargetException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String targetId;
    private final Set<String> sources;

    public ContaminatedTargetException(String targetId, Set<String> sources) {
        super("Target " + targetId + " consumes empirical inputs " + sources);
        this.targetId = targetId;
        this.sources = Set.copyOf(sources);
    }

    public String targetId() {
        return targetId;
    }

    public Set<String> sources() {
        return sources;
    }
}
