package com.firm.provenance.api;

/**
 * No target was designated and none could be inferred: there is not exactly
 * one TARGET node and not exactly one sink.
 */
public class TargetNotDesignatedException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String targetResult;

    public TargetNotDesignatedException(String targetResult, String reason) {
        super("No target node for \"" + targetResult + "\": " + reason);
        this.targetResult = targetResult;
    }

    public String targetResult() {
        return targetResult;
    }
}
