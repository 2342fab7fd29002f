package com.firm.provenance.api;

/** The target node does not rest on any declared axiom root. */
public class OrphanTargetException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String targetResult;
    private final String targetId;

    public OrphanTargetException(String targetResult, String targetId) {
        super("Target " + targetId + " of \"" + targetResult + "\" is not reachable from any axiom root");
        this.targetResult = targetResult;
        this.targetId = targetId;
    }

    public String targetResult() {
        return targetResult;
    }

    public String targetId() {
        return targetId;
    }
}
