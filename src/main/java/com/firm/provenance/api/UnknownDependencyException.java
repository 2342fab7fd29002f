package com.firm.provenance.api;

/** A dependency list references an id that was never inserted. */
public class UnknownDependencyException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;
    private final String missingDependencyId;

    public UnknownDependencyException(String nodeId, String missingDependencyId) {
        super("Node " + nodeId + " depends on unknown node " + missingDependencyId);
        this.nodeId = nodeId;
        this.missingDependencyId = missingDependencyId;
    }

    public String nodeId() {
        return nodeId;
    }

    public String missingDependencyId() {
        return missingDependencyId;
    }
}
