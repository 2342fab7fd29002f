package com.firm.provenance.api;

/** A node id was inserted twice into the same build. */
public class DuplicateNodeIdException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public DuplicateNodeIdException(String nodeId) {
        super("Duplicate node id: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
