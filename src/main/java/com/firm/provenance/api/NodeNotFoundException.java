package com.firm.provenance.api;

/**
 * A lookup asked for a node id the tree does not contain.
 *
 * This always indicates a provenance-assembly bug in the caller, so lookups
 * throw rather than return null.
 */
public class NodeNotFoundException extends ProvenanceException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Unknown node: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
