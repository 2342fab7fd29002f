package com.firm.provenance.api;

/** Only axioms may stand without dependencies. */
public class NonAxiomWithoutDependenciesException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public NonAxiomWithoutDependenciesException(String nodeId) {
        super("Node " + nodeId + " has no dependencies but is not an axiom");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
