package com.firm.provenance.api;

/** An axiom cited dependencies. */
public class AxiomWithDependenciesException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public AxiomWithDependenciesException(String nodeId) {
        super("Axiom " + nodeId + " must not have dependencies");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
