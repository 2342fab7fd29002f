package com.firm.provenance.api;

/** A declared axiom root is absent from the tree or is not an {@link DerivationKind#AXIOM} node. */
public class MissingAxiomRootException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public MissingAxiomRootException(String nodeId) {
        super("Declared axiom root " + nodeId + " is missing or is not an axiom");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
