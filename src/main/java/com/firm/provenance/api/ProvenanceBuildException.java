package com.firm.provenance.api;

/**
 * A derivation tree could not be built. The partial tree is discarded.
 */
public abstract class ProvenanceBuildException extends ProvenanceException {
    private static final long serialVersionUID = 1L;

    protected ProvenanceBuildException(String message) {
        super(message);
    }
}
