package com.firm.provenance.api;

/**
 * Root of every error raised by the provenance graph.
 *
 * All of them are deterministic structural faults: retrying the same input
 * always fails the same way.
 */
public class ProvenanceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ProvenanceException(String message) {
        super(message);
    }
}
