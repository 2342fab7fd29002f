package com.firm.provenance.api;

/** Registering the same target name twice. Trees are never silently overwritten. */
public class DuplicateTreeException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final String targetResult;

    public DuplicateTreeException(String targetResult) {
        super("A tree is already registered for \"" + targetResult + "\"");
        this.targetResult = targetResult;
    }

    public String targetResult() {
        return targetResult;
    }
}
