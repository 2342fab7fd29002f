package com.firm.provenance.api;

/** No tree is registered under the requested target name. */
public class UnknownTreeException extends ProvenanceException {
    private static final long serialVersionUID = 1L;

    private final String targetResult;

    public UnknownTreeException(String targetResult) {
        super("No tree registered for \"" + targetResult + "\"");
        this.targetResult = targetResult;
    }

    public String targetResult() {
        return targetResult;
    }
}
