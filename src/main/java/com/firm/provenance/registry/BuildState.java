package com.firm.provenance.registry;

/** Lifecycle of one {@link TreeBuild}. BUILDING moves to exactly one of the other two. */
public enum BuildState {
    BUILDING,
    VALID,
    REJECTED
}
