package com.firm.provenance.api;

import java.util.List;

/**
 * The dependency relation contains a cycle.
 *
 * {@link #cycle()} lists each member once, in derivation order: every id is a
 * dependency of the one after it, and the last is a dependency of the first.
 */
public class CyclicDependencyException extends ProvenanceBuildException {
    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    /**
     * @param closedPath cycle with its first id repeated at the end, as
     *                   returned by the cycle detector
     */
    public CyclicDependencyException(List<String> closedPath) {
        super("Cyclic dependency: " + String.join(" -> ", closedPath));
        this.cycle = List.copyOf(closedPath.subList(0, closedPath.size() - 1));
    }

    public List<String> cycle() {
        return cycle;
    }
}
