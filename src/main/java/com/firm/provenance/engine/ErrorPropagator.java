package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.ErrorBounds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numerical error carried through a derivation.
 *
 * One pass over the {@link TopologicalOrder}, like
 * {@link ContaminationPropagator}. A node with declared bounds keeps them.
 * Any other node combines its dependencies' relative errors by root-sum-square
 * and scales by its own value for the absolute error. An axiom without declared
 * bounds is exact.
 *
 * A dependency that has a value but neither declared nor inherited error
 * contributes {@link #MIN_RELATIVE_ERROR}, so numeric results never claim zero
 * error.
 */
public final class ErrorPropagator {
    /** Floor for an undeclared numeric dependency. */
    public static final double MIN_RELATIVE_ERROR = 1e-12;

    private final TopologicalOrder topology;
    private final ErrorBounds[] bounds;

    public ErrorPropagator(TopologicalOrder topology) {
        this.topology = topology;
        int n = topology.nodeCount();
        this.bounds = new ErrorBounds[n];
        for (int ti = 0; ti < n; ti++) {
            DerivationNode node = topology.node(ti);
            if (node.hasDeclaredErrorBounds()) {
                bounds[ti] = node.errorBounds();
                continue;
            }
            double sumSq = 0.0;
            for (int i = 0; i < topology.dependencyCount(ti); i++) {
                double rel = contribution(topology.dependency(ti, i));
                sumSq += rel * rel;
            }
            bounds[ti] = sumSq == 0.0 ? ErrorBounds.NONE : ErrorBounds.ofRelative(Math.sqrt(sumSq), node.numericValue());
        }
    }

    private double contribution(int dep) {
        DerivationNode node = topology.node(dep);
        double rel = bounds[dep].relativeError();
        if (rel == 0.0 && !node.hasDeclaredErrorBounds() && node.hasNumericValue())
            return MIN_RELATIVE_ERROR;
        return rel;
    }

    public ErrorBounds errorBounds(String id) {
        return bounds[topology.topoIndex(id)];
    }

    /** Bounds of every node, keyed by id in topological order. */
    public Map<String, ErrorBounds> all() {
        Map<String, ErrorBounds> out = new LinkedHashMap<>(bounds.length * 2);
        for (int ti = 0; ti < bounds.length; ti++)
            out.put(topology.node(ti).id(), bounds[ti]);
        return Collections.unmodifiableMap(out);
    }
}
