package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationNode;

import java.util.*;

/**
 * Transitive closure of empirical-input taints and axiom reachability.
 *
 * One pass over the {@link TopologicalOrder} fills a memo table indexed by
 * topological position: each node's result is the union of its own
 * empirical inputs with the already-computed results of its dependencies. A
 * shared ancestor is therefore computed once, no matter how many nodes depend
 * on it. Nodes whose result equals a single dependency's reuse that set
 * instead of copying it.
 *
 * The memo lives here, not on the nodes, so {@link DerivationNode} stays a
 * plain value. Instances are immutable once constructed.
 */
public final class ContaminationPropagator {
    private final TopologicalOrder topology;
    private final Set<String>[] sources;
    private final Set<String>[] axioms;

    @SuppressWarnings("unchecked")
    public ContaminationPropagator(TopologicalOrder topology) {
        this.topology = topology;
        int n = topology.nodeCount();
        this.sources = new Set[n];
        this.axioms = new Set[n];
        for (int ti = 0; ti < n; ti++) {
            DerivationNode node = topology.node(ti);
            sources[ti] = union(ti, node.empiricalInputs(), sources);
            axioms[ti] = topology.isAxiom(ti) ? Set.of(node.id()) : union(ti, List.of(), axioms);
        }
    }

    // Dependencies of ti precede it in topological order, so their memo slots are filled.
    private Set<String> union(int ti, List<String> own, Set<String>[] memo) {
        int depCount = topology.dependencyCount(ti);
        if (own.isEmpty() && depCount == 1)
            return memo[topology.dependency(ti, 0)];

        Set<String> acc = new TreeSet<>(own);
        for (int i = 0; i < depCount; i++)
            acc.addAll(memo[topology.dependency(ti, i)]);
        return acc.isEmpty() ? Set.of() : Collections.unmodifiableSet(acc);
    }

    /**
     * Every empirical input consumed anywhere in the node's dependency closure,
     * including the node itself.
     */
    public Set<String> contaminationSources(String id) {
        return sources[topology.topoIndex(id)];
    }

    /** True when no empirical input appears in the node's dependency closure. */
    public boolean isPure(String id) {
        return contaminationSources(id).isEmpty();
    }

    /** Ids of every AXIOM node reachable from this node, itself included. */
    public Set<String> axiomClosure(String id) {
        return axioms[topology.topoIndex(id)];
    }
}
