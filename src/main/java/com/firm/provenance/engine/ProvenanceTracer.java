package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.NodeNotFoundException;

import java.util.*;

/**
 * Read-side queries over a validated derivation: strict lookup, ancestor
 * chains for step-by-step rendering, and axiom attribution.
 */
public final class ProvenanceTracer {
    private final TopologicalOrder topology;
    private final ContaminationPropagator propagator;
    private final Set<String> axiomRoots;

    public ProvenanceTracer(TopologicalOrder topology, ContaminationPropagator propagator, Set<String> axiomRoots) {
        this.topology = topology;
        this.propagator = propagator;
        this.axiomRoots = Set.copyOf(axiomRoots);
    }

    /**
     * Strict lookup.
     *
     * @throws NodeNotFoundException if the id is not in the tree. Never returns null.
     */
    public DerivationNode getNode(String id) {
        return topology.node(topology.topoIndex(id));
    }

    /**
     * The node and all of its ancestors in topological order, dependencies
     * first and the node itself last. Suitable for "step 1 .. step k"
     * rendering.
     */
    public List<DerivationNode> traceChain(String id) {
        int target = topology.topoIndex(id);
        boolean[] reached = new boolean[target + 1];
        reached[target] = true;
        Deque<Integer> work = new ArrayDeque<>();
        work.push(target);
        while (!work.isEmpty()) {
            int ti = work.pop();
            for (int i = 0; i < topology.dependencyCount(ti); i++) {
                int dep = topology.dependency(ti, i);
                if (!reached[dep]) {
                    reached[dep] = true;
                    work.push(dep);
                }
            }
        }

        List<DerivationNode> chain = new ArrayList<>();
        for (int ti = 0; ti <= target; ti++)
            if (reached[ti])
                chain.add(topology.node(ti));
        return Collections.unmodifiableList(chain);
    }

    /** Declared axiom roots the node's derivation ultimately rests on. */
    public Set<String> axiomRootsOf(String id) {
        Set<String> roots = new TreeSet<>(propagator.axiomClosure(id));
        roots.retainAll(axiomRoots);
        return Collections.unmodifiableSet(roots);
    }

    /**
     * Every dependency path from the node down to an axiom. Each path starts
     * at {@code id} and ends at an AXIOM node; dependencies are explored in
     * id order so the result is stable. The number of paths can grow
     * exponentially with diamond depth, so this is meant for audits of small
     * derivations. Depth is not limited: the walk uses an explicit stack.
     */
    public List<List<String>> pathsToAxioms(String id) {
        List<List<String>> paths = new ArrayList<>();
        List<String> prefix = new ArrayList<>();
        Deque<PathFrame> stack = new ArrayDeque<>();
        enter(topology.topoIndex(id), prefix, stack, paths);

        while (!stack.isEmpty()) {
            PathFrame top = stack.peek();
            if (top.next < top.deps.length) {
                enter(topology.topoIndex(top.deps[top.next++]), prefix, stack, paths);
            } else {
                stack.pop();
                prefix.remove(prefix.size() - 1);
            }
        }
        return Collections.unmodifiableList(paths);
    }

    // Axioms end a path at once; other nodes stay on the stack until their dependencies are walked.
    private void enter(int ti, List<String> prefix, Deque<PathFrame> stack, List<List<String>> out) {
        DerivationNode node = topology.node(ti);
        prefix.add(node.id());
        if (topology.isAxiom(ti)) {
            out.add(List.copyOf(prefix));
            prefix.remove(prefix.size() - 1);
        } else {
            stack.push(new PathFrame(new TreeSet<>(node.dependencies()).toArray(new String[0])));
        }
    }

    private static final class PathFrame {
        final String[] deps;
        int next;

        PathFrame(String[] deps) {
            this.deps = deps;
        }
    }
}
