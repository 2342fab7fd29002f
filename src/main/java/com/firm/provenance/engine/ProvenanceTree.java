package com.firm.provenance.engine;

import com.firm.provenance.api.*;
import com.firm.provenance.util.Digests;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.*;

/**
 * A validated, frozen derivation: every node from the axioms to the target,
 * with its dependency structure, purity and axiom attribution precomputed.
 *
 * Trees are only obtained through {@link Builder#build()}, which enforces:
 * 1. every dependency id resolves;
 * 2. the dependency relation is acyclic;
 * 3. a node has no dependencies if and only if it is an AXIOM;
 * 4. every axiom root is an AXIOM node of this tree;
 * 5. the target is reachable from at least one axiom root.
 *
 * A built tree never changes. A new derivation means a new tree.
 */
public final class ProvenanceTree {
    private final String targetResult;
    private final String targetId;
    private final List<String> axiomRoots;
    private final Map<String, DerivationNode> nodes;
    private final TopologicalOrder topology;
    private final ContaminationPropagator propagator;
    private final ProvenanceTracer tracer;
    private final ErrorPropagator errors;

    private ProvenanceTree(String targetResult, String targetId, List<String> axiomRoots,
            TopologicalOrder topology, ContaminationPropagator propagator) {
        this.targetResult = targetResult;
        this.targetId = targetId;
        this.axiomRoots = List.copyOf(axiomRoots);
        this.topology = topology;
        this.propagator = propagator;
        this.tracer = new ProvenanceTracer(topology, propagator, new HashSet<>(axiomRoots));
        this.errors = new ErrorPropagator(topology);

        Map<String, DerivationNode> ordered = new LinkedHashMap<>(topology.nodeCount() * 2);
        for (int ti = 0; ti < topology.nodeCount(); ti++)
            ordered.put(topology.node(ti).id(), topology.node(ti));
        this.nodes = Collections.unmodifiableMap(ordered);
    }

    public static Builder builder(String targetResult) {
        return new Builder(targetResult);
    }

    /** Human name of the overall claim, e.g. "fine structure constant". */
    public String targetResult() {
        return targetResult;
    }

    public String targetId() {
        return targetId;
    }

    /** Axiom roots in id order. */
    public List<String> axiomRoots() {
        return axiomRoots;
    }

    /** All nodes, keyed by id, iterating in topological order. */
    public Map<String, DerivationNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public TopologicalOrder topology() {
        return topology;
    }

    /** Node ids in the deterministic topological order. */
    public List<String> topologicalOrder() {
        return topology.ids();
    }

    /**
     * Strict lookup.
     *
     * @throws NodeNotFoundException if the id is not in this tree.
     */
    public DerivationNode getNode(String id) {
        return tracer.getNode(id);
    }

    public DerivationNode target() {
        return getNode(targetId);
    }

    public List<DerivationNode> traceChain(String id) {
        return tracer.traceChain(id);
    }

    public Set<String> axiomRootsOf(String id) {
        return tracer.axiomRootsOf(id);
    }

    public List<List<String>> pathsToAxioms(String id) {
        return tracer.pathsToAxioms(id);
    }

    public Set<String> contaminationSources(String id) {
        return propagator.contaminationSources(id);
    }

    public boolean isPure(String id) {
        return propagator.isPure(id);
    }

    public Set<String> axiomClosure(String id) {
        return propagator.axiomClosure(id);
    }

    public boolean isTargetPure() {
        return isPure(targetId);
    }

    /**
     * Ids of intermediate nodes that consume empirical inputs themselves, in
     * topological order. TARGET nodes are left out; their purity is reported by
     * {@link #isTargetPure()}.
     */
    public List<String> contaminatedNodes() {
        List<String> out = new ArrayList<>();
        for (DerivationNode node : nodes.values())
            if (!node.isDirectlyPure() && node.kind() != DerivationKind.TARGET)
                out.add(node.id());
        return Collections.unmodifiableList(out);
    }

    /** Declared or propagated numerical error of a node. */
    public ErrorBounds errorBounds(String id) {
        return errors.errorBounds(id);
    }

    /** Error bounds of every node, keyed by id in topological order. */
    public Map<String, ErrorBounds> errorPropagation() {
        return errors.all();
    }

    /** Expression of each axiom root, in root order. */
    public Map<String, String> axiomStatements() {
        Map<String, String> out = new LinkedHashMap<>();
        for (String root : axiomRoots)
            out.put(root, getNode(root).expression());
        return Collections.unmodifiableMap(out);
    }

    /** True when every node rests on at least one AXIOM node. */
    public boolean hasCompleteProvenance() {
        for (String id : nodes.keySet())
            if (propagator.axiomClosure(id).isEmpty())
                return false;
        return true;
    }

    /**
     * Compares node content against fingerprints recorded earlier, e.g. the
     * {@code fingerprint} of each step in a stored report.
     *
     * @return Ids whose recorded fingerprint differs from the current content,
     *         or that are no longer in this tree, in id order.
     */
    public List<String> tamperedNodes(Map<String, String> recordedFingerprints) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, String> e : new TreeMap<>(recordedFingerprints).entrySet()) {
            DerivationNode node = nodes.get(e.getKey());
            if (node == null || !node.verifyFingerprint(e.getValue()))
                out.add(e.getKey());
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * SHA-256 over the node fingerprints in topological order, followed by the
     * target id. Equal for trees built from the same nodes in any order.
     */
    public String seal() {
        MessageDigest digest = Digests.newSha256();
        for (DerivationNode node : nodes.values())
            digest.update((node.fingerprint() + "\n").getBytes(StandardCharsets.UTF_8));
        digest.update(targetId.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ProvenanceTree other))
            return false;
        return targetResult.equals(other.targetResult)
                && targetId.equals(other.targetId)
                && axiomRoots.equals(other.axiomRoots)
                && topologicalOrder().equals(other.topologicalOrder())
                && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetResult, targetId, axiomRoots, nodes);
    }

    @Override
    public String toString() {
        return "ProvenanceTree[" + targetResult + ", target=" + targetId + ", nodes=" + nodes.size()
                + ", axiomRoots=" + axiomRoots + "]";
    }

    /**
     * Accumulates the nodes of one derivation and validates them as a batch.
     *
     * Usage Pattern:
     * 1. ProvenanceTree.Builder b = ProvenanceTree.builder("α⁻¹");
     * 2. b.insert(DerivationNode.axiom("A1", "..."));
     * 3. b.insert(...); b.target("alpha_inv");
     * 4. ProvenanceTree tree = b.build();
     *
     * A builder can build at most once. Not thread-safe.
     */
    public static final class Builder {
        private final String targetResult;
        private final NodeRegistry registry = new NodeRegistry();
        private final Set<String> declaredRoots = new LinkedHashSet<>();
        private String targetId;

        // Flag to prevent modification after building
        private boolean built;

        private Builder(String targetResult) {
            this.targetResult = Objects.requireNonNull(targetResult, "targetResult");
        }

        public String targetResult() {
            return targetResult;
        }

        /**
         * Adds a node. Dependencies may be inserted later.
         *
         * @throws DuplicateNodeIdException if the id was already inserted.
         */
        public Builder insert(DerivationNode node) {
            checkNotBuilt();
            registry.insert(node);
            return this;
        }

        /**
         * Declares an axiom root. If no root is declared every AXIOM node is a
         * root.
         */
        public Builder axiomRoot(String id) {
            checkNotBuilt();
            declaredRoots.add(Objects.requireNonNull(id, "id"));
            return this;
        }

        /**
         * Designates the target node. If absent, the single TARGET node is used,
         * or failing that the single node nothing depends on.
         */
        public Builder target(String id) {
            checkNotBuilt();
            this.targetId = Objects.requireNonNull(id, "id");
            return this;
        }

        public int size() {
            return registry.size();
        }

        /**
         * Validates the accumulated nodes and freezes them into a tree.
         *
         * @throws ProvenanceBuildException describing the first violated rule.
         */
        public ProvenanceTree build() {
            checkNotBuilt();
            built = true;

            // Sorted so the reported error does not depend on insertion order.
            Map<String, DerivationNode> byId = new TreeMap<>(registry.asMap());

            for (DerivationNode node : byId.values())
                for (String dep : node.dependencies())
                    if (!byId.containsKey(dep))
                        throw new UnknownDependencyException(node.id(), dep);

            Optional<List<String>> cycle = CycleDetector.detectCycle(byId);
            if (cycle.isPresent())
                throw new CyclicDependencyException(cycle.get());

            for (DerivationNode node : byId.values()) {
                boolean noDeps = node.dependencies().isEmpty();
                if (noDeps && !node.kind().isAxiom())
                    throw new NonAxiomWithoutDependenciesException(node.id());
                if (!noDeps && node.kind().isAxiom())
                    throw new AxiomWithDependenciesException(node.id());
            }

            List<String> roots = resolveAxiomRoots(byId);
            String target = resolveTarget(byId);

            TopologicalOrder topology = TopologicalOrder.builder().addNodes(byId.values()).build();
            ContaminationPropagator propagator = new ContaminationPropagator(topology);

            if (Collections.disjoint(propagator.axiomClosure(target), roots))
                throw new OrphanTargetException(targetResult, target);

            return new ProvenanceTree(targetResult, target, roots, topology, propagator);
        }

        private List<String> resolveAxiomRoots(Map<String, DerivationNode> byId) {
            if (declaredRoots.isEmpty()) {
                List<String> all = new ArrayList<>();
                for (DerivationNode node : byId.values())
                    if (node.kind().isAxiom())
                        all.add(node.id());
                return all;
            }
            for (String id : declaredRoots) {
                DerivationNode node = byId.get(id);
                if (node == null || !node.kind().isAxiom())
                    throw new MissingAxiomRootException(id);
            }
            return new ArrayList<>(new TreeSet<>(declaredRoots));
        }

        private String resolveTarget(Map<String, DerivationNode> byId) {
            if (targetId != null) {
                if (!byId.containsKey(targetId))
                    throw new TargetNotDesignatedException(targetResult,
                            "designated target " + targetId + " was never inserted");
                return targetId;
            }

            List<String> targets = new ArrayList<>();
            for (DerivationNode node : byId.values())
                if (node.kind() == DerivationKind.TARGET)
                    targets.add(node.id());
            if (targets.size() == 1)
                return targets.get(0);

            Set<String> sinks = new TreeSet<>(byId.keySet());
            for (DerivationNode node : byId.values())
                sinks.removeAll(node.dependencies());
            if (sinks.size() == 1)
                return sinks.iterator().next();

            throw new TargetNotDesignatedException(targetResult,
                    targets.size() > 1 ? "several TARGET nodes " + targets
                            : "no TARGET node and " + sinks.size() + " candidate sinks");
        }

        private void checkNotBuilt() {
            if (built)
                throw new IllegalStateException("Builder already built");
        }
    }
}
