package com.firm.provenance.engine;

import com.firm.provenance.api.CyclicDependencyException;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.NodeNotFoundException;
import com.firm.provenance.api.UnknownDependencyException;

import java.util.*;

/**
 * Topology -- CSR-encoded static derivation DAG.
 *
 * This class represents the immutable structure of a derivation after it has
 * been validated. Nodes are laid out in topological order, dependencies
 * before dependents, so every pass over the tree (contamination, axiom
 * closure, chain tracing) is a single linear scan.
 *
 * Ordering is deterministic: among nodes that are ready at the same time the
 * smallest id comes first. Two builds of the same logical graph therefore
 * produce the same order whatever order their nodes were inserted in.
 *
 * Data layout:
 * - topoOrder: nodes sorted topologically.
 * - dependencyList / dependencyOffset: flattened topological indices of each
 * node's dependencies. Node i's dependencies are
 * dependencyList[dependencyOffset[i]] inclusive to
 * dependencyList[dependencyOffset[i+1]] exclusive, in declaration order.
 * - dependentList / dependentOffset: the same for the reverse edges.
 */
public final class TopologicalOrder {
    // The nodes in topological order.
    private final DerivationNode[] topoOrder;

    // CSR: dependencies of node i (edges towards the axioms).
    private final int[] dependencyOffset;
    private final int[] dependencyList;

    // CSR: dependents of node i (edges towards the target).
    private final int[] dependentOffset;
    private final int[] dependentList;

    // Lookup map for id resolution
    private final Map<String, Integer> idToIndex;

    // Bitset: packs 64 axiom flags per long
    private final long[] axiomWords;

    private TopologicalOrder(DerivationNode[] topoOrder, int[] dependencyOffset, int[] dependencyList,
            int[] dependentOffset, int[] dependentList, Map<String, Integer> idToIndex, long[] axiomWords) {
        this.topoOrder = topoOrder;
        this.dependencyOffset = dependencyOffset;
        this.dependencyList = dependencyList;
        this.dependentOffset = dependentOffset;
        this.dependentList = dependentList;
        this.idToIndex = idToIndex;
        this.axiomWords = axiomWords;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node at the given topological index. */
    public DerivationNode node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node id to its topological index. O(1) hash lookup. */
    public int topoIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new NodeNotFoundException(id);
        return idx;
    }

    public boolean contains(String id) {
        return idToIndex.containsKey(id);
    }

    public boolean isAxiom(int ti) {
        return (axiomWords[ti >> 6] & (1L << ti)) != 0;
    }

    public int dependencyCount(int ti) {
        return dependencyOffset[ti + 1] - dependencyOffset[ti];
    }

    public int dependency(int ti, int i) {
        return dependencyList[dependencyOffset[ti] + i];
    }

    public int dependentCount(int ti) {
        return dependentOffset[ti + 1] - dependentOffset[ti];
    }

    public int dependent(int ti, int i) {
        return dependentList[dependentOffset[ti] + i];
    }

    /** Node ids in topological order. */
    public List<String> ids() {
        List<String> ids = new ArrayList<>(topoOrder.length);
        for (DerivationNode n : topoOrder)
            ids.add(n.id());
        return Collections.unmodifiableList(ids);
    }

    // Internal arrays are not exposed to prevent mutation of immutable topology.

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Resolves dependency ids, sorts, and rejects cycles.
     */
    public static final class Builder {
        private final List<DerivationNode> nodes = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();

        public Builder addNode(DerivationNode node) {
            if (idToIdx.containsKey(node.id()))
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            idToIdx.put(node.id(), nodes.size());
            nodes.add(node);
            return this;
        }

        public Builder addNodes(Collection<DerivationNode> all) {
            for (DerivationNode node : all)
                addNode(node);
            return this;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm, taking the smallest ready id each step.
         *
         * @throws UnknownDependencyException if a dependency id does not resolve.
         * @throws CyclicDependencyException  if the dependencies form a cycle.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];
            List<List<Integer>> forwardEdges = new ArrayList<>(n);
            for (int i = 0; i < n; i++)
                forwardEdges.add(new ArrayList<>());

            // 1. Resolve dependencies into forward edges and in-degrees
            for (int i = 0; i < n; i++) {
                DerivationNode node = nodes.get(i);
                for (String dep : node.dependencies()) {
                    Integer depIdx = idToIdx.get(dep);
                    if (depIdx == null)
                        throw new UnknownDependencyException(node.id(), dep);
                    forwardEdges.get(depIdx).add(i);
                    inDegree[i]++;
                }
            }

            // 2. Seed with nodes having no dependencies, smallest id first
            PriorityQueue<Integer> ready = new PriorityQueue<>(
                    Comparator.comparing((Integer i) -> nodes.get(i).id()));
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            // 3. Kahn's algorithm
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child); // all dependencies placed
            }
            if (topoIdx != n) {
                String placed = "Cycle detected! Placed " + topoIdx + " of " + n;
                Map<String, DerivationNode> byId = new HashMap<>(n * 2);
                for (DerivationNode node : nodes)
                    byId.put(node.id(), node);
                throw new CyclicDependencyException(CycleDetector.detectCycle(byId)
                        .orElseThrow(() -> new IllegalStateException(placed)));
            }

            // 4. Construct compact arrays
            DerivationNode[] orderedNodes = new DerivationNode[n];
            long[] axWords = new long[(n + 63) / 64];
            Map<String, Integer> newIdToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                orderedNodes[ti] = nodes.get(reverseMap[ti]);
                if (orderedNodes[ti].kind().isAxiom())
                    axWords[ti >> 6] |= (1L << ti);
                newIdToIndex.put(orderedNodes[ti].id(), ti);
            }

            // 5. Build both CSR structures
            int[] depOffsets = new int[n + 1];
            int[] childOffsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++) {
                depOffsets[ti + 1] = depOffsets[ti] + orderedNodes[ti].dependencies().size();
                childOffsets[ti + 1] = childOffsets[ti] + forwardEdges.get(reverseMap[ti]).size();
            }

            int[] flatDeps = new int[depOffsets[n]];
            int[] flatChildren = new int[childOffsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<String> deps = orderedNodes[ti].dependencies();
                int base = depOffsets[ti];
                for (int j = 0; j < deps.size(); j++)
                    flatDeps[base + j] = newIdToIndex.get(deps.get(j));

                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                base = childOffsets[ti];
                for (int j = 0; j < children.size(); j++)
                    flatChildren[base + j] = topoMap[children.get(j)];
            }
            return new TopologicalOrder(orderedNodes, depOffsets, flatDeps, childOffsets, flatChildren,
                    newIdToIndex, axWords);
        }
    }
}
