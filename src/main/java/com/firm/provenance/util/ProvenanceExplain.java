package com.firm.provenance.util;

import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.engine.ProvenanceTree;
import com.firm.provenance.engine.TopologicalOrder;

import java.util.List;

/**
 * Diagnostic utility for inspecting a provenance tree.
 *
 * <p>
 * Generates human-readable text for a single node or for the chain of steps
 * leading to it. Intended for debugging sessions and error messages; report
 * layouts belong to the caller.
 */
public final class ProvenanceExplain {
    private final ProvenanceTree tree;
    private final TopologicalOrder topology;

    public ProvenanceExplain(ProvenanceTree tree) {
        this.tree = tree;
        this.topology = tree.topology();
    }

    /**
     * Dumps the state of a single node.
     */
    public String explainNode(String id) {
        int idx = topology.topoIndex(id);
        DerivationNode node = topology.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Kind: ").append(node.kind().value()).append('\n')
                .append("  Expression: ").append(node.expression()).append('\n');
        if (node.hasNumericValue())
            sb.append("  Value: ").append(node.numericValue()).append('\n');
        sb.append("  Depends on: ").append(node.dependencies()).append('\n')
                .append("  Axiom roots: ").append(tree.axiomRootsOf(id)).append('\n')
                .append("  Pure: ").append(tree.isPure(id));
        if (!tree.isPure(id))
            sb.append(" (empirical: ").append(tree.contaminationSources(id)).append(')');
        sb.append('\n');
        int dc = topology.dependentCount(idx);
        sb.append("  Used by (").append(dc).append("): ");
        for (int i = 0; i < dc; i++) {
            sb.append(topology.node(topology.dependent(idx, i)).id());
            if (i < dc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Numbered steps from the axioms to {@code id}.
     */
    public String explainChain(String id) {
        List<DerivationNode> chain = tree.traceChain(id);
        StringBuilder sb = new StringBuilder(1024);
        sb.append(tree.targetResult()).append(" (").append(chain.size()).append(" steps):\n");
        int step = 1;
        for (DerivationNode node : chain) {
            sb.append("  ").append(step++).append(". [").append(node.kind().value()).append("] ")
                    .append(node.id()).append(": ").append(node.expression());
            if (!node.isDirectlyPure())
                sb.append("  <empirical: ").append(String.join(", ", node.empiricalInputs())).append('>');
            sb.append('\n');
        }
        return sb.toString();
    }
}
