package com.firm.provenance.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.ErrorBounds;
import com.firm.provenance.engine.ProvenanceTree;
import com.firm.provenance.engine.TopologicalOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Audit summary of one provenance tree, for peer review and regression
 * comparison. Serialised by {@link ProvenanceReportWriter}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "targetResult", "targetId", "nodeCount", "axiomRoots", "axiomStatements", "kindCounts",
        "maxDepth", "averageBranchingFactor", "completeProvenance", "targetPure", "targetContaminationSources",
        "contaminatedNodes", "errorPropagation", "seal", "steps" })
public class ProvenanceReport {
    String targetResult;
    String targetId;
    int nodeCount;
    List<String> axiomRoots;
    /** Root id to its statement. */
    Map<String, String> axiomStatements;
    Map<String, Integer> kindCounts;
    /** Longest dependency chain; an axiom alone has depth 1. */
    int maxDepth;
    /** Total dependency references divided by node count. */
    double averageBranchingFactor;
    boolean completeProvenance;
    boolean targetPure;
    Set<String> targetContaminationSources;
    List<String> contaminatedNodes;
    /** Declared or propagated error of every node, in topological order. */
    Map<String, ErrorBounds> errorPropagation;
    String seal;
    @Singular
    List<Step> steps;

    /** One row of the derivation, in topological order. */
    @Value
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Step {
        String id;
        String kind;
        String expression;
        Double numericValue;
        String justification;
        List<String> dependencies;
        List<String> assumptions;
        List<String> empiricalInputs;
        String fingerprint;
    }

    /** Step id to fingerprint, for {@link ProvenanceTree#tamperedNodes(Map)}. */
    public Map<String, String> recordedFingerprints() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Step step : steps)
            out.put(step.getId(), step.getFingerprint());
        return out;
    }

    public static ProvenanceReport of(ProvenanceTree tree) {
        TopologicalOrder topology = tree.topology();
        int n = topology.nodeCount();

        Map<String, Integer> kinds = new TreeMap<>();
        int[] depth = new int[n];
        int maxDepth = 0;
        long totalDeps = 0;
        ProvenanceReportBuilder b = builder();
        for (int ti = 0; ti < n; ti++) {
            DerivationNode node = topology.node(ti);
            kinds.merge(node.kind().value(), 1, Integer::sum);

            int d = 0;
            for (int i = 0; i < topology.dependencyCount(ti); i++)
                d = Math.max(d, depth[topology.dependency(ti, i)]);
            depth[ti] = d + 1;
            maxDepth = Math.max(maxDepth, depth[ti]);
            totalDeps += node.dependencies().size();

            b.step(new Step(node.id(), node.kind().value(), node.expression(), node.numericValue(),
                    node.justification(), node.dependencies(), node.assumptions(), node.empiricalInputs(),
                    node.fingerprint()));
        }

        return b.targetResult(tree.targetResult())
                .targetId(tree.targetId())
                .nodeCount(n)
                .axiomRoots(tree.axiomRoots())
                .axiomStatements(tree.axiomStatements())
                .kindCounts(kinds)
                .maxDepth(maxDepth)
                .averageBranchingFactor(n == 0 ? 0.0 : (double) totalDeps / n)
                .completeProvenance(tree.hasCompleteProvenance())
                .targetPure(tree.isTargetPure())
                .targetContaminationSources(tree.contaminationSources(tree.targetId()))
                .contaminatedNodes(tree.contaminatedNodes())
                .errorPropagation(tree.errorPropagation())
                .seal(tree.seal())
                .build();
    }
}
