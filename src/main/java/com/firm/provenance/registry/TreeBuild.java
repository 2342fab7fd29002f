package com.firm.provenance.registry;

import com.firm.provenance.api.BuildListener;
import com.firm.provenance.api.ContaminatedTargetException;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.ProvenanceBuildException;
import com.firm.provenance.engine.ProvenanceTree;

import java.util.Collection;
import java.util.Optional;

/**
 * One in-flight build opened by {@link DerivationRegistry#startBuild(String)}.
 *
 * Nodes accumulate privately in this build; nothing is visible in the
 * registry until {@link #finishBuild()} validates and stores the frozen tree.
 * Independent builds share no mutable state and may run on different
 * threads, but a single build must stay on one thread.
 */
public final class TreeBuild {
    private final DerivationRegistry registry;
    private final ProvenanceTree.Builder builder;
    private final BuildListener listener;

    private BuildState state = BuildState.BUILDING;
    private ProvenanceBuildException error;

    TreeBuild(DerivationRegistry registry, String targetResult, BuildListener listener) {
        this.registry = registry;
        this.builder = ProvenanceTree.builder(targetResult);
        this.listener = listener;
    }

    public String targetResult() {
        return builder.targetResult();
    }

    public BuildState state() {
        return state;
    }

    public Optional<ProvenanceBuildException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Adds a node to this build.
     *
     * A duplicate id rejects the whole build: the partial tree is discarded
     * and the exception is rethrown.
     */
    public TreeBuild insert(DerivationNode node) {
        checkBuilding();
        try {
            builder.insert(node);
        } catch (ProvenanceBuildException e) {
            throw reject(e);
        }
        listener.onNodeInserted(targetResult(), node);
        return this;
    }

    public TreeBuild insertAll(Collection<DerivationNode> nodes) {
        for (DerivationNode node : nodes)
            insert(node);
        return this;
    }

    public TreeBuild axiomRoot(String id) {
        checkBuilding();
        builder.axiomRoot(id);
        return this;
    }

    public TreeBuild target(String id) {
        checkBuilding();
        builder.target(id);
        return this;
    }

    /**
     * Validates the accumulated nodes, freezes them and stores the tree under
     * {@link #targetResult()}.
     *
     * @return The stored tree.
     * @throws ProvenanceBuildException if validation or registration fails.
     *                                  The registry is left unchanged.
     */
    public ProvenanceTree finishBuild() {
        checkBuilding();
        ProvenanceTree tree;
        try {
            tree = builder.build();
            if (registry.purityPolicy() == PurityPolicy.REQUIRE_PURE_TARGET && !tree.isTargetPure())
                throw new ContaminatedTargetException(tree.targetId(), tree.contaminationSources(tree.targetId()));
            registry.store(tree);
        } catch (ProvenanceBuildException e) {
            throw reject(e);
        }
        state = BuildState.VALID;
        listener.onBuildValidated(targetResult(), tree.size(), tree.isTargetPure());
        return tree;
    }

    private ProvenanceBuildException reject(ProvenanceBuildException e) {
        state = BuildState.REJECTED;
        error = e;
        listener.onBuildRejected(targetResult(), e);
        return e;
    }

    private void checkBuilding() {
        if (state != BuildState.BUILDING)
            throw new IllegalStateException("Build of \"" + targetResult() + "\" is " + state);
    }
}
