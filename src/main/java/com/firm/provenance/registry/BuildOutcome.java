package com.firm.provenance.registry;

import com.firm.provenance.api.ProvenanceBuildException;
import com.firm.provenance.engine.ProvenanceTree;

import java.util.Optional;

/**
 * Result of one build submitted through
 * {@link DerivationRegistry#registerAll}: the stored tree or the reason it was
 * rejected.
 */
public record BuildOutcome(String targetResult, BuildState state, ProvenanceTree tree,
        ProvenanceBuildException error) {

    static BuildOutcome valid(ProvenanceTree tree) {
        return new BuildOutcome(tree.targetResult(), BuildState.VALID, tree, null);
    }

    static BuildOutcome rejected(String targetResult, ProvenanceBuildException error) {
        return new BuildOutcome(targetResult, BuildState.REJECTED, null, error);
    }

    public boolean isValid() {
        return state == BuildState.VALID;
    }

    public Optional<ProvenanceTree> treeIfValid() {
        return Optional.ofNullable(tree);
    }

    public Optional<ProvenanceBuildException> errorIfRejected() {
        return Optional.ofNullable(error);
    }
}
