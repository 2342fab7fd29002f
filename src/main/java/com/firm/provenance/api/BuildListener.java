package com.firm.provenance.api;

/**
 * Observability hook for derivation tree builds.
 *
 * Implementations are registered with the DerivationRegistry and receive
 * callbacks as each build progresses. The graph algorithms themselves never
 * log or print; anything a caller wants to see goes through here.
 *
 * Builds for different targets may run on different threads, so
 * implementations shared between registries or builds must be thread-safe.
 */
public interface BuildListener {

    /** Listener that ignores every event. */
    BuildListener NO_OP = new BuildListener() {
    };

    /**
     * Called when a build is opened.
     *
     * @param targetResult Name of the claim being derived.
     */
    default void onBuildStarted(String targetResult) {
    }

    /**
     * Called after a node has been accepted into a build.
     *
     * @param targetResult Name of the build.
     * @param node         The inserted node.
     */
    default void onNodeInserted(String targetResult, DerivationNode node) {
    }

    /**
     * Called once the tree passed validation and was stored.
     *
     * @param targetResult Name of the build.
     * @param nodeCount    Number of nodes in the frozen tree.
     * @param targetPure   Whether the target consumes no empirical input.
     */
    default void onBuildValidated(String targetResult, int nodeCount, boolean targetPure) {
    }

    /**
     * Called when a build is rejected. The partial tree has been discarded.
     *
     * @param targetResult Name of the build.
     * @param error        The validation failure.
     */
    default void onBuildRejected(String targetResult, ProvenanceBuildException error) {
    }
}
