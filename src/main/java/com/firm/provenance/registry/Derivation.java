package com.firm.provenance.registry;

/**
 * A derivation module: contributes the nodes of one provenance tree.
 *
 * Implementations insert their axioms, intermediate steps and target into the
 * supplied build and may declare roots and the target. They must not call
 * {@link TreeBuild#finishBuild()}; the registry does.
 */
@FunctionalInterface
public interface Derivation {
    void define(TreeBuild build);
}
