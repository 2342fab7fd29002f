package com.firm.provenance;

import com.firm.provenance.api.BuildListener;
import com.firm.provenance.engine.ProvenanceTree;
import com.firm.provenance.registry.DerivationRegistry;
import com.firm.provenance.registry.PurityPolicy;
import com.firm.provenance.util.LoggingBuildListener;

/**
 * FirmProvenance -- derivation provenance graphs for φ-derived constants.
 *
 * <h2>Model</h2>
 * <p>
 * Every computed result is a node in a directed acyclic graph whose edges are
 * explicit dependencies:
 * <ul>
 * <li><b>Axioms</b> are the only nodes allowed to stand without
 * dependencies.</li>
 * <li><b>Empirical inputs</b> are declared on the node that consumes them and
 * taint every node downstream, so a contaminated result can never pass as
 * axiom-pure.</li>
 * <li><b>Trees</b> are validated as a batch and frozen; a
 * {@link DerivationRegistry} stores them by target name.</li>
 * </ul>
 *
 * There are no global singletons: create a registry per application or test
 * and pass it where it is needed.
 */
public final class FirmProvenance {

    private FirmProvenance() {
        // Prevent instantiation of utility class
    }

    /** A registry that accepts contaminated targets and reports nothing. */
    public static DerivationRegistry registry() {
        return new DerivationRegistry();
    }

    /** A registry that logs every build event through Log4j 2. */
    public static DerivationRegistry loggingRegistry(PurityPolicy policy) {
        return new DerivationRegistry(new LoggingBuildListener(), policy);
    }

    public static DerivationRegistry registry(BuildListener listener, PurityPolicy policy) {
        return new DerivationRegistry(listener, policy);
    }

    /** Standalone tree builder, for derivations that are not registered anywhere. */
    public static ProvenanceTree.Builder tree(String targetResult) {
        return ProvenanceTree.builder(targetResult);
    }
}
