package com.firm.provenance.registry;

/**
 * How a registry treats targets whose derivation consumes empirical inputs.
 */
public enum PurityPolicy {
    /** Contamination is recorded and reported by audits, the tree is accepted. */
    ALLOW_EMPIRICAL,
    /** A contaminated target rejects the whole tree. */
    REQUIRE_PURE_TARGET
}
