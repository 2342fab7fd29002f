package com.firm.provenance.api;

/**
 * The closed set of step kinds a {@link DerivationNode} can have.
 *
 * Only {@link #AXIOM} nodes may stand without dependencies; every other kind
 * must cite at least one dependency.
 */
public enum DerivationKind {
    AXIOM("axiom"),
    DEFINITION("definition"),
    THEOREM("theorem"),
    LEMMA("lemma"),
    COROLLARY("corollary"),
    COMPUTATION("computation"),
    RECURSION("recursion"),
    FIXED_POINT("fixed_point"),
    EMERGENCE("emergence"),
    MATHEMATICAL_DERIVATION("mathematical_derivation"),
    PHYSICAL_DERIVATION("physical_derivation"),
    TARGET("target");

    private final String value;

    DerivationKind(String value) {
        this.value = value;
    }

    /** Lowercase wire name, e.g. {@code "fixed_point"}. */
    public String value() {
        return value;
    }

    public boolean isAxiom() {
        return this == AXIOM;
    }

    public static DerivationKind fromString(String text) {
        if (text != null) {
            for (DerivationKind k : DerivationKind.values()) {
                if (k.value.equalsIgnoreCase(text) || k.name().equalsIgnoreCase(text)) {
                    return k;
                }
            }
        }
        throw new IllegalArgumentException("Unknown DerivationKind: " + text);
    }
}
