package com.firm.provenance.api;

import com.firm.provenance.util.Digests;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A single step in a derivation: an axiom, a lemma, a computation, the final
 * target, and so on.
 *
 * Nodes are plain immutable values. They carry their dependency ids but never
 * any derived state; purity and axiom closure are computed by the owning
 * {@code ProvenanceTree} when it is built.
 *
 * Structural rules (checked at build time, not here):
 * - dependencies is empty if and only if kind is AXIOM.
 * - every dependency id must resolve inside the same tree.
 *
 * @param id              Unique id within a tree.
 * @param kind            Step kind.
 * @param expression      Free-text mathematical statement, opaque to the graph.
 * @param numericValue    Computed value, or null when the step is symbolic.
 * @param dependencies    Ordered ids of the steps this one rests on.
 * @param justification   Descriptive reasoning, not validated.
 * @param assumptions     Descriptive assumptions, not validated.
 * @param empiricalInputs Names of measured quantities consumed directly by
 *                        this step. Empty for pure derivations.
 * @param errorBounds     Declared numerical error, or null to have it
 *                        propagated from the dependencies.
 */
public record DerivationNode(
        String id,
        DerivationKind kind,
        String expression,
        Double numericValue,
        List<String> dependencies,
        String justification,
        List<String> assumptions,
        List<String> empiricalInputs,
        ErrorBounds errorBounds) {

    public DerivationNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (id.isBlank())
            throw new IllegalArgumentException("Node id must not be blank");
        expression = expression == null ? "" : expression;
        justification = justification == null ? "" : justification;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        empiricalInputs = empiricalInputs == null ? List.of() : List.copyOf(empiricalInputs);
    }

    public DerivationNode(String id, DerivationKind kind, String expression, Double numericValue,
            List<String> dependencies, String justification, List<String> assumptions, List<String> empiricalInputs) {
        this(id, kind, expression, numericValue, dependencies, justification, assumptions, empiricalInputs, null);
    }

    public DerivationNode(String id, DerivationKind kind, String expression, List<String> dependencies) {
        this(id, kind, expression, null, dependencies, "", List.of(), List.of(), null);
    }

    /** Shorthand for a foundational axiom. */
    public static DerivationNode axiom(String id, String expression) {
        return new DerivationNode(id, DerivationKind.AXIOM, expression, List.of());
    }

    public static Builder builder(String id, DerivationKind kind) {
        return new Builder(id, kind);
    }

    public Builder toBuilder() {
        return new Builder(id, kind)
                .expression(expression)
                .numericValue(numericValue)
                .dependsOn(dependencies)
                .justification(justification)
                .assumptions(assumptions)
                .empiricalInputs(empiricalInputs)
                .errorBounds(errorBounds);
    }

    public boolean hasNumericValue() {
        return numericValue != null;
    }

    public boolean hasDeclaredErrorBounds() {
        return errorBounds != null;
    }

    /** True when this step itself consumes no measured quantity. */
    public boolean isDirectlyPure() {
        return empiricalInputs.isEmpty();
    }

    /**
     * Content hash: the first 16 hex characters of
     * SHA-256({@code id:expression:kind}). Recomputed on every call, so it only
     * detects tampering when compared with a fingerprint recorded earlier, see
     * {@link #verifyFingerprint(String)}.
     */
    public String fingerprint() {
        String content = id + ":" + expression + ":" + kind.value();
        return Digests.sha256Hex(content).substring(0, 16);
    }

    /** True when {@code recorded} matches this node's current content hash. */
    public boolean verifyFingerprint(String recorded) {
        return fingerprint().equals(recorded);
    }

    /**
     * Fluent builder for nodes with many optional fields.
     *
     * Usage:
     * DerivationNode.builder("omega_m", DerivationKind.PHYSICAL_DERIVATION)
     * .expression("Ω_m = φ^-2.4")
     * .dependsOn("phi_def")
     * .empiricalInputs("measured_Om")
     * .build();
     */
    public static final class Builder {
        private final String id;
        private final DerivationKind kind;
        private String expression = "";
        private Double numericValue;
        private final List<String> dependencies = new ArrayList<>();
        private String justification = "";
        private final List<String> assumptions = new ArrayList<>();
        private final List<String> empiricalInputs = new ArrayList<>();
        private ErrorBounds errorBounds;
        private Double relativeError;

        private Builder(String id, DerivationKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        public Builder numericValue(Double numericValue) {
            this.numericValue = numericValue;
            return this;
        }

        public Builder dependsOn(String... ids) {
            return dependsOn(Arrays.asList(ids));
        }

        public Builder dependsOn(Collection<String> ids) {
            dependencies.addAll(ids);
            return this;
        }

        public Builder justification(String justification) {
            this.justification = justification;
            return this;
        }

        public Builder assumptions(String... assumptions) {
            return assumptions(Arrays.asList(assumptions));
        }

        public Builder assumptions(Collection<String> assumptions) {
            this.assumptions.addAll(assumptions);
            return this;
        }

        public Builder empiricalInputs(String... names) {
            return empiricalInputs(Arrays.asList(names));
        }

        public Builder empiricalInputs(Collection<String> names) {
            empiricalInputs.addAll(names);
            return this;
        }

        public Builder errorBounds(ErrorBounds errorBounds) {
            this.relativeError = null;
            this.errorBounds = errorBounds;
            return this;
        }

        /** Declares a relative error; the absolute error follows from the value at build time. */
        public Builder relativeError(double relativeError) {
            this.errorBounds = null;
            this.relativeError = relativeError;
            return this;
        }

        public DerivationNode build() {
            ErrorBounds bounds = relativeError == null ? errorBounds
                    : ErrorBounds.ofRelative(relativeError, numericValue);
            return new DerivationNode(id, kind, expression, numericValue, dependencies, justification,
                    assumptions, empiricalInputs, bounds);
        }
    }
}
