package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationKind;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.ErrorBounds;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.junit.Assert.*;

public class ErrorPropagatorTest {
    private static final double EPS = 1e-15;

    private static ErrorPropagator propagate(Collection<DerivationNode> nodes) {
        return new ErrorPropagator(TopologicalOrder.builder().addNodes(nodes).build());
    }

    private static DerivationNode.Builder step(String id, double value, String... deps) {
        return DerivationNode.builder(id, DerivationKind.COMPUTATION).numericValue(value).dependsOn(deps);
    }

    @Test
    public void testDiamondRootSumSquare() {
        // A feeds B (inherits) and C (declared); D joins them.
        ErrorPropagator p = propagate(List.of(
                DerivationNode.builder("A", DerivationKind.AXIOM).numericValue(2.0).relativeError(0.01).build(),
                step("B", 3.0, "A").build(),
                step("C", 4.0, "A").relativeError(0.02).build(),
                DerivationNode.builder("D", DerivationKind.TARGET).numericValue(-10.0).dependsOn("B", "C").build()));

        assertEquals(0.02, p.errorBounds("A").absoluteError(), EPS);
        assertEquals(0.01, p.errorBounds("B").relativeError(), EPS);
        assertEquals(0.03, p.errorBounds("B").absoluteError(), EPS);
        assertEquals(0.08, p.errorBounds("C").absoluteError(), EPS);

        double rel = Math.sqrt(0.01 * 0.01 + 0.02 * 0.02);
        assertEquals(rel, p.errorBounds("D").relativeError(), EPS);
        assertEquals(10.0 * rel, p.errorBounds("D").absoluteError(), 1e-14);
    }

    @Test
    public void testDeclaredBoundsWin() {
        ErrorBounds declared = new ErrorBounds(0.5, 7.0);
        ErrorPropagator p = propagate(List.of(
                DerivationNode.builder("A", DerivationKind.AXIOM).numericValue(1.0).relativeError(0.1).build(),
                step("B", 3.0, "A").errorBounds(declared).build()));
        assertSame(declared, p.errorBounds("B"));
    }

    @Test
    public void testUndeclaredNumericDependencyUsesFloor() {
        ErrorPropagator p = propagate(List.of(
                DerivationNode.builder("X", DerivationKind.AXIOM).numericValue(1.0).build(),
                step("Y", 5.0, "X").build(),
                step("Z", 2.0, "X", "Y").build()));

        assertEquals(ErrorBounds.NONE, p.errorBounds("X"));
        assertEquals(ErrorPropagator.MIN_RELATIVE_ERROR, p.errorBounds("Y").relativeError(), 0.0);
        assertEquals(5.0 * ErrorPropagator.MIN_RELATIVE_ERROR, p.errorBounds("Y").absoluteError(), 1e-25);
        assertEquals(Math.sqrt(2) * ErrorPropagator.MIN_RELATIVE_ERROR, p.errorBounds("Z").relativeError(), 1e-25);
    }

    @Test
    public void testSymbolicStepsCarryNoError() {
        ErrorPropagator p = propagate(List.of(
                DerivationNode.axiom("S", "symmetry"),
                new DerivationNode("T", DerivationKind.LEMMA, "group", List.of("S"))));
        assertEquals(ErrorBounds.NONE, p.errorBounds("T"));
    }

    @Test
    public void testErrorCarriesAlongChain() {
        List<DerivationNode> nodes = new ArrayList<>();
        nodes.add(DerivationNode.builder("n0", DerivationKind.AXIOM).numericValue(1.0).relativeError(1e-6).build());
        for (int i = 1; i < 5; i++)
            nodes.add(step("n" + i, i, "n" + (i - 1)).build());
        ErrorPropagator p = propagate(nodes);

        for (int i = 1; i < 5; i++)
            assertEquals(1e-6, p.errorBounds("n" + i).relativeError(), EPS);
        assertEquals(List.of("n0", "n1", "n2", "n3", "n4"), new ArrayList<>(p.all().keySet()));
    }

    @Test
    public void testOfRelativeWithoutValue() {
        assertEquals(new ErrorBounds(0.3, 0.0), ErrorBounds.ofRelative(0.3, null));
        assertEquals(new ErrorBounds(0.5, 2.0), ErrorBounds.ofRelative(0.5, -4.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeBoundsRejected() {
        new ErrorBounds(-0.1, 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNBoundsRejected() {
        new ErrorBounds(0.1, Double.NaN);
    }
}
