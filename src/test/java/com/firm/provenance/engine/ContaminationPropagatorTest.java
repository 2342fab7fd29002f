package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationKind;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.testing.RandomDags;
import com.firm.provenance.testing.SampleDerivations;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class ContaminationPropagatorTest {

    private static ContaminationPropagator propagate(Collection<DerivationNode> nodes) {
        return new ContaminationPropagator(TopologicalOrder.builder().addNodes(nodes).build());
    }

    @Test
    public void testChainScenario() {
        ContaminationPropagator p = propagate(SampleDerivations.contaminatedChain());

        assertTrue(p.isPure("A"));
        assertTrue(p.isPure("B"));
        assertEquals(Set.of("measured_Om"), p.contaminationSources("C"));
        assertEquals(Set.of("measured_Om"), p.contaminationSources("D"));
        assertFalse(p.isPure("D"));
        assertEquals(Set.of("A"), p.axiomClosure("D"));
    }

    @Test
    public void testDiamondUnion() {
        // A feeds B (m1) and C (m2); D joins them.
        ContaminationPropagator p = propagate(List.of(
                DerivationNode.axiom("A", "a"),
                DerivationNode.builder("B", DerivationKind.LEMMA).dependsOn("A").empiricalInputs("m1").build(),
                DerivationNode.builder("C", DerivationKind.LEMMA).dependsOn("A").empiricalInputs("m2").build(),
                DerivationNode.builder("D", DerivationKind.TARGET).dependsOn("B", "C").build()));

        assertEquals(Set.of("m1", "m2"), p.contaminationSources("D"));
        assertEquals(Set.of("A"), p.axiomClosure("D"));
    }

    @Test
    public void testAxiomClosureCollectsAllReachableAxioms() {
        ContaminationPropagator p = propagate(List.of(
                DerivationNode.axiom("X", "x"),
                DerivationNode.axiom("Y", "y"),
                DerivationNode.axiom("Z", "unused"),
                DerivationNode.builder("P", DerivationKind.LEMMA).dependsOn("X").build(),
                DerivationNode.builder("Q", DerivationKind.THEOREM).dependsOn("P", "Y").build()));

        assertEquals(Set.of("X"), p.axiomClosure("P"));
        assertEquals(Set.of("X", "Y"), p.axiomClosure("Q"));
        assertEquals(Set.of("Z"), p.axiomClosure("Z"));
    }

    @Test
    public void testMemoisedEqualsNaive() {
        Random rnd = new Random(2024);
        for (int round = 0; round < 40; round++) {
            List<DerivationNode> nodes = RandomDags.generate(rnd, 5 + rnd.nextInt(30));
            Map<String, DerivationNode> byId = RandomDags.byId(nodes);
            ContaminationPropagator p = propagate(nodes);

            for (String id : byId.keySet()) {
                Set<String> naive = RandomDags.naiveSources(byId, id);
                assertEquals("sources of " + id, naive, p.contaminationSources(id));
                assertEquals(naive.isEmpty(), p.isPure(id));
            }
        }
    }

    @Test
    public void testResultIndependentOfInsertionOrder() {
        Random rnd = new Random(99);
        List<DerivationNode> nodes = RandomDags.generate(rnd, 40);
        List<DerivationNode> shuffled = new ArrayList<>(nodes);
        Collections.shuffle(shuffled, new Random(5));

        ContaminationPropagator a = propagate(nodes);
        ContaminationPropagator b = propagate(shuffled);
        for (DerivationNode n : nodes) {
            assertEquals(a.contaminationSources(n.id()), b.contaminationSources(n.id()));
            assertEquals(a.axiomClosure(n.id()), b.axiomClosure(n.id()));
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testResultsAreReadOnly() {
        ContaminationPropagator p = propagate(SampleDerivations.contaminatedChain());
        p.contaminationSources("D").add("sneaky");
    }
}
