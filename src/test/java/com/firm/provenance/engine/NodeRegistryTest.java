package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationKind;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.DuplicateNodeIdException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NodeRegistryTest {

    @Test
    public void testInsertAndGet() {
        NodeRegistry registry = new NodeRegistry();
        DerivationNode a = DerivationNode.axiom("A", "x");
        registry.insert(a);
        assertEquals(1, registry.size());
        assertTrue(registry.contains("A"));
        assertSame(a, registry.get("A").orElseThrow());
        assertTrue(registry.get("B").isEmpty());
    }

    @Test
    public void testForwardReferenceAllowed() {
        NodeRegistry registry = new NodeRegistry();
        registry.insert(new DerivationNode("B", DerivationKind.LEMMA, "y", List.of("A")));
        registry.insert(DerivationNode.axiom("A", "x"));
        assertEquals(List.of("B", "A"), List.copyOf(registry.asMap().keySet()));
    }

    @Test
    public void testDuplicateRejected() {
        NodeRegistry registry = new NodeRegistry();
        registry.insert(DerivationNode.axiom("A", "x"));
        try {
            registry.insert(DerivationNode.axiom("A", "other"));
            fail("Expected DuplicateNodeIdException");
        } catch (DuplicateNodeIdException e) {
            assertEquals("A", e.nodeId());
        }
        assertEquals("x", registry.get("A").orElseThrow().expression());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testViewIsReadOnly() {
        NodeRegistry registry = new NodeRegistry();
        registry.asMap().put("A", DerivationNode.axiom("A", "x"));
    }
}
