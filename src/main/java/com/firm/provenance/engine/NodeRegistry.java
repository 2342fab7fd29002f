package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.DuplicateNodeIdException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only keyed store of derivation nodes for one build.
 *
 * No ordering is imposed at insertion time: a node may cite a dependency that
 * is inserted later. Structural validity is only established when the owning
 * {@link ProvenanceTree.Builder} builds.
 *
 * Not thread-safe; a registry belongs to a single build.
 */
public final class NodeRegistry {
    private final Map<String, DerivationNode> nodes = new LinkedHashMap<>();

    /**
     * Stores a node.
     *
     * @throws DuplicateNodeIdException if a node with the same id is present.
     */
    public void insert(DerivationNode node) {
        Objects.requireNonNull(node, "node");
        if (nodes.putIfAbsent(node.id(), node) != null)
            throw new DuplicateNodeIdException(node.id());
    }

    public Optional<DerivationNode> get(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    /** Nodes in insertion order. */
    public Collection<DerivationNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Read-only id to node view, in insertion order. */
    public Map<String, DerivationNode> asMap() {
        return Collections.unmodifiableMap(nodes);
    }
}
