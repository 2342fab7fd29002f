package com.firm.provenance.engine;

import com.firm.provenance.api.DerivationNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Depth-first cycle detection over dependency edges.
 *
 * Uses an explicit stack instead of recursion, so arbitrarily deep
 * derivation chains cannot overflow the call stack. Nodes are coloured
 * unvisited / in-progress / done; an edge into an in-progress node closes a
 * cycle. O(V + E).
 *
 * Start nodes are visited in id order, so the reported cycle does not depend
 * on insertion order. Dependency ids that do not resolve are skipped here;
 * reporting them is the caller's job.
 */
public final class CycleDetector {
    private enum Color {
        IN_PROGRESS, DONE
    }

    private CycleDetector() {
        // Utility class
    }

    /**
     * Finds a cycle, if any.
     *
     * @param nodes id to node map.
     * @return The cycle as a closed path (first id repeated at the end) in
     *         derivation order: each id is a dependency of the next. Empty if
     *         the graph is acyclic.
     */
    public static Optional<List<String>> detectCycle(Map<String, DerivationNode> nodes) {
        Map<String, Color> colors = new HashMap<>(nodes.size() * 2);
        Deque<Frame> stack = new ArrayDeque<>();
        // ids currently in progress, outermost first
        List<String> path = new ArrayList<>();

        for (String start : new TreeSet<>(nodes.keySet())) {
            if (colors.containsKey(start))
                continue;
            colors.put(start, Color.IN_PROGRESS);
            path.add(start);
            stack.push(new Frame(nodes.get(start)));

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                List<String> deps = top.node.dependencies();
                if (top.next < deps.size()) {
                    String dep = deps.get(top.next++);
                    DerivationNode depNode = nodes.get(dep);
                    if (depNode == null)
                        continue;
                    Color c = colors.get(dep);
                    if (c == null) {
                        colors.put(dep, Color.IN_PROGRESS);
                        path.add(dep);
                        stack.push(new Frame(depNode));
                    } else if (c == Color.IN_PROGRESS) {
                        return Optional.of(closeCycle(path, dep));
                    }
                } else {
                    colors.put(top.node.id(), Color.DONE);
                    path.remove(path.size() - 1);
                    stack.pop();
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isAcyclic(Map<String, DerivationNode> nodes) {
        return detectCycle(nodes).isEmpty();
    }

    // path runs dependent -> dependency; the cycle is reported the other way round.
    private static List<String> closeCycle(List<String> path, String repeated) {
        int from = path.indexOf(repeated);
        List<String> cycle = new ArrayList<>(path.size() - from + 1);
        cycle.add(repeated);
        for (int i = path.size() - 1; i > from; i--)
            cycle.add(path.get(i));
        cycle.add(repeated);
        return cycle;
    }

    private static final class Frame {
        final DerivationNode node;
        int next;

        Frame(DerivationNode node) {
            this.node = node;
        }
    }
}
