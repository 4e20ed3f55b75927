package io.segmentnav.core.engine;

import io.segmentnav.core.error.StructuralException;
import io.segmentnav.core.model.SchemaNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root-to-node paths through a schema tree and the exclusion rule built on them.
 *
 * <p>
 * An ancestor chain is the list of nodes from the root down to a node, inclusive. During one
 * enumeration the chain of the start node marks the branches that are already explored: when the
 * walk comes back to an ancestor on the chain, only the children at or after the one the chain
 * continues through are offered again.
 *
 * <p>
 * Chain membership is by node identity. Thread-safe and stateless.
 */
public final class AncestorChains {

    private AncestorChains() {}

    /**
     * Builds the chain from the root down to {@code node}, inclusive.
     *
     * @param node any schema node
     * @return a fresh, mutable list: root first, {@code node} last
     * @throws StructuralException if the rebuilt chain does not end in {@code node}'s parent
     */
    public static List<SchemaNode> ancestorChain(SchemaNode node) {
        List<SchemaNode> chain = new ArrayList<>();
        for (SchemaNode p = node.parent(); p != null; p = p.parent()) {
            chain.add(p);
        }
        Collections.reverse(chain);
        if (!chain.isEmpty() && chain.get(chain.size() - 1) != node.parent()) {
            throw new StructuralException("Incorrect parent collection for node " + node.name(), node.name());
        }
        chain.add(node);
        return chain;
    }

    /**
     * Parents of {@code node}, nearest first, excluding the node itself. The root is last.
     */
    static List<SchemaNode> parentsNearestFirst(SchemaNode node) {
        List<SchemaNode> parents = new ArrayList<>();
        for (SchemaNode p = node.parent(); p != null; p = p.parent()) {
            parents.add(p);
        }
        return parents;
    }

    /**
     * Finds where {@code chain} continues below {@code node}.
     *
     * @return index within {@code node.children()} of the chain element that follows {@code node}
     * @throws StructuralException if {@code node} is not on the chain, is the last element of it,
     *                             or the following element is not one of its children
     */
    public static int childIndexContinuingChain(SchemaNode node, List<SchemaNode> chain) {
        int index = indexOfIdentity(chain, node);
        if (index == -1) {
            throw new StructuralException("Child is not part of the parents list: " + node.name(), node.name());
        }
        if (index + 1 == chain.size()) {
            throw new StructuralException(
                    "Child is in the last position in the parents list: " + node.name(), node.name());
        }
        SchemaNode next = chain.get(index + 1);
        int childIndex = indexOfIdentity(node.children(), next);
        if (childIndex == -1) {
            throw new StructuralException(
                    "Parents list continues from " + node.name() + " into " + next.name() + ", which is not its child",
                    next.name());
        }
        return childIndex;
    }

    /**
     * Children of {@code node} still worth exploring given the explored {@code chain}.
     *
     * @return the children at or after the one {@code chain} continues through when {@code node}
     *         is on the chain; an empty list otherwise
     */
    public static List<SchemaNode> childrenAfterExclusion(SchemaNode node, List<SchemaNode> chain) {
        if (indexOfIdentity(chain, node) == -1) {
            return List.of();
        }
        int from = childIndexContinuingChain(node, chain);
        return node.children().subList(from, node.children().size());
    }

    static int indexOfIdentity(List<SchemaNode> nodes, SchemaNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
