package io.segmentnav.core.engine;

import io.segmentnav.core.error.StructuralException;
import io.segmentnav.core.model.SchemaNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Adjacency policy of the schema walk: which nodes are explored next from a given node, in
 * priority order. The policy depends only on the node's kind:
 *
 * <ul>
 * <li>{@code TOKEN}: the parent</li>
 * <li>{@code GROUP}: the unexplored children, then the first child (a group repeats), then the
 * parent</li>
 * <li>{@code CONTAINER}: the unexplored children, or all children when none are left</li>
 * <li>{@code UNIT}: as {@code CONTAINER}, then the parent</li>
 * <li>{@code WILDCARD}: all children, then the parent</li>
 * </ul>
 *
 * <p>
 * "Unexplored" is decided by {@link AncestorChains#childrenAfterExclusion}. The order of the
 * returned list is the match priority, so it must not change. A missing parent (the root) or
 * missing first child contributes nothing.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class NeighbourRule {

    private NeighbourRule() {}

    /**
     * Computes the neighbours of {@code node}.
     *
     * @param node  the node being expanded
     * @param chain ancestor chain of the node the walk started from
     * @return a fresh list of neighbours in exploration order
     * @throws StructuralException if {@code chain} is inconsistent with the tree
     */
    public static List<SchemaNode> neighbours(SchemaNode node, List<SchemaNode> chain) {
        List<SchemaNode> result = new ArrayList<>();
        switch (node.kind()) {
            case TOKEN -> addIfPresent(result, node.parent());
            case GROUP -> {
                result.addAll(AncestorChains.childrenAfterExclusion(node, chain));
                addIfPresent(result, node.firstChild());
                addIfPresent(result, node.parent());
            }
            case CONTAINER -> {
                result.addAll(AncestorChains.childrenAfterExclusion(node, chain));
                if (result.isEmpty()) {
                    result.addAll(node.children());
                }
            }
            case UNIT -> {
                result.addAll(AncestorChains.childrenAfterExclusion(node, chain));
                if (result.isEmpty()) {
                    result.addAll(node.children());
                }
                addIfPresent(result, node.parent());
            }
            case WILDCARD -> {
                result.addAll(node.children());
                addIfPresent(result, node.parent());
            }
            default -> throw new StructuralException("Unsupported node kind: " + node.kind(), node.name());
        }
        return result;
    }

    private static void addIfPresent(List<SchemaNode> result, SchemaNode node) {
        if (node != null) {
            result.add(node);
        }
    }
}
