package io.segmentnav.core.engine;

import io.segmentnav.core.error.StructuralException;
import io.segmentnav.core.model.MatchPath;
import io.segmentnav.core.model.NodeKind;
import io.segmentnav.core.model.SchemaNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes where a newly matched token attaches relative to the previously matched one.
 *
 * <p>
 * Both tokens' parents are listed nearest first. The pivot is the nearest parent of the new token
 * whose name also appears among the previous token's parents, i.e. their lowest common ancestor. The
 * parents of the new token below the pivot are the containers that have to be opened, outermost
 * first, and the new token closes the path.
 *
 * <p>
 * A trigger token whose parent is the pivot itself still opens that parent again: matching a
 * trigger always starts a new occurrence of its group.
 *
 * <p>
 * Pure function of the tree structure. Thread-safe and stateless.
 */
public final class AnchorResolver {

    private AnchorResolver() {}

    /**
     * Resolves the attachment path of {@code newTokenNode}.
     *
     * @param newTokenNode      the token node just matched
     * @param previousTokenNode the token node matched before it
     * @return the containers to open, outer to inner, followed by {@code newTokenNode}
     * @throws StructuralException if {@code newTokenNode} is not a token node or the two nodes have
     *                             no common ancestor
     */
    public static MatchPath resolve(SchemaNode newTokenNode, SchemaNode previousTokenNode) {
        if (newTokenNode.kind() != NodeKind.TOKEN) {
            throw new StructuralException("Not a segment " + newTokenNode.name(), newTokenNode.name());
        }

        List<SchemaNode> parents = AncestorChains.parentsNearestFirst(newTokenNode);
        Set<String> previousNames = new HashSet<>();
        for (SchemaNode p : AncestorChains.parentsNearestFirst(previousTokenNode)) {
            previousNames.add(p.name());
        }

        String pivotName = parents.stream()
                .map(SchemaNode::name)
                .filter(previousNames::contains)
                .findFirst()
                .orElseThrow(() -> new StructuralException(
                        "No common ancestor for " + newTokenNode.name() + " and " + previousTokenNode.name(),
                        newTokenNode.name()));

        List<SchemaNode> result = new ArrayList<>();
        for (SchemaNode parent : parents) {
            if (parent.name().equals(pivotName)) {
                break;
            }
            result.add(parent);
        }
        Collections.reverse(result);

        if (result.isEmpty() && newTokenNode.isTrigger()) {
            result.add(newTokenNode.parent());
        }
        result.add(newTokenNode);
        return new MatchPath(result);
    }
}
