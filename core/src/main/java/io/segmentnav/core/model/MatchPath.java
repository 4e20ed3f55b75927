package io.segmentnav.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Where a newly matched segment attaches in the output document: the container nodes to open,
 * outermost first, followed by the matched token node itself.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param nodes the path, outer to inner; never empty, last element is a token node
 */
public record MatchPath(List<SchemaNode> nodes) {

    /** Canonical constructor: copies the list and requires a token node at the end. */
    public MatchPath {
        Objects.requireNonNull(nodes, "nodes must not be null");
        nodes = List.copyOf(nodes);
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("match path must not be empty");
        }
        if (nodes.get(nodes.size() - 1).kind() != NodeKind.TOKEN) {
            throw new IllegalArgumentException("match path must end with a token node");
        }
    }

    /** The matched token node (last element). */
    public SchemaNode token() {
        return nodes.get(nodes.size() - 1);
    }

    /** The container nodes to open before attaching the token, outermost first. */
    public List<SchemaNode> containers() {
        return nodes.subList(0, nodes.size() - 1);
    }

    /** Node names along the path, handy for logging and assertions. */
    public List<String> names() {
        return nodes.stream().map(SchemaNode::name).toList();
    }

    @Override
    public String toString() {
        return "MatchPath" + names();
    }
}
