package io.segmentnav.core.model;

import io.segmentnav.core.error.StructuralException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A loaded schema: the root {@link SchemaNode} of one message format together with its identity
 * and a by-name index over every node.
 *
 * <p>
 * Immutable, thread-safe. Built once at schema-load time and shared for the life of the process.
 */
public final class SchemaTree {

    private final String id;
    private final String version;
    private final SchemaNode root;
    private final List<SchemaNode> descendants;
    private final Map<String, SchemaNode> nodesByName;

    /**
     * Indexes the tree under {@code root}.
     *
     * @param id      schema identifier (e.g. "invoic-d96a")
     * @param version schema version (semver string)
     * @param root    the root node; must have no parent
     * @throws StructuralException if {@code root} has a parent or two nodes share a name
     */
    public SchemaTree(String id, String version, SchemaNode root) {
        this.id = Objects.requireNonNull(id, "schema id must not be null");
        this.version = Objects.requireNonNull(version, "schema version must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        if (!root.isRoot()) {
            throw new StructuralException("Schema root must not have a parent", root.name());
        }
        this.descendants = Collections.unmodifiableList(preOrder(root));
        Map<String, SchemaNode> index = new LinkedHashMap<>();
        for (SchemaNode node : descendants) {
            if (index.putIfAbsent(node.name(), node) != null) {
                throw new StructuralException(
                        "Duplicate node name '" + node.name() + "' in schema '" + id + "'", node.name());
            }
        }
        this.nodesByName = Collections.unmodifiableMap(index);
    }

    public String id() {
        return id;
    }

    public String version() {
        return version;
    }

    public SchemaNode root() {
        return root;
    }

    /** Registry key of this schema: {@code id@version}. */
    public String key() {
        return id + "@" + version;
    }

    /**
     * Looks up a node by its unique name.
     *
     * @param name the node name (e.g. "S_NAD")
     * @return the node, or empty if no node has that name
     */
    public Optional<SchemaNode> node(String name) {
        return Optional.ofNullable(nodesByName.get(name));
    }

    /**
     * Every node of the tree, root first, in pre-order declaration order (unmodifiable).
     */
    public List<SchemaNode> descendants() {
        return descendants;
    }

    /** Number of nodes in the tree. */
    public int size() {
        return descendants.size();
    }

    /**
     * The first token node in declaration order, where a parse of this message format starts.
     *
     * @throws StructuralException if the tree contains no token node
     */
    public SchemaNode firstTokenNode() {
        return descendants.stream()
                .filter(n -> n.kind() == NodeKind.TOKEN)
                .findFirst()
                .orElseThrow(() -> new StructuralException("Schema '" + id + "' has no token nodes", root.name()));
    }

    @Override
    public String toString() {
        return "SchemaTree[" + key() + ", " + descendants.size() + " nodes]";
    }

    private static List<SchemaNode> preOrder(SchemaNode root) {
        List<SchemaNode> result = new ArrayList<>();
        Deque<SchemaNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SchemaNode current = stack.pop();
            result.add(current);
            List<SchemaNode> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }
}
