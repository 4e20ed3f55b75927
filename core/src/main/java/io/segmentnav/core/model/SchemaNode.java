package io.segmentnav.core.model;

import io.segmentnav.core.error.StructuralException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A node of a schema tree: the static template describing how segments may nest inside a message.
 *
 * <p>
 * Immutable, thread-safe. A whole tree is created at once by {@link Builder#build()}, which wires
 * each node's {@link #parent()} back-reference. Nothing on a node changes afterwards, so a tree can
 * be shared by any number of concurrent parses. Per-parse state (visited sets, cursors) belongs to
 * the caller, never to the node.
 *
 * <p>
 * Nodes compare by identity. {@link #name()} is unique within one tree and is what the anchor
 * resolver compares; {@link #wireName()} is the segment tag matched against input and may repeat.
 */
public final class SchemaNode {

    private final String name;
    private final String wireName;
    private final NodeKind kind;
    private final boolean trigger;
    private final Set<String> firstQualifierValues;
    private final Set<String> secondQualifierValues;
    private final SchemaNode parent;
    private final List<SchemaNode> children;

    private SchemaNode(Builder builder, SchemaNode parent) {
        this.name = builder.name;
        this.wireName = builder.wireName != null ? builder.wireName : defaultWireName(builder.name);
        this.kind = builder.kind;
        this.trigger = builder.trigger;
        this.firstQualifierValues = Collections.unmodifiableSet(new LinkedHashSet<>(builder.firstQualifierValues));
        this.secondQualifierValues = Collections.unmodifiableSet(new LinkedHashSet<>(builder.secondQualifierValues));
        this.parent = parent;
        List<SchemaNode> built = new ArrayList<>(builder.children.size());
        for (Builder child : builder.children) {
            built.add(new SchemaNode(child, this));
        }
        this.children = Collections.unmodifiableList(built);
    }

    /** Unique identifier of this node within its tree (e.g. {@code G_NAD}). */
    public String name() {
        return name;
    }

    /** The segment tag matched against input tokens (e.g. {@code NAD}). */
    public String wireName() {
        return wireName;
    }

    public NodeKind kind() {
        return kind;
    }

    /** {@code true} if matching this node opens a new instance of its enclosing group. */
    public boolean isTrigger() {
        return trigger;
    }

    /** Accepted values of the segment's first qualifying element; empty when unconstrained. */
    public Set<String> firstQualifierValues() {
        return firstQualifierValues;
    }

    /** Accepted values of the segment's second qualifying element; empty when unconstrained. */
    public Set<String> secondQualifierValues() {
        return secondQualifierValues;
    }

    /**
     * The enclosing node. A back-reference only; the parent does not own this node through it.
     *
     * @return the parent, or {@code null} for the root
     */
    public SchemaNode parent() {
        return parent;
    }

    /** Children in declaration order (unmodifiable). Declaration order is significant. */
    public List<SchemaNode> children() {
        return children;
    }

    /**
     * The first declared child.
     *
     * @return the first child, or {@code null} if this node has none
     */
    public SchemaNode firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Number of parent links between this node and the root (the root has depth 0). */
    public int depth() {
        int depth = 0;
        for (SchemaNode p = parent; p != null; p = p.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return "SchemaNode[" + name + "]";
    }

    /**
     * The part of a node name after the kind prefix, e.g. {@code NAD} for {@code S_NAD}. Names
     * without a prefix are returned unchanged.
     */
    static String defaultWireName(String name) {
        int separator = name.indexOf('_');
        return separator > 0 && separator < name.length() - 1 ? name.substring(separator + 1) : name;
    }

    // ── Factory methods ──

    /**
     * Starts a node definition with an explicit kind.
     *
     * @param name unique node name
     * @param kind structural kind
     * @return a fresh builder
     */
    public static Builder builder(String name, NodeKind kind) {
        return new Builder(name, kind);
    }

    /**
     * Starts a node definition whose kind is inferred from the name prefix ({@code S_}, {@code G_},
     * {@code M_}, {@code U_}, {@code A_}).
     *
     * @throws StructuralException if the name carries no supported prefix
     */
    public static Builder builder(String name) {
        return new Builder(name, NodeKind.fromNodeName(name));
    }

    /**
     * Mutable definition of a node and its subtree. Only {@link #build()} on the root builder
     * produces nodes. A builder has at most one parent builder, and adding one of its own ancestors
     * as a child is rejected, so every definition describes a tree.
     */
    public static final class Builder {

        private final String name;
        private final NodeKind kind;
        private String wireName;
        private boolean trigger;
        private final Set<String> firstQualifierValues = new LinkedHashSet<>();
        private final Set<String> secondQualifierValues = new LinkedHashSet<>();
        private final List<Builder> children = new ArrayList<>();
        private Builder parent;

        Builder(String name, NodeKind kind) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        /** Overrides the segment tag; defaults to the name without its kind prefix. */
        public Builder wireName(String wireName) {
            this.wireName = wireName;
            return this;
        }

        public Builder trigger(boolean trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder firstQualifiers(String... values) {
            return firstQualifiers(List.of(values));
        }

        public Builder firstQualifiers(Iterable<String> values) {
            values.forEach(firstQualifierValues::add);
            return this;
        }

        public Builder secondQualifiers(String... values) {
            return secondQualifiers(List.of(values));
        }

        public Builder secondQualifiers(Iterable<String> values) {
            values.forEach(secondQualifierValues::add);
            return this;
        }

        /**
         * Appends a child; children keep the order in which they are added.
         *
         * @throws StructuralException if {@code child} already has a parent or is this builder or
         *                             one of its ancestors
         */
        public Builder child(Builder child) {
            Objects.requireNonNull(child, "child must not be null");
            if (child.parent != null) {
                throw new StructuralException(
                        "Node " + child.name + " is already a child of " + child.parent.name, child.name);
            }
            for (Builder b = this; b != null; b = b.parent) {
                if (b == child) {
                    throw new StructuralException(
                            "Node " + child.name + " cannot be nested inside itself", child.name);
                }
            }
            child.parent = this;
            children.add(child);
            return this;
        }

        public Builder children(Builder... children) {
            for (Builder child : children) {
                child(child);
            }
            return this;
        }

        /**
         * Builds the subtree rooted at this definition. The returned node is a root: its parent is
         * {@code null}.
         */
        public SchemaNode build() {
            return new SchemaNode(this, null);
        }
    }
}
