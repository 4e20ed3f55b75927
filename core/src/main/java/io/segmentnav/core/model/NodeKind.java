package io.segmentnav.core.model;

import io.segmentnav.core.error.StructuralException;

/**
 * Structural kind of a {@link SchemaNode}. The kind decides how navigation moves through the node
 * (see {@code NeighbourRule}).
 *
 * <p>
 * Each kind carries the one-letter prefix used by EDI schema class names, e.g. {@code S_NAD} is a
 * token and {@code G_NAD} the group it opens.
 */
public enum NodeKind {
    /** A concrete, matchable segment. */
    TOKEN("S"),
    /** A repeatable group, opened by its trigger token. */
    GROUP("G"),
    /** A strict composite, typically the message root. */
    CONTAINER("M"),
    /** A composite whose scope may be left once its children are exhausted. */
    UNIT("U"),
    /** Unconstrained: everything beneath and above is reachable. */
    WILDCARD("A");

    private final String prefix;

    NodeKind(String prefix) {
        this.prefix = prefix;
    }

    /** The one-letter name prefix for this kind. */
    public String prefix() {
        return prefix;
    }

    /**
     * Resolves a kind from its name prefix (case-insensitive).
     *
     * @param prefix the one-letter prefix, e.g. "S"
     * @return the matching kind
     * @throws StructuralException if the prefix is not supported
     */
    public static NodeKind fromPrefix(String prefix) {
        if (prefix != null) {
            for (NodeKind kind : values()) {
                if (kind.prefix.equalsIgnoreCase(prefix)) {
                    return kind;
                }
            }
        }
        throw new StructuralException("Unsupported node prefix: " + prefix, null);
    }

    /**
     * Resolves a kind from its full name ({@code group}) or its prefix ({@code G}),
     * case-insensitive.
     *
     * @throws StructuralException if the text names no supported kind
     */
    public static NodeKind parse(String text) {
        if (text != null) {
            for (NodeKind kind : values()) {
                if (kind.name().equalsIgnoreCase(text)) {
                    return kind;
                }
            }
        }
        return fromPrefix(text);
    }

    /**
     * Resolves a kind from a schema node name such as {@code G_NAD}: the text before the first
     * underscore is the prefix.
     *
     * @throws StructuralException if the name has no prefix or the prefix is not supported
     */
    public static NodeKind fromNodeName(String name) {
        int separator = name == null ? -1 : name.indexOf('_');
        if (separator <= 0) {
            throw new StructuralException("Node name has no kind prefix: " + name, name);
        }
        return fromPrefix(name.substring(0, separator));
    }
}
