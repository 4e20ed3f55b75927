package io.segmentnav.core.engine;

import io.segmentnav.core.model.MatchPath;
import io.segmentnav.core.model.SchemaNode;
import io.segmentnav.core.model.TokenIdentity;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Entry point for parser drivers: the four navigation operations over a shared, read-only schema
 * tree, plus {@link #findNext} which chains enumeration and matching.
 *
 * <p>
 * Thread-safe and stateless: every call owns its own walk state, so concurrent parses may share
 * one tree.
 */
public final class SchemaNavigator {

    private SchemaNavigator() {}

    /** @see AncestorChains#ancestorChain(SchemaNode) */
    public static List<SchemaNode> ancestorChain(SchemaNode node) {
        return AncestorChains.ancestorChain(node);
    }

    /**
     * Lazily enumerates the token nodes reachable from {@code startNode} (see
     * {@link TokenNodeIterator}).
     *
     * @param startNode where the walk begins, normally the last matched token node
     * @return a sequential, ordered stream; each token node appears at most once
     */
    public static Stream<SchemaNode> tokenNodes(SchemaNode startNode) {
        Iterator<SchemaNode> iterator = new TokenNodeIterator(startNode);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(
                        iterator, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT),
                false);
    }

    /** @see IdentityMatcher#matches(SchemaNode, TokenIdentity) */
    public static boolean matches(SchemaNode tokenNode, TokenIdentity identity) {
        return IdentityMatcher.matches(tokenNode, identity);
    }

    /** @see AnchorResolver#resolve(SchemaNode, SchemaNode) */
    public static MatchPath resolveAnchor(SchemaNode newTokenNode, SchemaNode previousTokenNode) {
        return AnchorResolver.resolve(newTokenNode, previousTokenNode);
    }

    /**
     * Finds the first token node reachable from {@code startNode} that {@code identity} matches.
     * The walk stops at the first match.
     *
     * @return the matching node, or empty if the segment is unexpected at this position
     */
    public static Optional<SchemaNode> findNext(SchemaNode startNode, TokenIdentity identity) {
        return tokenNodes(startNode).filter(n -> IdentityMatcher.matches(n, identity)).findFirst();
    }
}
