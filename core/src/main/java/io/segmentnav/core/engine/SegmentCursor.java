package io.segmentnav.core.engine;

import io.segmentnav.core.model.MatchPath;
import io.segmentnav.core.model.SchemaNode;
import io.segmentnav.core.model.SchemaTree;
import io.segmentnav.core.model.TokenIdentity;
import io.segmentnav.core.spi.NavigationListener;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives navigation for one parse: remembers the last matched token node and places each new
 * segment relative to it.
 *
 * <p>
 * For every segment the cursor enumerates the token nodes reachable from its position, takes the
 * first one the segment matches, and resolves the path of containers to open. The caller applies
 * that path to its output document. A segment that matches nothing leaves the cursor where it was
 * and is reported as empty; turning that into an "unexpected segment" error is up to the caller.
 *
 * <p>
 * Before the first match the walk starts at the schema's first token node, and the returned path
 * is the match's whole ancestor chain below the root.
 *
 * <p>
 * NOT thread-safe: create one cursor per parse. The {@link SchemaTree} it reads may be shared.
 */
public final class SegmentCursor {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentCursor.class);

    private final SchemaTree schema;
    private final NavigationListener listener;
    private SchemaNode position;
    private int segmentIndex;

    /**
     * Creates a cursor with no listener.
     *
     * @param schema the schema to navigate
     */
    public SegmentCursor(SchemaTree schema) {
        this(schema, NavigationListener.NOOP);
    }

    /**
     * Creates a cursor that reports every placement to {@code listener}.
     *
     * @param schema   the schema to navigate
     * @param listener receives matched/rejected events
     */
    public SegmentCursor(SchemaTree schema, NavigationListener listener) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Places the next input segment.
     *
     * @param identity the segment's tag and qualifier values
     * @return the containers to open followed by the matched token node, or empty if no reachable
     *         token node matches
     * @throws io.segmentnav.core.error.StructuralException if the schema tree is malformed
     */
    public Optional<MatchPath> advance(TokenIdentity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        int index = segmentIndex++;
        SchemaNode start = position != null ? position : schema.firstTokenNode();

        Optional<SchemaNode> found = SchemaNavigator.findNext(start, identity);
        if (found.isEmpty()) {
            LOG.debug(
                    "segment.rejected schema={} index={} wire_name={} position={}",
                    schema.key(),
                    index,
                    identity.wireName(),
                    start.name());
            notifyRejected(index, identity, start);
            return Optional.empty();
        }

        SchemaNode matched = found.get();
        MatchPath path = position != null ? AnchorResolver.resolve(matched, position) : initialPath(matched);
        position = matched;

        LOG.debug(
                "segment.matched schema={} index={} wire_name={} node={} path={}",
                schema.key(),
                index,
                identity.wireName(),
                matched.name(),
                path.names());
        notifyMatched(index, identity, path);
        return Optional.of(path);
    }

    /**
     * The last matched token node.
     *
     * @return the node, or empty before the first match
     */
    public Optional<SchemaNode> position() {
        return Optional.ofNullable(position);
    }

    /** Number of segments passed to {@link #advance}, matched or not. */
    public int segmentCount() {
        return segmentIndex;
    }

    public SchemaTree schema() {
        return schema;
    }

    /** Forgets the position so the next segment is placed as the first of a new message. */
    public void reset() {
        position = null;
        segmentIndex = 0;
    }

    private static MatchPath initialPath(SchemaNode matched) {
        List<SchemaNode> chain = AncestorChains.ancestorChain(matched);
        // The root is the message itself, already open.
        return new MatchPath(chain.size() > 1 ? chain.subList(1, chain.size()) : chain);
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they MUST NOT affect navigation.

    private void notifyMatched(int index, TokenIdentity identity, MatchPath path) {
        try {
            listener.onTokenMatched(new NavigationListener.TokenMatchedEvent(
                    schema.key(), index, identity.wireName(), path.token().name(), path.names()));
        } catch (Exception e) {
            LOG.warn("NavigationListener.onTokenMatched failed", e);
        }
    }

    private void notifyRejected(int index, TokenIdentity identity, SchemaNode start) {
        try {
            listener.onTokenRejected(new NavigationListener.TokenRejectedEvent(
                    schema.key(), index, identity.wireName(), start.name()));
        } catch (Exception e) {
            LOG.warn("NavigationListener.onTokenRejected failed", e);
        }
    }
}
