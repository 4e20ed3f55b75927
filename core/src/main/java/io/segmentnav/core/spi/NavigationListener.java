package io.segmentnav.core.spi;

import java.util.List;

/**
 * SPI interface for observability hooks on a {@code SegmentCursor}.
 *
 * <p>
 * Callers bridge these events to metrics, tracing or audit logs. The core has no telemetry
 * dependencies; this is a pure Java interface.
 *
 * <p>
 * Implementations MUST be non-blocking. Exceptions thrown by listeners are caught by the cursor
 * and logged. They do NOT affect navigation.
 */
public interface NavigationListener {

    /** Listener that ignores every event. */
    NavigationListener NOOP = new NavigationListener() {
        @Override
        public void onTokenMatched(TokenMatchedEvent event) {}

        @Override
        public void onTokenRejected(TokenRejectedEvent event) {}
    };

    /**
     * Called when an input segment was placed in the schema tree.
     *
     * @param event contains schemaKey, segment index, wireName, matched node and the path opened
     */
    void onTokenMatched(TokenMatchedEvent event);

    /**
     * Called when no reachable token node matches an input segment.
     *
     * @param event contains schemaKey, segment index, wireName and the cursor position
     */
    void onTokenRejected(TokenRejectedEvent event);

    // --- Event records ---

    /** Event emitted when a segment is matched. */
    record TokenMatchedEvent(
            String schemaKey, int segmentIndex, String wireName, String nodeName, List<String> openedPath) {}

    /** Event emitted when a segment is unexpected at the cursor position. */
    record TokenRejectedEvent(String schemaKey, int segmentIndex, String wireName, String positionName) {}
}
