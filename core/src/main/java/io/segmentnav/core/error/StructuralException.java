package io.segmentnav.core.error;

/**
 * Thrown when a schema tree is malformed or misused during navigation: a node missing from an
 * ancestor chain, a chain that contradicts the parent links, a non-token node treated as a token,
 * an unsupported node kind, or two nodes without a common ancestor.
 *
 * <p>
 * These are data-integrity errors. A malformed schema cannot recover, so callers should let them
 * propagate.
 */
public final class StructuralException extends NavigationException {

    private static final long serialVersionUID = 1L;

    public StructuralException(String message, String nodeName) {
        super(message, nodeName, Phase.NAVIGATION);
    }

    public StructuralException(String message, Throwable cause, String nodeName) {
        super(message, cause, nodeName, Phase.NAVIGATION);
    }
}
