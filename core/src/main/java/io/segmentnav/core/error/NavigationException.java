package io.segmentnav.core.error;

/**
 * Abstract base for all segment-navigator exceptions. Never thrown directly; use
 * {@link StructuralException} or {@link SchemaLoadException}.
 */
public abstract class NavigationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        NAVIGATION
    }

    private final String nodeName;
    private final Phase phase;

    protected NavigationException(String message, String nodeName, Phase phase) {
        super(message);
        this.nodeName = nodeName;
        this.phase = phase;
    }

    protected NavigationException(String message, Throwable cause, String nodeName, Phase phase) {
        super(message, cause);
        this.nodeName = nodeName;
        this.phase = phase;
    }

    /** The schema node involved in the error, or {@code null} if not tied to a single node. */
    public String nodeName() {
        return nodeName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
