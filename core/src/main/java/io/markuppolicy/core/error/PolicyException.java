package io.markuppolicy.core.error;

/**
 * Abstract base for all markup-policy exceptions. Never thrown directly; use
 * the concrete subclasses under {@link PolicyLoadException}.
 *
 * <p>
 * The decision functions themselves never throw; these exceptions only arise
 * while building or loading policy tables.
 */
public abstract class PolicyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected PolicyException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected PolicyException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
