package io.markuppolicy.core.error;

/**
 * Thrown when a policy overlay has invalid syntax, an unexpected structure, a
 * non-lowercase tag or attribute name, or a pattern that does not compile.
 */
public final class PolicyParseException extends PolicyLoadException {

    private static final long serialVersionUID = 1L;

    public PolicyParseException(String message, String source) {
        super(message, source);
    }

    public PolicyParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
