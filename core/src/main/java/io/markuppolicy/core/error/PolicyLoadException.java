package io.markuppolicy.core.error;

/**
 * Thrown when a policy overlay cannot be read, e.g. the file is missing or
 * unreadable.
 */
public class PolicyLoadException extends PolicyException {

    private static final long serialVersionUID = 1L;

    public PolicyLoadException(String message, String source) {
        super(message, source);
    }

    public PolicyLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
