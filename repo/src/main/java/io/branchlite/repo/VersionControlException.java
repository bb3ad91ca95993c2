package io.branchlite.repo;

/**
 * Base type for branch, ref and commit errors. Messages start with a fixed phrase
 * callers can match on, optionally followed by {@code ": <name>"}.
 */
public class VersionControlException extends RuntimeException {

    public VersionControlException(String message) {
        super(message);
    }

    public VersionControlException(String message, Throwable cause) {
        super(message, cause);
    }

    static String withName(String phrase, String name) {
        return name == null ? phrase : phrase + ": " + name;
    }
}
