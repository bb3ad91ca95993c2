package io.branchlite.repo;

/**
 * Stored commit bytes do not hash to the key they are stored under, or cannot be parsed.
 */
public final class CorruptCommitException extends VersionControlException {
    private final String hash;

    public CorruptCommitException(String hash, String detail) {
        super("Corrupt commit " + hash + ": " + detail);
        this.hash = hash;
    }

    public CorruptCommitException(String hash, Throwable cause) {
        super("Corrupt commit " + hash + ": " + cause.getMessage(), cause);
        this.hash = hash;
    }

    public String hash() { return hash; }
}
