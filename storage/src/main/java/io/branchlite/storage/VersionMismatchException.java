package io.branchlite.storage;

/**
 * A conditional write found a different version than the caller expected.
 */
public final class VersionMismatchException extends StorageException {
    private final String key;
    private final String expectedVersion;
    private final String actualVersion;

    public VersionMismatchException(String key, String expectedVersion, String actualVersion) {
        super("Version mismatch for " + key + ": expected " + describe(expectedVersion)
                + ", found " + describe(actualVersion));
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String key() { return key; }

    /** Null when the caller expected the key to be absent. */
    public String expectedVersion() { return expectedVersion; }

    /** Null when the key was absent. */
    public String actualVersion() { return actualVersion; }

    private static String describe(String version) {
        return version == null ? "<absent>" : version;
    }
}
