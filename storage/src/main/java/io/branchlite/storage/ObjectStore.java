package io.branchlite.storage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Byte-level key/value storage used for commit blobs and ref pointers.
 * <p>
 * Keys are relative, '/'-separated paths such as {@code HEAD}, {@code refs/heads/main}
 * or {@code objects/commits/<hash>.json}. Segments must be non-empty; otherwise any
 * characters are allowed, and a key may be both a value and the prefix of other keys
 * ({@code refs/heads/a} next to {@code refs/heads/a/b}).
 * <p>
 * Semantics:
 *  - put() replaces the whole value atomically; readers see the old or the new bytes.
 *  - get() returns a private copy of the bytes, or empty when the key is absent.
 *  - Every stored value has a version: the SHA-256 of its bytes. Absent keys have none.
 *  - writeConditional() is a compare-and-set on that version.
 * <p>
 * No retry is performed. I/O failures surface as {@link StorageException}.
 */
public interface ObjectStore {

    Optional<byte[]> get(String key);

    void put(String key, byte[] data);

    /** @return true if the key existed. */
    boolean delete(String key);

    /** All keys starting with {@code prefix}, sorted. An empty prefix lists everything. */
    List<String> list(String prefix);

    default boolean exists(String key) {
        return get(key).isPresent();
    }

    /** Current version of the key, or empty when absent. */
    default Optional<String> version(String key) {
        return get(key).map(ObjectStore::versionOf);
    }

    /**
     * Write {@code data} only if the stored version still equals {@code expectedVersion}.
     *
     * @param expectedVersion version read earlier, or null to require that the key is absent
     * @return the new version
     * @throws VersionMismatchException if another writer got there first
     */
    String writeConditional(String key, byte[] data, String expectedVersion);

    default Optional<String> getString(String key) {
        return get(key).map(b -> new String(b, StandardCharsets.UTF_8));
    }

    default void putString(String key, String value) {
        put(key, value.getBytes(StandardCharsets.UTF_8));
    }

    static String versionOf(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Reject empty keys and keys with empty segments. */
    static String checkKey(String key) {
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
        for (String segment : key.split("/", -1)) {
            if (segment.isEmpty()) throw new IllegalArgumentException("Invalid storage key: " + key);
        }
        return key;
    }
}
