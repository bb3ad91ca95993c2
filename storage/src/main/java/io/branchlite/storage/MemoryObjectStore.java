package io.branchlite.storage;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed store for tests and embedded use.
 * <p>
 * Thread-safety: all operations are atomic per key; writeConditional is linearizable
 * through {@link ConcurrentHashMap#compute}.
 */
public final class MemoryObjectStore implements ObjectStore {
    private final ConcurrentHashMap<String, byte[]> data = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] v = data.get(ObjectStore.checkKey(key));
        return v == null ? Optional.empty() : Optional.of(v.clone());
    }

    @Override
    public void put(String key, byte[] value) {
        Objects.requireNonNull(value, "value");
        data.put(ObjectStore.checkKey(key), value.clone());
    }

    @Override
    public boolean delete(String key) {
        return data.remove(ObjectStore.checkKey(key)) != null;
    }

    @Override
    public List<String> list(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return data.keySet().stream().filter(k -> k.startsWith(prefix)).sorted().toList();
    }

    @Override
    public boolean exists(String key) {
        return data.containsKey(ObjectStore.checkKey(key));
    }

    @Override
    public String writeConditional(String key, byte[] value, String expectedVersion) {
        Objects.requireNonNull(value, "value");
        byte[] copy = value.clone();
        data.compute(ObjectStore.checkKey(key), (k, current) -> {
            String actual = current == null ? null : ObjectStore.versionOf(current);
            if (!Objects.equals(actual, expectedVersion)) {
                throw new VersionMismatchException(k, expectedVersion, actual);
            }
            return copy;
        });
        return ObjectStore.versionOf(copy);
    }
}
