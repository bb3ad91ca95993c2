package io.branchlite.repo;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, content-addressed snapshot with parent links.
 * <p>
 * The hash covers {@code parents}, {@code message}, {@code author} and {@code state};
 * {@code timestamp} (epoch millis) is informational only.
 */
public record Commit(
        String hash,
        List<String> parents,
        String message,
        String author,
        long timestamp,
        DatabaseState state
) {
    public Commit {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(author, "author");
        parents = parents == null ? List.of() : List.copyOf(parents);
        state = state == null ? DatabaseState.empty() : state;
    }

    @JsonIgnore
    public boolean isRoot() { return parents.isEmpty(); }

    @JsonIgnore
    public boolean isMerge() { return parents.size() > 1; }

    /** First seven hex digits, for display. */
    public String shortHash() {
        return hash.length() <= 7 ? hash : hash.substring(0, 7);
    }
}
