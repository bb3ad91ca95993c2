package io.branchlite.repo;

import java.util.List;
import java.util.Objects;

public record CommitOptions(String message, String author, List<String> parents) {
    public CommitOptions {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(author, "author");
        parents = parents == null ? List.of() : List.copyOf(parents);
    }

    public static CommitOptions root(String message, String author) {
        return new CommitOptions(message, author, List.of());
    }
}
