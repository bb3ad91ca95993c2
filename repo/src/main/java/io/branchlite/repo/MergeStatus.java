package io.branchlite.repo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Progress of a branch merge, stored as {@code in_progress}, {@code conflicted} or {@code resolved}. */
public enum MergeStatus {
    IN_PROGRESS,
    CONFLICTED,
    RESOLVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MergeStatus parse(String value) {
        for (MergeStatus s : values()) {
            if (s.wireName().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown merge status: " + value);
    }
}
