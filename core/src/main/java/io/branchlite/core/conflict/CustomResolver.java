package io.branchlite.core.conflict;

/**
 * User-supplied resolution function.
 * <p>
 * Implementations may leave {@link Resolution#strategy()} or {@link Resolution#conflict()}
 * null; {@link ConflictResolver} fills them with {@code "custom"} and the input conflict.
 */
@FunctionalInterface
public interface CustomResolver {
    Resolution resolve(ConflictInfo conflict);
}
