package io.branchlite.core.conflict;

import java.util.Objects;

/**
 * A policy mapping a conflict to a resolved value or a manual-resolution flag.
 * <p>
 * Either one of the built-in tokens or a {@link Custom} wrapper around a function.
 * Composite strategies from {@link Strategies} are {@code Custom} instances.
 */
public sealed interface ResolutionStrategy permits ResolutionStrategy.Builtin, ResolutionStrategy.Custom {

    ResolutionStrategy OURS = Builtin.OURS;
    ResolutionStrategy THEIRS = Builtin.THEIRS;
    ResolutionStrategy LATEST = Builtin.LATEST;
    ResolutionStrategy MANUAL = Builtin.MANUAL;

    /** Label reported in {@link Resolution#strategy()} by default. */
    String label();

    enum Builtin implements ResolutionStrategy {
        OURS("ours"), THEIRS("theirs"), LATEST("latest"), MANUAL("manual");

        private final String token;

        Builtin(String token) { this.token = token; }

        public String token() { return token; }

        @Override public String label() { return token; }
    }

    record Custom(CustomResolver resolver) implements ResolutionStrategy {
        public Custom {
            Objects.requireNonNull(resolver, "resolver");
        }

        @Override public String label() { return "custom"; }
    }

    /**
     * Parse a built-in token ("ours", "theirs", "latest", "manual").
     *
     * @throws UnknownStrategyException for anything else
     */
    static ResolutionStrategy named(String token) {
        for (Builtin b : Builtin.values()) {
            if (b.token.equals(token)) return b;
        }
        throw new UnknownStrategyException(token);
    }

    static ResolutionStrategy custom(CustomResolver resolver) {
        return new Custom(resolver);
    }
}
