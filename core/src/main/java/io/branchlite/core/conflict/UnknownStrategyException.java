package io.branchlite.core.conflict;

/**
 * Raised when a strategy token does not name a built-in strategy.
 */
public class UnknownStrategyException extends IllegalArgumentException {
    private final String token;

    public UnknownStrategyException(String token) {
        super("Unknown resolution strategy: " + token);
        this.token = token;
    }

    public String token() { return token; }
}
