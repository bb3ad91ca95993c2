package io.branchlite.cli;

/** Usage or input error; reported as {@code error: <message>} with exit code 1. */
public final class CliException extends RuntimeException {
    public CliException(String message) {
        super(message);
    }

    public CliException(String message, Throwable cause) {
        super(message, cause);
    }
}
