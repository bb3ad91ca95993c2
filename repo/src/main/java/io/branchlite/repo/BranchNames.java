package io.branchlite.repo;

import java.util.regex.Pattern;

/**
 * Branch-name grammar: one or more '/'-separated segments of {@code [A-Za-z0-9._-]+}.
 */
public final class BranchNames {
    private static final Pattern GRAMMAR = Pattern.compile("[A-Za-z0-9._-]+(/[A-Za-z0-9._-]+)*");

    private BranchNames() {
    }

    public static boolean isValid(String name) {
        return name != null && GRAMMAR.matcher(name).matches();
    }

    /** @throws InvalidBranchNameException when {@link #isValid} is false */
    public static String validate(String name) {
        if (!isValid(name)) throw new InvalidBranchNameException(name);
        return name;
    }
}
