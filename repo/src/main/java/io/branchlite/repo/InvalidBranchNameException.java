package io.branchlite.repo;

/** The name does not follow the branch-name grammar. */
public final class InvalidBranchNameException extends VersionControlException {
    private final String name;

    public InvalidBranchNameException(String name) {
        super(withName("Invalid branch name", name));
        this.name = name;
    }

    public String name() { return name; }
}
