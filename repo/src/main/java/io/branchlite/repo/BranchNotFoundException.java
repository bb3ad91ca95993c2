package io.branchlite.repo;

public final class BranchNotFoundException extends VersionControlException {
    private final String name;

    public BranchNotFoundException(String name) {
        super(withName("Branch not found", name));
        this.name = name;
    }

    /** Same phrase and name, followed by {@code " (<hint>)"}. */
    public BranchNotFoundException(String name, String hint) {
        super(withName("Branch not found", name) + " (" + hint + ")");
        this.name = name;
    }

    public String name() { return name; }
}
