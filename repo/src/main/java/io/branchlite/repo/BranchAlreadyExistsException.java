package io.branchlite.repo;

public final class BranchAlreadyExistsException extends VersionControlException {
    private final String name;

    public BranchAlreadyExistsException(String name) {
        super(withName("Branch already exists", name));
        this.name = name;
    }

    public String name() { return name; }
}
