package io.branchlite.repo;

/** A ref, or the branch HEAD points at, has no commit. */
public final class RefNotFoundException extends VersionControlException {
    private final String name;

    public RefNotFoundException(String name) {
        super(withName("Ref not found", name));
        this.name = name;
    }

    public String name() { return name; }
}
