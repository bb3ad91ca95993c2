package io.branchlite.repo;

/** Raised when deleting the checked-out branch without force. */
public final class CannotDeleteCurrentBranchException extends VersionControlException {
    private final String name;

    public CannotDeleteCurrentBranchException(String name) {
        super(withName("Cannot delete current branch", name));
        this.name = name;
    }

    public String name() { return name; }
}
