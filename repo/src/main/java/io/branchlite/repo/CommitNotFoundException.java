package io.branchlite.repo;

public final class CommitNotFoundException extends VersionControlException {
    private final String hash;

    public CommitNotFoundException(String hash) {
        super(withName("Commit not found", hash));
        this.hash = hash;
    }

    public String hash() { return hash; }
}
