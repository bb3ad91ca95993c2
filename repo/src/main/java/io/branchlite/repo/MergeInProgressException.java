package io.branchlite.repo;

public final class MergeInProgressException extends VersionControlException {
    private final String source;

    public MergeInProgressException(String source) {
        super(withName("Merge already in progress", source));
        this.source = source;
    }

    /** Source branch of the merge that is already running, if known. */
    public String source() { return source; }
}
