package io.branchlite.repo;

import io.branchlite.storage.ObjectStore;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Wires the commit store, ref manager, branch manager and merge state over one {@link ObjectStore}.
 */
public final class Repository {
    private static final Logger log = Logger.getLogger(Repository.class.getName());

    private final ObjectStore store;
    private final CommitStore commits;
    private final RefManager refs;
    private final BranchManager branches;
    private final MergeStateStore merges;

    public Repository(ObjectStore store, String defaultBranch) {
        this(store, defaultBranch, new CommitStore(store), StateReconstructor.NONE);
    }

    public Repository(ObjectStore store, String defaultBranch, CommitStore commits, StateReconstructor reconstructor) {
        this.store = Objects.requireNonNull(store, "store");
        this.commits = Objects.requireNonNull(commits, "commits");
        this.refs = new RefManager(store, BranchNames.validate(defaultBranch));
        this.branches = new BranchManager(refs, commits, reconstructor);
        this.merges = new MergeStateStore(store);
    }

    /** True once HEAD has been written. */
    public boolean isInitialized() {
        return refs.refExists(RefManager.HEAD);
    }

    /**
     * Write HEAD pointing at the default branch, if it is not there yet.
     *
     * @return false if the repository was already initialized
     */
    public boolean init() {
        if (isInitialized()) return false;
        refs.setHead(refs.defaultBranch());
        log.info(() -> "Initialized repository on branch " + refs.defaultBranch());
        return true;
    }

    public ObjectStore store() { return store; }

    public CommitStore commits() { return commits; }

    public RefManager refs() { return refs; }

    public BranchManager branches() { return branches; }

    public MergeStateStore merges() { return merges; }
}
