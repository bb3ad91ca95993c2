package io.branchlite.repo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Branch operations over a {@link RefManager} and a {@link CommitStore}.
 * <p>
 * Not synchronized. Callers are expected to serialize mutations of the same branch.
 */
public final class BranchManager {
    private static final Logger log = Logger.getLogger(BranchManager.class.getName());

    private final RefManager refs;
    private final CommitStore commits;
    private final StateReconstructor reconstructor;

    public BranchManager(RefManager refs, CommitStore commits) {
        this(refs, commits, StateReconstructor.NONE);
    }

    public BranchManager(RefManager refs, CommitStore commits, StateReconstructor reconstructor) {
        this.refs = Objects.requireNonNull(refs, "refs");
        this.commits = Objects.requireNonNull(commits, "commits");
        this.reconstructor = Objects.requireNonNull(reconstructor, "reconstructor");
    }

    /** Create a branch at the HEAD commit. */
    public Branch create(String name) {
        return create(name, null);
    }

    /**
     * Create a branch at {@code from}, or at the HEAD commit when {@code from} is null.
     *
     * @throws InvalidBranchNameException   for names outside the grammar
     * @throws BranchAlreadyExistsException if the name is taken
     * @throws RefNotFoundException         if {@code from} is null and HEAD has no commit
     * @throws CommitNotFoundException      if the base commit is not stored
     */
    public Branch create(String name, String from) {
        BranchNames.validate(name);
        if (refs.refExists(name)) throw new BranchAlreadyExistsException(name);

        String base = from != null ? from : refs.resolveRef(RefManager.HEAD);
        if (!commits.exists(base)) throw new CommitNotFoundException(base);

        refs.updateRef(name, base);
        log.log(Level.INFO, "Created branch {0} at {1}", new Object[]{name, base});
        return new Branch(name, base, false);
    }

    public Branch checkout(String name) {
        return checkout(name, CheckoutOptions.defaults());
    }

    /**
     * Point HEAD at {@code name}, creating the branch first if asked to.
     *
     * @throws BranchNotFoundException if the branch is missing and {@code create} is off
     */
    public Branch checkout(String name, CheckoutOptions options) {
        Objects.requireNonNull(options, "options");
        if (!exists(name)) {
            if (!options.create()) {
                throw new BranchNotFoundException(name, "use --create to create it");
            }
            create(name);
        }
        String commit = refs.resolveRef(name);
        refs.setHead(name);
        log.log(Level.INFO, "Switched to branch {0}", name);
        if (!options.skipStateReconstruction()) reconstructor.reconstruct(name, commit);
        return new Branch(name, commit, true);
    }

    public void delete(String name) {
        delete(name, false);
    }

    /**
     * @throws BranchNotFoundException             if the branch is missing
     * @throws CannotDeleteCurrentBranchException if it is checked out and {@code force} is off
     */
    public void delete(String name, boolean force) {
        if (!exists(name)) throw new BranchNotFoundException(name);
        boolean isCurrent = current().map(name::equals).orElse(false);
        if (isCurrent && !force) throw new CannotDeleteCurrentBranchException(name);

        refs.deleteRef(name);
        log.log(Level.INFO, "Deleted branch {0}{1}", new Object[]{name, isCurrent ? " (was current)" : ""});
    }

    /**
     * Move a branch to a new name. HEAD follows if it pointed at the old name.
     *
     * @throws BranchNotFoundException      if {@code oldName} is missing
     * @throws InvalidBranchNameException   for an invalid {@code newName}
     * @throws BranchAlreadyExistsException if {@code newName} is taken
     */
    public Branch rename(String oldName, String newName) {
        if (!exists(oldName)) throw new BranchNotFoundException(oldName);
        BranchNames.validate(newName);
        if (refs.refExists(newName)) throw new BranchAlreadyExistsException(newName);

        boolean wasCurrent = current().map(oldName::equals).orElse(false);
        String commit = refs.resolveRef(oldName);
        refs.updateRef(newName, commit);
        refs.deleteRef(oldName);
        if (wasCurrent) refs.setHead(newName);
        log.log(Level.INFO, "Renamed branch {0} to {1}", new Object[]{oldName, newName});
        return new Branch(newName, commit, wasCurrent);
    }

    /** All branches sorted by name, flagged with whether HEAD follows them. */
    public List<Branch> list() {
        String current = current().orElse(null);
        List<Branch> out = new ArrayList<>();
        for (String name : refs.listRefs()) {
            Optional<String> commit = refs.readRef(name);
            if (commit.isEmpty()) continue;
            out.add(new Branch(name, commit.get(), name.equals(current)));
        }
        return out;
    }

    /** The branch HEAD follows, or empty when HEAD is detached. */
    public Optional<String> current() {
        if (refs.getHead() instanceof HeadState.OnBranch onBranch) return Optional.of(onBranch.branch());
        return Optional.empty();
    }

    public boolean exists(String name) {
        return name != null && BranchNames.isValid(name) && refs.refExists(name);
    }

    /**
     * Record {@code state} as a new commit on top of HEAD and advance HEAD's branch
     * (or the detached HEAD). The first commit on an unborn branch has no parent.
     */
    public Commit commit(DatabaseState state, String message, String author) {
        List<String> parents = refs.readRef(RefManager.HEAD).map(h -> List.of(h)).orElse(List.of());
        Commit commit = commits.create(state, new CommitOptions(message, author, parents));
        commits.save(commit);
        refs.updateRef(RefManager.HEAD, commit.hash());
        log.log(Level.INFO, "Committed {0} on {1}: {2}",
                new Object[]{commit.shortHash(), current().orElse("detached HEAD"), message});
        return commit;
    }
}
