package io.branchlite.repo;

import io.branchlite.storage.ObjectStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named pointers to commits, kept in an {@link ObjectStore}.
 * <p>
 * Layout:
 *  - {@code HEAD}: either {@code "ref: refs/heads/<branch>"} or a bare commit hash.
 *  - {@code refs/heads/<branch>}: the branch's commit hash.
 * A missing HEAD is read as a symbolic ref to the default branch.
 * <p>
 * No locking: a read followed by a write is not atomic, so each ref is expected to have a
 * single writer. Ref writes do not check that the commit exists.
 */
public final class RefManager {
    public static final String HEAD = "HEAD";

    static final String HEADS_PREFIX = "refs/heads/";
    private static final String SYMBOLIC_PREFIX = "ref: ";

    private final ObjectStore store;
    private final String defaultBranch;

    public RefManager(ObjectStore store, String defaultBranch) {
        this.store = Objects.requireNonNull(store, "store");
        this.defaultBranch = Objects.requireNonNull(defaultBranch, "defaultBranch");
    }

    public String defaultBranch() { return defaultBranch; }

    public HeadState getHead() {
        Optional<String> raw = store.getString(HEAD).map(String::trim);
        if (raw.isEmpty()) return new HeadState.OnBranch(defaultBranch);
        String value = raw.get();
        if (value.startsWith(SYMBOLIC_PREFIX)) {
            String ref = value.substring(SYMBOLIC_PREFIX.length()).trim();
            String branch = ref.startsWith(HEADS_PREFIX) ? ref.substring(HEADS_PREFIX.length()) : ref;
            return new HeadState.OnBranch(branch);
        }
        return new HeadState.Detached(value);
    }

    /** Point HEAD at a branch. The branch need not exist yet. */
    public void setHead(String branch) {
        Objects.requireNonNull(branch, "branch");
        store.putString(HEAD, SYMBOLIC_PREFIX + HEADS_PREFIX + branch + "\n");
    }

    /** Point HEAD directly at a commit. */
    public void detachHead(String hash) {
        Objects.requireNonNull(hash, "hash");
        store.putString(HEAD, hash + "\n");
    }

    /**
     * Create or overwrite a ref. For {@code HEAD} this moves the branch HEAD follows,
     * or the detached HEAD itself.
     */
    public void updateRef(String name, String hash) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(hash, "hash");
        if (HEAD.equals(name)) {
            HeadState head = getHead();
            if (head instanceof HeadState.OnBranch onBranch) {
                store.putString(branchKey(onBranch.branch()), hash + "\n");
            } else {
                detachHead(hash);
            }
            return;
        }
        store.putString(branchKey(name), hash + "\n");
    }

    /**
     * Resolve a ref to a commit hash, following HEAD when it is symbolic.
     *
     * @throws RefNotFoundException if the ref, or the branch HEAD follows, is missing
     */
    public String resolveRef(String name) {
        return readRef(name).orElseThrow(() -> new RefNotFoundException(
                HEAD.equals(name) && getHead() instanceof HeadState.OnBranch b ? b.branch() : name));
    }

    /** Like {@link #resolveRef} but empty instead of throwing. */
    public Optional<String> readRef(String name) {
        Objects.requireNonNull(name, "name");
        if (HEAD.equals(name)) {
            HeadState head = getHead();
            if (head instanceof HeadState.Detached detached) return Optional.of(detached.commit());
            return readRef(((HeadState.OnBranch) head).branch());
        }
        return store.getString(branchKey(name)).map(String::trim).filter(s -> !s.isEmpty());
    }

    public boolean refExists(String name) {
        if (HEAD.equals(name)) return store.exists(HEAD);
        return store.exists(branchKey(name));
    }

    /** @return true if the ref existed. */
    public boolean deleteRef(String name) {
        if (HEAD.equals(name)) throw new IllegalArgumentException("HEAD cannot be deleted");
        return store.delete(branchKey(name));
    }

    /** All branch names, sorted. HEAD is not included. */
    public List<String> listRefs() {
        return store.list(HEADS_PREFIX).stream()
                .map(k -> k.substring(HEADS_PREFIX.length()))
                .toList();
    }

    private static String branchKey(String branch) {
        return HEADS_PREFIX + branch;
    }
}
