package io.branchlite.repo;

import io.branchlite.storage.MemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BranchManagerTest {

    private Repository repo;
    private BranchManager branches;
    private final List<String> reconstructed = new ArrayList<>();
    private Commit initial;

    @BeforeEach
    void setUp() {
        var store = new MemoryObjectStore();
        repo = new Repository(store, "main", new CommitStore(store),
                (branch, commit) -> reconstructed.add(branch + "@" + commit));
        repo.init();
        branches = repo.branches();
        initial = branches.commit(DatabaseState.empty(), "initial", "alice");
    }

    private static DatabaseState rows(long n) {
        return new DatabaseState(Map.of("posts", new DatabaseState.CollectionState("d" + n, "s", n)), null, null);
    }

    @Test
    void first_commit_starts_the_default_branch() {
        assertEquals(Optional.of("main"), branches.current());
        assertTrue(initial.isRoot());
        assertEquals(initial.hash(), repo.refs().resolveRef("main"));
        assertFalse(repo.init());
    }

    @Test
    void commits_chain_onto_head() {
        Commit second = branches.commit(rows(1), "second", "bob");

        assertEquals(List.of(initial.hash()), second.parents());
        assertEquals(second.hash(), repo.refs().resolveRef("HEAD"));
        assertEquals(2, repo.commits().log(second.hash(), 0).size());
    }

    @Test
    void create_branches_from_head_or_an_explicit_commit() {
        Commit second = branches.commit(rows(1), "second", "bob");

        Branch fromHead = branches.create("feature/a");
        Branch fromInitial = branches.create("hotfix", initial.hash());

        assertEquals(second.hash(), fromHead.commit());
        assertEquals(initial.hash(), fromInitial.commit());
        assertFalse(fromHead.isCurrent());
        assertTrue(branches.exists("feature/a"));
        assertEquals(Optional.of("main"), branches.current());
    }

    @Test
    void create_rejects_invalid_names() {
        for (String bad : List.of("invalid branch name", "//double-slash", "trailing/", "/leading-slash")) {
            var ex = assertThrows(InvalidBranchNameException.class, () -> branches.create(bad), bad);
            assertTrue(ex.getMessage().startsWith("Invalid branch name"));
        }
    }

    @Test
    void create_rejects_taken_names() {
        var ex = assertThrows(BranchAlreadyExistsException.class, () -> branches.create("main"));
        assertTrue(ex.getMessage().startsWith("Branch already exists"));
    }

    @Test
    void create_rejects_unknown_base_commits() {
        assertThrows(CommitNotFoundException.class, () -> branches.create("x", "f".repeat(64)));
        assertFalse(branches.exists("x"));
    }

    @Test
    void create_on_an_unborn_head_has_nothing_to_branch_from() {
        var empty = new Repository(new MemoryObjectStore(), "main");
        empty.init();

        assertThrows(RefNotFoundException.class, () -> empty.branches().create("dev"));
    }

    @Test
    void checkout_moves_head_and_rebuilds_state() {
        branches.create("dev");
        reconstructed.clear();

        Branch dev = branches.checkout("dev");

        assertTrue(dev.isCurrent());
        assertEquals(Optional.of("dev"), branches.current());
        assertEquals(List.of("dev@" + initial.hash()), reconstructed);
    }

    @Test
    void checkout_can_skip_state_reconstruction() {
        branches.create("dev");
        reconstructed.clear();

        branches.checkout("dev", new CheckoutOptions(false, true));

        assertTrue(reconstructed.isEmpty());
        assertEquals(Optional.of("dev"), branches.current());
    }

    @Test
    void checkout_of_a_missing_branch_fails_unless_asked_to_create() {
        var ex = assertThrows(BranchNotFoundException.class, () -> branches.checkout("nope"));
        assertTrue(ex.getMessage().startsWith("Branch not found: nope"));
        assertTrue(ex.getMessage().contains("--create"), ex.getMessage());
        assertEquals("nope", ex.name());

        Branch created = branches.checkout("nope", CheckoutOptions.creating());

        assertEquals(initial.hash(), created.commit());
        assertEquals(Optional.of("nope"), branches.current());
    }

    @Test
    void commits_on_a_branch_leave_other_branches_alone() {
        branches.checkout("dev", CheckoutOptions.creating());
        Commit onDev = branches.commit(rows(2), "dev work", "bob");

        assertEquals(onDev.hash(), repo.refs().resolveRef("dev"));
        assertEquals(initial.hash(), repo.refs().resolveRef("main"));
        assertEquals(Optional.of(initial.hash()), repo.commits().mergeBase(onDev.hash(), initial.hash()));
    }

    @Test
    void deleting_the_current_branch_needs_force() {
        var ex = assertThrows(CannotDeleteCurrentBranchException.class, () -> branches.delete("main"));
        assertTrue(ex.getMessage().startsWith("Cannot delete current branch"));
        assertTrue(branches.exists("main"));

        branches.delete("main", true);

        assertFalse(branches.exists("main"));
        assertTrue(branches.list().stream().noneMatch(b -> b.name().equals("main")));
    }

    @Test
    void deleting_other_branches_needs_no_force() {
        branches.create("old");

        branches.delete("old");

        assertFalse(branches.exists("old"));
        assertThrows(BranchNotFoundException.class, () -> branches.delete("old"));
    }

    @Test
    void renaming_the_current_branch_moves_head() {
        Branch renamed = branches.rename("main", "trunk");

        assertTrue(renamed.isCurrent());
        assertEquals(Optional.of("trunk"), branches.current());
        assertFalse(branches.exists("main"));
        assertEquals(initial.hash(), repo.refs().resolveRef("HEAD"));
    }

    @Test
    void renaming_checks_both_names() {
        branches.create("dev");

        assertThrows(BranchNotFoundException.class, () -> branches.rename("ghost", "x"));
        assertThrows(BranchAlreadyExistsException.class, () -> branches.rename("dev", "main"));
        assertThrows(InvalidBranchNameException.class, () -> branches.rename("dev", "bad name"));
        assertTrue(branches.exists("dev"));
    }

    @Test
    void list_is_sorted_and_flags_the_current_branch() {
        branches.create("zeta");
        branches.create("alpha");
        branches.checkout("alpha");

        List<Branch> listed = branches.list();

        assertEquals(List.of("alpha", "main", "zeta"), listed.stream().map(Branch::name).toList());
        assertEquals(List.of(true, false, false), listed.stream().map(Branch::isCurrent).toList());
    }

    @Test
    void detached_head_has_no_current_branch() {
        repo.refs().detachHead(initial.hash());

        assertEquals(Optional.empty(), branches.current());
        assertTrue(branches.list().stream().noneMatch(Branch::isCurrent));

        Commit detached = branches.commit(rows(3), "detached work", "carol");
        assertEquals(new HeadState.Detached(detached.hash()), repo.refs().getHead());
        assertEquals(initial.hash(), repo.refs().resolveRef("main"));
    }

    @Test
    void names_ending_in_tmp_or_with_dot_segments_are_ordinary_branches() {
        branches.create("backup.tmp");
        branches.create("release/v1.tmp");
        branches.create("a/../b");

        assertEquals(List.of("a/../b", "backup.tmp", "main", "release/v1.tmp"),
                branches.list().stream().map(Branch::name).toList());
        assertEquals(initial.hash(), branches.checkout("release/v1.tmp").commit());
    }
}
