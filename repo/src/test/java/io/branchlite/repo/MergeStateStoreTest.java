package io.branchlite.repo;

import com.fasterxml.jackson.databind.node.TextNode;
import io.branchlite.storage.FileObjectStore;
import io.branchlite.storage.MemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MergeStateStoreTest {

    private MemoryObjectStore store;
    private Repository repo;
    private MergeStateStore merges;
    private Commit initial;

    @BeforeEach
    void setUp() {
        store = new MemoryObjectStore();
        repo = new Repository(store, "main");
        repo.init();
        initial = repo.branches().commit(DatabaseState.empty(), "initial", "alice");
        merges = repo.merges();
    }

    @Test
    void started_merges_can_be_loaded_back() {
        merges.start("feature", "main", "base-hash", "source-hash", "target-hash", "manual");

        MergeState loaded = merges.load().orElseThrow();

        assertEquals("feature", loaded.source());
        assertEquals("main", loaded.target());
        assertEquals("base-hash", loaded.baseCommit());
        assertEquals(MergeStatus.IN_PROGRESS, loaded.status());
        assertTrue(store.getString(MergeStateStore.KEY).orElseThrow().contains("\"in_progress\""));
    }

    @Test
    void conflicts_and_resolutions_survive_a_save() {
        MergeState s = merges.start("feature", "main", null, "source-hash", "target-hash", null)
                .addConflict(MergeConflict.of("users/user1", "users", List.of("name"),
                        TextNode.valueOf("Our Name"), TextNode.valueOf("Their Name"), TextNode.valueOf("Original")))
                .addConflict(MergeConflict.of("users/user2", "users", List.of(), null, null, null));
        merges.save(s.resolveConflict("users/user2", "theirs"));

        MergeState loaded = merges.load().orElseThrow();

        assertEquals(MergeStatus.CONFLICTED, loaded.status());
        assertEquals(2, loaded.conflicts().size());
        MergeConflict open = loaded.unresolvedConflicts().get(0);
        assertEquals("users/user1", open.entityId());
        assertEquals(List.of("name"), open.fields());
        assertEquals("Their Name", open.theirValue().textValue());
        assertEquals("theirs", loaded.conflicts().get(1).resolution());
    }

    @Test
    void clearing_aborts_the_merge_and_leaves_branches_alone() {
        merges.start("feature", "main", initial.hash(), "source-hash", initial.hash(), null);
        assertTrue(merges.hasMergeInProgress());

        assertTrue(merges.clear());

        assertFalse(merges.hasMergeInProgress());
        assertEquals(Optional.empty(), merges.load());
        assertFalse(merges.clear());
        assertEquals(initial.hash(), repo.refs().resolveRef("main"));
    }

    @Test
    void a_second_merge_cannot_start_while_one_is_open() {
        merges.start("feature-a", "main", "base", "source-a", initial.hash(), null);

        var ex = assertThrows(MergeInProgressException.class,
                () -> merges.start("feature-b", "main", "base", "source-b", initial.hash(), null));

        assertEquals("feature-a", ex.source());
        assertTrue(ex.getMessage().startsWith("Merge already in progress"));
        assertEquals("feature-a", merges.load().orElseThrow().source());

        merges.clear();
        assertEquals("feature-b",
                merges.start("feature-b", "main", "base", "source-b", initial.hash(), null).source());
    }

    @Test
    void a_branch_cannot_be_merged_into_itself() {
        assertThrows(IllegalArgumentException.class,
                () -> merges.start("main", "main", initial.hash(), initial.hash(), initial.hash(), null));
        assertFalse(merges.hasMergeInProgress());
    }

    @Test
    void unreadable_state_is_reported() {
        store.putString(MergeStateStore.KEY, "{not json");

        var ex = assertThrows(VersionControlException.class, () -> merges.load());
        assertTrue(ex.getMessage().startsWith("Corrupt merge state"));
    }

    @Test
    void state_persists_in_a_file_store(@TempDir Path dir) {
        var onDisk = new MergeStateStore(new FileObjectStore(dir));
        onDisk.save(MergeState.start("feature", "main", "b", "s", "t", "ours", 5L)
                .addConflict(MergeConflict.of("posts/p1", "posts", List.of("title"), null, null, null)));

        MergeState loaded = new MergeStateStore(new FileObjectStore(dir)).load().orElseThrow();

        assertEquals(MergeStatus.CONFLICTED, loaded.status());
        assertEquals(5L, loaded.startedAt());
        assertEquals("ours", loaded.strategy());
    }
}
