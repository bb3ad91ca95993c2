package io.branchlite.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.branchlite.storage.FileObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @TempDir Path dir;

    private Path repo;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        repo = dir.resolve("repo");
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        List<String> full = new ArrayList<>(List.of("--repo", repo.toString(), "--author", "tester"));
        full.addAll(List.of(args));
        var cli = new Cli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return cli.run(full.toArray(String[]::new));
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8); }

    private String stderr() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void branch_workflow_end_to_end() {
        assertEquals(0, run("init"));
        assertTrue(stdout().contains("on branch main"));

        assertEquals(0, run("commit", "first"));
        assertTrue(stdout().startsWith("[main "));

        assertEquals(0, run("branch", "feature/x"));
        assertEquals(0, run("checkout", "feature/x"));
        assertEquals(0, run("commit", "on feature"));

        assertEquals(0, run("branch"));
        String listing = stdout();
        assertTrue(listing.contains("* feature/x"), listing);
        assertTrue(listing.contains("  main"), listing);

        assertEquals(0, run("log", "--limit", "1"));
        assertTrue(stdout().contains("on feature"));
        assertFalse(stdout().contains("first"));
        assertTrue(stdout().contains("Author: tester"));

        assertEquals(0, run("branch", "-m", "feature/x", "feature/y"));
        assertEquals(0, run("branch"));
        assertTrue(stdout().contains("* feature/y"));
    }

    @Test
    void version_control_errors_exit_with_1_and_the_message() {
        run("init");
        run("commit", "first");

        assertEquals(1, run("branch", "-d", "main"));
        assertTrue(stderr().contains("Cannot delete current branch"));

        assertEquals(1, run("checkout", "nope"));
        assertTrue(stderr().contains("Branch not found: nope"));
        assertTrue(stderr().contains("--create"));

        assertEquals(1, run("branch", "bad name"));
        assertTrue(stderr().contains("Invalid branch name"));

        assertEquals(0, run("branch", "-D", "main"));
    }

    @Test
    void checkout_creates_with_either_flag() {
        run("init");
        run("commit", "first");

        assertEquals(0, run("checkout", "--create", "feature"));
        assertEquals(0, run("checkout", "-b", "feature/login"));
        assertEquals(0, run("branch"));
        String listing = stdout();
        assertTrue(listing.contains("  feature "), listing);
        assertTrue(listing.contains("* feature/login"), listing);
    }

    @Test
    void commands_need_an_initialized_repository() {
        assertEquals(1, run("branch"));
        assertTrue(stderr().contains("run init first"));
    }

    @Test
    void unknown_commands_are_usage_errors() {
        assertEquals(1, run("frobnicate"));
        assertTrue(stderr().contains("unknown command: frobnicate"));
    }

    @Test
    void commit_records_the_state_file() throws Exception {
        run("init");
        Path state = dir.resolve("state.json");
        Files.writeString(state, """
                {"collections":{"posts":{"dataHash":"d1","schemaHash":"s1","rowCount":3}},
                 "eventLogPosition":{"segmentId":"seg-1","offset":42}}
                """);

        assertEquals(0, run("commit", "snapshot", "--state", state.toString()));
        var store = new FileObjectStore(repo);
        String hash = store.getString("refs/heads/main").orElseThrow().trim();
        String stored = store.getString("objects/commits/" + hash + ".json").orElseThrow();
        assertTrue(stored.contains("\"dataHash\":\"d1\""), stored);
    }

    @Test
    void merge_events_reports_conflicts_and_resolutions() throws Exception {
        Path ours = dir.resolve("ours.json");
        Path theirs = dir.resolve("theirs.json");
        Files.writeString(ours, """
                [{"id":"o1","ts":1000,"op":"UPDATE","target":"posts:p1",
                  "before":{"title":"Original"},"after":{"title":"Our Title"},"actor":"alice"}]
                """);
        Files.writeString(theirs, """
                [{"id":"t1","ts":1100,"op":"UPDATE","target":"posts:p1",
                  "before":{"title":"Original"},"after":{"title":"Their Title"},"actor":"bob"}]
                """);

        assertEquals(3, run("merge-events", ours.toString(), theirs.toString()));
        assertTrue(stderr().contains("1 conflict(s)"));
        JsonNode unresolved = new ObjectMapper().readTree(stdout());
        assertFalse(unresolved.get("success").asBoolean());
        assertEquals("concurrent_update", unresolved.get("conflicts").get(0).get("type").asText());
        assertEquals("title", unresolved.get("conflicts").get(0).get("field").asText());

        assertEquals(0, run("merge-events", ours.toString(), theirs.toString(), "--strategy", "latest"));
        JsonNode resolved = new ObjectMapper().readTree(stdout());
        assertTrue(resolved.get("success").asBoolean());
        assertEquals("Their Title", resolved.get("resolved").get(0).get("resolvedValue").asText());
        assertEquals(2, resolved.get("mergedEvents").size());
        assertEquals(1, resolved.get("stats").get("conflictsResolved").asInt());
    }

    @Test
    void merge_events_rejects_unknown_strategies() throws Exception {
        Path empty = dir.resolve("empty.json");
        Files.writeString(empty, "[]");

        assertEquals(1, run("merge-events", empty.toString(), empty.toString(), "--strategy", "newest"));
        assertTrue(stderr().contains("Unknown resolution strategy: newest"));
    }

    @Test
    void help_prints_usage() {
        assertEquals(0, run("--help"));
        assertTrue(stdout().contains("Usage: branchlite"));
    }
}
