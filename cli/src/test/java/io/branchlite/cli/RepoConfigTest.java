package io.branchlite.cli;

import io.branchlite.core.conflict.ResolutionStrategy;
import io.branchlite.core.conflict.UnknownStrategyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RepoConfigTest {

    @TempDir Path dir;

    @Test
    void defaults() {
        var cfg = RepoConfig.defaults();

        assertEquals("main", cfg.defaultBranch());
        assertEquals("anonymous", cfg.author());
        assertEquals("manual", cfg.resolutionStrategy());
        assertTrue(cfg.autoMergeCommutative());
    }

    @Test
    void json_file_overrides_only_the_fields_it_names() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"defaultBranch\":\"trunk\",\"resolutionStrategy\":\"latest\",\"autoMergeCommutative\":false}");

        var cfg = RepoConfig.fromJsonFile(file);

        assertEquals("trunk", cfg.defaultBranch());
        assertEquals("anonymous", cfg.author());
        assertEquals(ResolutionStrategy.LATEST, cfg.mergeOptions().resolutionStrategy());
        assertFalse(cfg.mergeOptions().autoMergeCommutative());
    }

    @Test
    void invalid_values_are_rejected() throws Exception {
        Path badStrategy = dir.resolve("s.json");
        Files.writeString(badStrategy, "{\"resolutionStrategy\":\"newest\"}");
        Path badBranch = dir.resolve("b.json");
        Files.writeString(badBranch, "{\"defaultBranch\":\"has space\"}");

        assertThrows(UnknownStrategyException.class, () -> RepoConfig.fromJsonFile(badStrategy));
        assertThrows(IllegalArgumentException.class, () -> RepoConfig.fromJsonFile(badBranch));
    }

    @Test
    void unreadable_files_surface_as_cli_errors() throws Exception {
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{not json");

        assertThrows(CliException.class, () -> RepoConfig.fromJsonFile(broken));
        assertThrows(CliException.class, () -> RepoConfig.fromJsonFile(dir.resolve("missing.json")));
    }

    @Test
    void author_can_be_overridden() {
        assertEquals("bob", RepoConfig.defaults().withAuthor("bob").author());
    }
}
