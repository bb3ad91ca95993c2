package io.branchlite.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliConfigTest {

    @Test
    void defaults_apply_when_no_options_are_given() {
        var cfg = CliConfig.fromArgs(new String[]{"branch"});

        assertEquals(CliConfig.DEFAULT_REPO_DIR, cfg.repoDir());
        assertNull(cfg.configPath());
        assertNull(cfg.author());
        assertFalse(cfg.verbose());
        assertEquals("branch", cfg.commandName());
        assertTrue(cfg.commandArgs().isEmpty());
    }

    @Test
    void options_before_the_command_are_parsed_in_long_and_short_form() {
        var cfg = CliConfig.fromArgs(new String[]{"-r", "/tmp/r", "--config", "c.json", "-a", "bob", "-v",
                "checkout", "-b", "dev"});

        assertEquals("/tmp/r", cfg.repoDir());
        assertEquals("c.json", cfg.configPath());
        assertEquals("bob", cfg.author());
        assertTrue(cfg.verbose());
        assertEquals("checkout", cfg.commandName());
        assertEquals(List.of("-b", "dev"), cfg.commandArgs());
    }

    @Test
    void help_needs_no_command() {
        var cfg = CliConfig.fromArgs(new String[]{"--help"});

        assertTrue(cfg.help());
        assertNull(cfg.commandName());
    }

    @Test
    void usage_errors_are_reported() {
        assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{}));
        assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{"--repo"}));
        var ex = assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{"--bogus", "init"}));
        assertEquals("unknown option: --bogus", ex.getMessage());
    }
}
