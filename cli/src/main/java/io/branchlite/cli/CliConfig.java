package io.branchlite.cli;

import java.util.Arrays;
import java.util.List;

/**
 * Global options parsed from the command line, plus the command and its arguments.
 * <p>
 * Options must precede the command:
 *   --repo,    -r  <dir>   repository directory (default: ./.branchlite)
 *   --config,  -c  <file>  JSON config (default: &lt;repo&gt;/config.json when present)
 *   --author,  -a  <name>  overrides the configured author
 *   --verbose, -v          log repository activity to stderr
 *   --help,    -h
 */
public record CliConfig(
        String repoDir,
        String configPath,
        String author,
        boolean verbose,
        boolean help,
        List<String> command
) {
    public static final String DEFAULT_REPO_DIR = ".branchlite";

    public CliConfig {
        command = List.copyOf(command);
    }

    public static CliConfig fromArgs(String[] args) {
        String repoDir = DEFAULT_REPO_DIR;
        String configPath = null;
        String author = null;
        boolean verbose = false;
        boolean help = false;

        int i = 0;
        for (; i < args.length && args[i].startsWith("-"); i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;
                case "--verbose", "-v" -> verbose = true;
                case "--repo", "-r" -> {
                    ensureValue(args, i);
                    repoDir = args[++i];
                }
                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }
                case "--author", "-a" -> {
                    ensureValue(args, i);
                    author = args[++i];
                }
                default -> throw new CliException("unknown option: " + args[i]);
            }
        }
        List<String> command = Arrays.asList(Arrays.copyOfRange(args, i, args.length));
        if (!help && command.isEmpty()) throw new CliException("missing command");
        return new CliConfig(repoDir, configPath, author, verbose, help, command);
    }

    public String commandName() {
        return command.isEmpty() ? null : command.get(0);
    }

    public List<String> commandArgs() {
        return command.isEmpty() ? List.of() : command.subList(1, command.size());
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) throw new CliException("missing value for option: " + args[i]);
    }
}
