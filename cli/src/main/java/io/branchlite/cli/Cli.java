package io.branchlite.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.branchlite.core.Event;
import io.branchlite.core.conflict.ConflictInfo;
import io.branchlite.core.conflict.Resolution;
import io.branchlite.core.merge.EventMerger;
import io.branchlite.core.merge.MergeOptions;
import io.branchlite.core.merge.MergeResult;
import io.branchlite.repo.Branch;
import io.branchlite.repo.BranchManager;
import io.branchlite.repo.CheckoutOptions;
import io.branchlite.repo.Commit;
import io.branchlite.repo.DatabaseState;
import io.branchlite.repo.Repository;
import io.branchlite.repo.VersionControlException;
import io.branchlite.storage.FileObjectStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line front end for a repository stored in a local directory.
 *
 * Usage:
 *   branchlite [options] init
 *   branchlite [options] branch                          list branches
 *   branchlite [options] branch <name> [--from <hash>]   create a branch
 *   branchlite [options] branch -d|-D <name>             delete (-D forces)
 *   branchlite [options] branch -m <old> <new>           rename
 *   branchlite [options] checkout [-b|--create] <name>
 *   branchlite [options] commit <message> [--state <file.json>]
 *   branchlite [options] log [--limit <n>]
 *   branchlite [options] merge-events <ours.json> <theirs.json> [--strategy <token>]
 *
 * Exit codes: 0 ok, 1 usage or repository error, 2 unexpected failure,
 * 3 merge-events left unresolved conflicts.
 */
public final class Cli {
    static final int OK = 0;
    static final int USAGE = 1;
    static final int FAILURE = 2;
    static final int UNRESOLVED = 3;

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final PrintStream out;
    private final PrintStream err;

    Cli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(new Cli(System.out, System.err).run(args));
    }

    int run(String[] args) {
        try {
            CliConfig cli = CliConfig.fromArgs(args);
            if (cli.help()) {
                printUsage(out);
                return OK;
            }
            if (cli.verbose()) enableVerboseLogging();
            return dispatch(cli);
        } catch (CliException | VersionControlException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return USAGE;
        } catch (Exception e) {
            e.printStackTrace(err);
            return FAILURE;
        }
    }

    private int dispatch(CliConfig cli) {
        Path repoDir = Path.of(cli.repoDir());
        RepoConfig config = loadConfig(cli, repoDir);
        List<String> args = cli.commandArgs();

        switch (cli.commandName()) {
            case "init" -> {
                if (!args.isEmpty()) throw new CliException("init takes no arguments");
                return init(repoDir, config);
            }
            case "branch" -> {
                return branch(open(repoDir, config).branches(), args);
            }
            case "checkout" -> {
                return checkout(open(repoDir, config).branches(), args);
            }
            case "commit" -> {
                return commit(open(repoDir, config), config, args);
            }
            case "log" -> {
                return log(open(repoDir, config), args);
            }
            case "merge-events" -> {
                return mergeEvents(config, args);
            }
            default -> throw new CliException("unknown command: " + cli.commandName());
        }
    }

    // ----------------- commands -----------------

    private int init(Path repoDir, RepoConfig config) {
        Repository repo = new Repository(new FileObjectStore(repoDir), config.defaultBranch());
        if (repo.init()) {
            out.println("Initialized empty repository in " + repoDir.toAbsolutePath().normalize()
                    + " on branch " + config.defaultBranch());
        } else {
            out.println("Repository already initialized in " + repoDir.toAbsolutePath().normalize());
        }
        return OK;
    }

    private int branch(BranchManager branches, List<String> args) {
        if (args.isEmpty()) {
            for (Branch b : branches.list()) {
                out.println((b.isCurrent() ? "* " : "  ") + b.name() + " " + shortHash(b.commit()));
            }
            return OK;
        }
        switch (args.get(0)) {
            case "-d", "-D" -> {
                requireArgs(args, 2, "branch " + args.get(0) + " requires <name>");
                branches.delete(args.get(1), args.get(0).equals("-D"));
                out.println("Deleted branch " + args.get(1));
            }
            case "-m" -> {
                requireArgs(args, 3, "branch -m requires <old> <new>");
                branches.rename(args.get(1), args.get(2));
                out.println("Renamed branch " + args.get(1) + " to " + args.get(2));
            }
            default -> {
                String name = args.get(0);
                String from = null;
                if (args.size() == 3 && args.get(1).equals("--from")) {
                    from = args.get(2);
                } else if (args.size() != 1) {
                    throw new CliException("branch requires <name> [--from <hash>]");
                }
                Branch created = branches.create(name, from);
                out.println("Created branch " + created.name() + " at " + shortHash(created.commit()));
            }
        }
        return OK;
    }

    private int checkout(BranchManager branches, List<String> args) {
        boolean create = !args.isEmpty() && (args.get(0).equals("-b") || args.get(0).equals("--create"));
        List<String> rest = create ? args.subList(1, args.size()) : args;
        requireArgs(rest, 1, "checkout requires [-b|--create] <name>");
        if (rest.size() != 1) throw new CliException("checkout requires [-b|--create] <name>");

        Branch b = branches.checkout(rest.get(0), new CheckoutOptions(create, false));
        out.println("Switched to branch " + b.name());
        return OK;
    }

    private int commit(Repository repo, RepoConfig config, List<String> args) {
        requireArgs(args, 1, "commit requires <message> [--state <file.json>]");
        String message = args.get(0);
        DatabaseState state = DatabaseState.empty();
        if (args.size() == 3 && args.get(1).equals("--state")) {
            state = readJson(Path.of(args.get(2)), new TypeReference<DatabaseState>() { });
        } else if (args.size() != 1) {
            throw new CliException("commit requires <message> [--state <file.json>]");
        }

        Commit c = repo.branches().commit(state, message, config.author());
        String where = repo.branches().current().orElse("detached HEAD");
        out.println("[" + where + " " + c.shortHash() + "] " + message);
        return OK;
    }

    private int log(Repository repo, List<String> args) {
        int limit = 0;
        if (args.size() == 2 && args.get(0).equals("--limit")) {
            try {
                limit = Integer.parseInt(args.get(1));
            } catch (NumberFormatException e) {
                throw new CliException("invalid --limit: " + args.get(1));
            }
        } else if (!args.isEmpty()) {
            throw new CliException("log accepts only [--limit <n>]");
        }

        String head = repo.refs().readRef("HEAD").orElse(null);
        if (head == null) {
            out.println("(no commits yet)");
            return OK;
        }
        for (Commit c : repo.commits().log(head, limit)) {
            out.println("commit " + c.hash());
            if (c.isMerge()) out.println("Merge: " + String.join(" ", c.parents().stream().map(Cli::shortHash).toList()));
            out.println("Author: " + c.author());
            out.println("Date:   " + Instant.ofEpochMilli(c.timestamp()));
            out.println();
            out.println("    " + c.message());
            out.println();
        }
        return OK;
    }

    private int mergeEvents(RepoConfig config, List<String> args) {
        MergeOptions options = config.mergeOptions();
        if (args.size() == 4 && args.get(2).equals("--strategy")) {
            options = options.withStrategy(args.get(3));
        } else if (args.size() != 2) {
            throw new CliException("merge-events requires <ours.json> <theirs.json> [--strategy <token>]");
        }
        List<Event> ours = readJson(Path.of(args.get(0)), new TypeReference<List<Event>>() { });
        List<Event> theirs = readJson(Path.of(args.get(1)), new TypeReference<List<Event>>() { });

        MergeResult result = new EventMerger().mergeEventStreams(ours, theirs, options);
        try {
            out.println(JSON.writeValueAsString(summarize(result)));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot render merge result", e);
        }
        if (!result.success()) {
            err.println(result.pending().size() + " conflict(s) need manual resolution");
            return UNRESOLVED;
        }
        return OK;
    }

    // ----------------- helpers -----------------

    private static ObjectNode summarize(MergeResult result) {
        ObjectNode root = JSON.createObjectNode();
        root.put("success", result.success());
        root.set("stats", JSON.valueToTree(result.stats()));
        root.set("mergedEvents", JSON.valueToTree(result.mergedEvents()));

        ArrayNode conflicts = root.putArray("conflicts");
        for (ConflictInfo c : result.conflicts()) {
            ObjectNode n = conflicts.addObject();
            n.put("type", c.type().wireName());
            n.put("target", c.target());
            if (c.hasField()) n.put("field", c.field());
            n.set("ourValue", c.ourValue());
            n.set("theirValue", c.theirValue());
            n.set("baseValue", c.baseValue());
            n.put("resolved", c.resolved());
        }
        ArrayNode resolved = root.putArray("resolved");
        for (Resolution r : result.resolved()) {
            ObjectNode n = resolved.addObject();
            n.put("location", r.conflict().location());
            n.put("strategy", r.strategy());
            n.set("resolvedValue", r.resolvedValue());
            n.put("explanation", r.explanation());
        }
        root.set("autoMerged", JSON.valueToTree(result.autoMerged()));
        return root;
    }

    private RepoConfig loadConfig(CliConfig cli, Path repoDir) {
        RepoConfig config;
        if (cli.configPath() != null) {
            config = RepoConfig.fromJsonFile(Path.of(cli.configPath()));
        } else if (Files.isRegularFile(repoDir.resolve("config.json"))) {
            config = RepoConfig.fromJsonFile(repoDir.resolve("config.json"));
        } else {
            config = RepoConfig.defaults();
        }
        return cli.author() != null ? config.withAuthor(cli.author()) : config;
    }

    private static Repository open(Path repoDir, RepoConfig config) {
        if (!Files.isDirectory(repoDir)) {
            throw new CliException("not a branchlite repository: " + repoDir + " (run init first)");
        }
        Repository repo = new Repository(new FileObjectStore(repoDir), config.defaultBranch());
        if (!repo.isInitialized()) {
            throw new CliException("not a branchlite repository: " + repoDir + " (run init first)");
        }
        return repo;
    }

    private static <T> T readJson(Path file, TypeReference<T> type) {
        try {
            return JSON.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new CliException("cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private static void requireArgs(List<String> args, int min, String usage) {
        if (args.size() < min) throw new CliException(usage);
    }

    private static String shortHash(String hash) {
        return hash.length() <= 7 ? hash : hash.substring(0, 7);
    }

    private static void printUsage(PrintStream out) {
        out.println("""
            Usage: branchlite [options] <command> [args]

            Commands:
              init                                     create the repository
              branch                                   list branches
              branch <name> [--from <hash>]            create a branch
              branch -d|-D <name>                      delete a branch (-D: even if current)
              branch -m <old> <new>                    rename a branch
              checkout [-b|--create] <name>            switch branches (-b: create first)
              commit <message> [--state <file.json>]   record a snapshot on HEAD
              log [--limit <n>]                        show history from HEAD
              merge-events <ours> <theirs> [--strategy <token>]
                                                       merge two JSON event arrays

            Options:
              --repo,    -r   Repository directory (default: ./.branchlite)
              --config,  -c   JSON config file (default: <repo>/config.json)
              --author,  -a   Commit author (overrides config)
              --verbose, -v   Log repository activity to stderr
              --help,    -h   Show this help message
            """);
    }

    private static void configureLogging() {
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("warning: cannot read logging.properties: " + e.getMessage());
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("io.branchlite");
        root.setLevel(Level.FINE);
        for (Handler h : Logger.getLogger("").getHandlers()) {
            if (h instanceof ConsoleHandler) h.setLevel(Level.FINE);
        }
    }
}
