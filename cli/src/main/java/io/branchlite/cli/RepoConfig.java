package io.branchlite.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.branchlite.cli.dto.JsonRepoConfig;
import io.branchlite.core.conflict.ResolutionStrategy;
import io.branchlite.core.merge.MergeOptions;
import io.branchlite.repo.BranchNames;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Repository settings read from JSON.
 *
 * @param defaultBranch        branch HEAD follows in a fresh repository.
 * @param author               author recorded on commits.
 * @param resolutionStrategy   built-in strategy token used by merge-events.
 * @param autoMergeCommutative combine commuting operators instead of reporting conflicts.
 */
public record RepoConfig(
        String defaultBranch,
        String author,
        String resolutionStrategy,
        boolean autoMergeCommutative
) {
    public static final String DEFAULT_BRANCH = "main";
    public static final String DEFAULT_AUTHOR = "anonymous";
    public static final String DEFAULT_STRATEGY = "manual";

    public RepoConfig {
        Objects.requireNonNull(defaultBranch, "defaultBranch");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(resolutionStrategy, "resolutionStrategy");
        if (!BranchNames.isValid(defaultBranch)) {
            throw new IllegalArgumentException("defaultBranch is not a valid branch name: " + defaultBranch);
        }
        if (author.isBlank()) throw new IllegalArgumentException("author must not be blank");
        ResolutionStrategy.named(resolutionStrategy);
    }

    public static RepoConfig defaults() {
        return new RepoConfig(DEFAULT_BRANCH, DEFAULT_AUTHOR, DEFAULT_STRATEGY, true);
    }

    public static RepoConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonRepoConfig cfg = mapper.readValue(path.toFile(), JsonRepoConfig.class);
            RepoConfig d = defaults();
            return new RepoConfig(
                    cfg.defaultBranch != null ? cfg.defaultBranch : d.defaultBranch(),
                    cfg.author != null ? cfg.author : d.author(),
                    cfg.resolutionStrategy != null ? cfg.resolutionStrategy : d.resolutionStrategy(),
                    cfg.autoMergeCommutative != null ? cfg.autoMergeCommutative : d.autoMergeCommutative()
            );
        } catch (IOException e) {
            throw new CliException("Failed to load config from " + path + ": " + e.getMessage(), e);
        }
    }

    public RepoConfig withAuthor(String newAuthor) {
        return new RepoConfig(defaultBranch, newAuthor, resolutionStrategy, autoMergeCommutative);
    }

    public MergeOptions mergeOptions() {
        return MergeOptions.defaults()
                .withStrategy(resolutionStrategy)
                .withAutoMergeCommutative(autoMergeCommutative);
    }
}
