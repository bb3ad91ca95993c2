package io.branchlite.cli.dto;

/** Shape of {@code config.json}. Missing fields stay null and fall back to defaults. */
public class JsonRepoConfig {
    public String defaultBranch;
    public String author;
    public String resolutionStrategy;
    public Boolean autoMergeCommutative;
}
