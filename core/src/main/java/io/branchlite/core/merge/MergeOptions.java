package io.branchlite.core.merge;

import io.branchlite.core.conflict.ResolutionStrategy;

/**
 * Knobs for {@link EventMerger#mergeEventStreams(java.util.List, java.util.List, MergeOptions)}.
 *
 * @param resolutionStrategy   strategy applied to every detected conflict, or null to leave
 *                             conflicts unresolved.
 * @param autoMergeCommutative when true, fields changed by commuting operators are combined
 *                             instead of being reported as conflicts.
 */
public record MergeOptions(ResolutionStrategy resolutionStrategy, boolean autoMergeCommutative) {

    private static final MergeOptions DEFAULTS = new MergeOptions(null, true);

    public static MergeOptions defaults() { return DEFAULTS; }

    public MergeOptions withStrategy(ResolutionStrategy strategy) {
        return new MergeOptions(strategy, autoMergeCommutative);
    }

    /** Parses a built-in token; throws {@link io.branchlite.core.conflict.UnknownStrategyException}. */
    public MergeOptions withStrategy(String token) {
        return withStrategy(ResolutionStrategy.named(token));
    }

    public MergeOptions withAutoMergeCommutative(boolean enabled) {
        return new MergeOptions(resolutionStrategy, enabled);
    }

    public boolean resolves() { return resolutionStrategy != null; }
}
