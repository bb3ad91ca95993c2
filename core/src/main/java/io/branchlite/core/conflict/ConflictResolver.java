package io.branchlite.core.conflict;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies resolution strategies to conflicts.
 * <p>
 * Built-ins:
 *  - ours:    our value.
 *  - theirs:  their value.
 *  - latest:  value of the event with the greater ts; ours on a tie.
 *  - manual:  no value, flagged for a human decision.
 * <p>
 * Stateless and thread safe.
 */
public final class ConflictResolver {

    public Resolution resolveConflict(ConflictInfo conflict, String token) {
        return resolveConflict(conflict, ResolutionStrategy.named(token));
    }

    public Resolution resolveConflict(ConflictInfo conflict, ResolutionStrategy strategy) {
        Objects.requireNonNull(conflict, "conflict");
        Objects.requireNonNull(strategy, "strategy");
        if (strategy instanceof ResolutionStrategy.Builtin builtin) {
            return resolveBuiltin(conflict, builtin);
        }
        if (strategy instanceof ResolutionStrategy.Custom custom) {
            return normalize(conflict, custom.resolver().resolve(conflict));
        }
        throw new IllegalStateException("Unsupported strategy type: " + strategy);
    }

    /** Same strategy for every conflict, input order preserved. */
    public List<Resolution> resolveAllConflicts(List<ConflictInfo> conflicts, ResolutionStrategy strategy) {
        List<Resolution> out = new ArrayList<>(conflicts.size());
        for (ConflictInfo c : conflicts) out.add(resolveConflict(c, strategy));
        return out;
    }

    public List<Resolution> resolveConflictsByType(List<ConflictInfo> conflicts,
                                                   Map<ConflictType, ResolutionStrategy> byType) {
        return resolveConflictsByType(conflicts, byType, ResolutionStrategy.MANUAL);
    }

    /** Dispatch on {@link ConflictInfo#type()}; unmapped types use {@code defaultStrategy}. */
    public List<Resolution> resolveConflictsByType(List<ConflictInfo> conflicts,
                                                   Map<ConflictType, ResolutionStrategy> byType,
                                                   ResolutionStrategy defaultStrategy) {
        List<Resolution> out = new ArrayList<>(conflicts.size());
        for (ConflictInfo c : conflicts) {
            out.add(resolveConflict(c, byType.getOrDefault(c.type(), defaultStrategy)));
        }
        return out;
    }

    public static boolean allResolutionsComplete(List<Resolution> resolutions) {
        return resolutions.stream().noneMatch(Resolution::requiresManualResolution);
    }

    public static List<Resolution> getUnresolvedConflicts(List<Resolution> resolutions) {
        return resolutions.stream().filter(Resolution::requiresManualResolution).toList();
    }

    /** Feed back a human decision for a resolution that required manual work. */
    public static Resolution applyManualResolution(Resolution resolution, JsonNode value) {
        Objects.requireNonNull(resolution, "resolution");
        return Resolution.resolved(value, "manual-resolved", resolution.conflict(),
                "Manually resolved by user");
    }

    private Resolution resolveBuiltin(ConflictInfo c, ResolutionStrategy.Builtin builtin) {
        return switch (builtin) {
            case OURS -> Resolution.resolved(c.ourValue(), builtin.token(), c, "Using our value");
            case THEIRS -> Resolution.resolved(c.theirValue(), builtin.token(), c, "Using their value");
            case LATEST -> {
                long ourTs = c.ourEvent().ts();
                long theirTs = c.theirEvent().ts();
                if (theirTs > ourTs) {
                    yield Resolution.resolved(c.theirValue(), builtin.token(), c,
                            "Using their value from latest event (ts=%d > %d)".formatted(theirTs, ourTs));
                }
                yield Resolution.resolved(c.ourValue(), builtin.token(), c,
                        "Using our value from latest event (ts=%d >= %d)".formatted(ourTs, theirTs));
            }
            case MANUAL -> {
                String where = c.hasField()
                        ? "field '" + c.field() + "' of " + c.target()
                        : c.target();
                yield Resolution.manual(builtin.token(), c,
                        "Conflict on " + where + " requires manual resolution");
            }
        };
    }

    private static Resolution normalize(ConflictInfo conflict, Resolution r) {
        if (r == null) {
            return Resolution.manual("custom", conflict, "Custom strategy returned no resolution");
        }
        String label = (r.strategy() == null || r.strategy().isBlank()) ? "custom" : r.strategy();
        ConflictInfo c = r.conflict() == null ? conflict : r.conflict();
        String explanation = r.explanation() == null ? "Resolved by " + label + " strategy" : r.explanation();
        if (label.equals(r.strategy()) && c == r.conflict() && explanation.equals(r.explanation())) return r;
        return new Resolution(r.resolvedValue(), label, r.requiresManualResolution(), c, explanation);
    }
}
