package io.branchlite.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.branchlite.storage.ObjectStore;
import io.branchlite.storage.VersionMismatchException;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the one merge a repository may have in flight, as JSON under {@code MERGE_STATE}.
 * <p>
 * {@link #start} claims the slot with a conditional create, so a second merge cannot begin
 * until the first is cleared. {@link #save} overwrites whatever is there.
 */
public final class MergeStateStore {
    private static final Logger log = Logger.getLogger(MergeStateStore.class.getName());

    public static final String KEY = "MERGE_STATE";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final ObjectStore store;
    private final Clock clock;

    public MergeStateStore(ObjectStore store) {
        this(store, Clock.systemUTC());
    }

    public MergeStateStore(ObjectStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Record the start of a merge of {@code source} into {@code target}.
     *
     * @throws MergeInProgressException if another merge has not been cleared
     * @throws IllegalArgumentException if source and target are the same branch
     */
    public MergeState start(String source, String target, String baseCommit,
                            String sourceCommit, String targetCommit, String strategy) {
        if (Objects.equals(source, target)) {
            throw new IllegalArgumentException("Cannot merge a branch into itself: " + source);
        }
        MergeState state = MergeState.start(source, target, baseCommit, sourceCommit, targetCommit,
                strategy, clock.millis());
        try {
            store.writeConditional(KEY, toBytes(state), null);
        } catch (VersionMismatchException e) {
            throw new MergeInProgressException(load().map(MergeState::source).orElse(null));
        }
        log.log(Level.INFO, "Started merge of {0} into {1}", new Object[]{source, target});
        return state;
    }

    public void save(MergeState state) {
        Objects.requireNonNull(state, "state");
        store.put(KEY, toBytes(state));
        log.fine(() -> "Saved merge state " + state.status().wireName()
                + " with " + state.unresolvedConflicts().size() + " open conflict(s)");
    }

    /** @throws VersionControlException if the stored state cannot be parsed */
    public Optional<MergeState> load() {
        Optional<byte[]> bytes = store.get(KEY);
        if (bytes.isEmpty()) return Optional.empty();
        try {
            return Optional.of(MAPPER.readValue(bytes.get(), MergeState.class));
        } catch (IOException e) {
            throw new VersionControlException("Corrupt merge state: " + e.getMessage(), e);
        }
    }

    /** Drop the merge state, as on abort or after the merge commit. @return true if one existed. */
    public boolean clear() {
        boolean existed = store.delete(KEY);
        if (existed) log.info("Cleared merge state");
        return existed;
    }

    public boolean hasMergeInProgress() {
        return store.exists(KEY);
    }

    private static byte[] toBytes(MergeState state) {
        try {
            return MAPPER.writeValueAsBytes(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize merge state", e);
        }
    }
}
