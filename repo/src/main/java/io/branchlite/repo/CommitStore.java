package io.branchlite.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.branchlite.storage.ObjectStore;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Creates, persists and walks commits.
 * <p>
 * Layout: each commit is a JSON document at {@code objects/commits/<hash>.json}.
 * <p>
 * Hashing: SHA-256 (lowercase hex) over the canonical JSON of
 * {@code {author, message, parents, state}} with object keys sorted at every level.
 * The timestamp is not hashed, so identical content always maps to the same commit.
 * <p>
 * Invariants enforced on save:
 *  - the stored hash matches the content,
 *  - every parent is already stored.
 * Loads re-verify the hash.
 */
public final class CommitStore {
    private static final Logger log = Logger.getLogger(CommitStore.class.getName());

    static final String PREFIX = "objects/commits/";
    private static final Pattern HASH = Pattern.compile("[0-9a-f]{64}");

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    // newest first, ties by hash for a stable order
    private static final Comparator<Commit> NEWEST_FIRST =
            Comparator.comparingLong(Commit::timestamp).reversed().thenComparing(Commit::hash);

    private final ObjectStore store;
    private final Clock clock;

    public CommitStore(ObjectStore store) {
        this(store, Clock.systemUTC());
    }

    public CommitStore(ObjectStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Build a commit without persisting it. */
    public Commit create(DatabaseState state, CommitOptions options) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(options, "options");
        String hash = computeHash(options.parents(), options.message(), options.author(), state);
        return new Commit(hash, options.parents(), options.message(), options.author(), clock.millis(), state);
    }

    /**
     * Persist a commit. Saving a hash that is already stored is a no-op.
     *
     * @throws CorruptCommitException  if the hash does not match the content
     * @throws CommitNotFoundException if a parent is not stored
     */
    public void save(Commit commit) {
        Objects.requireNonNull(commit, "commit");
        String expected = computeHash(commit.parents(), commit.message(), commit.author(), commit.state());
        if (!expected.equals(commit.hash())) {
            throw new CorruptCommitException(commit.hash(), "content hashes to " + expected);
        }
        if (exists(commit.hash())) {
            log.fine(() -> "Commit " + commit.shortHash() + " already stored");
            return;
        }
        for (String parent : commit.parents()) {
            if (!exists(parent)) throw new CommitNotFoundException(parent);
        }
        try {
            store.put(key(commit.hash()), MAPPER.writeValueAsBytes(commit));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize commit " + commit.hash(), e);
        }
        log.log(Level.FINE, "Stored commit {0}", commit.hash());
    }

    /** @throws CommitNotFoundException if no commit is stored under {@code hash} */
    public Commit load(String hash) {
        if (hash == null || !HASH.matcher(hash).matches()) throw new CommitNotFoundException(hash);
        byte[] bytes = store.get(key(hash)).orElseThrow(() -> new CommitNotFoundException(hash));

        Commit commit;
        try {
            commit = MAPPER.readValue(bytes, Commit.class);
        } catch (IOException e) {
            throw new CorruptCommitException(hash, e);
        }
        String actual = computeHash(commit.parents(), commit.message(), commit.author(), commit.state());
        if (!hash.equals(actual) || !hash.equals(commit.hash())) {
            throw new CorruptCommitException(hash, "content hashes to " + actual);
        }
        return commit;
    }

    public boolean exists(String hash) {
        return hash != null && HASH.matcher(hash).matches() && store.exists(key(hash));
    }

    /**
     * Ancestors of {@code hash} including itself, newest first.
     *
     * @param limit maximum number of commits; zero or negative means no limit
     */
    public List<Commit> log(String hash, int limit) {
        List<Commit> out = new ArrayList<>();
        PriorityQueue<Commit> frontier = new PriorityQueue<>(NEWEST_FIRST);
        Set<String> seen = new HashSet<>();
        frontier.add(load(hash));
        seen.add(hash);
        while (!frontier.isEmpty() && (limit <= 0 || out.size() < limit)) {
            Commit next = frontier.poll();
            out.add(next);
            for (String parent : next.parents()) {
                if (seen.add(parent)) frontier.add(load(parent));
            }
        }
        return out;
    }

    /** Nearest common ancestor of two commits, or empty when their histories are disjoint. */
    public Optional<String> mergeBase(String a, String b) {
        Set<String> ancestorsOfA = new HashSet<>();
        for (Commit c : log(a, 0)) ancestorsOfA.add(c.hash());
        for (Commit c : log(b, 0)) {
            if (ancestorsOfA.contains(c.hash())) return Optional.of(c.hash());
        }
        return Optional.empty();
    }

    /** Content hash over parents, message, author and state. */
    public static String computeHash(List<String> parents, String message, String author, DatabaseState state) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("author", author);
        root.put("message", message);
        ArrayNode p = root.putArray("parents");
        parents.forEach(p::add);
        root.set("state", MAPPER.valueToTree(state));
        try {
            byte[] canonical = MAPPER.writeValueAsBytes(sorted(root));
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize commit content", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> fields = new TreeMap<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                String name = it.next();
                fields.put(name, sorted(node.get(name)));
            }
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            fields.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            node.forEach(child -> out.add(sorted(child)));
            return out;
        }
        return node;
    }

    private static String key(String hash) {
        return PREFIX + hash + ".json";
    }
}
