package io.branchlite.storage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Store that maps each key to a file below a root directory.
 * <p>
 * Layout:
 *   - every key segment is percent-encoded: bytes outside {@code [A-Za-z0-9._-]} become
 *     {@code %XX}, and a segment made only of dots is encoded entirely,
 *   - leading segments become directories named {@code "<segment>~"}, the last one a file.
 * '~' never survives encoding, so {@code a} and {@code a/b} live at {@code a} and
 * {@code a~/b} and never clash. Example: {@code refs/heads/main} is {@code refs~/heads~/main}.
 * <p>
 * Atomicity:
 *   - put() writes "<file>~tmp" first, forces it to disk,
 *   - then renames it over "<file>" using ATOMIC_MOVE.
 * Leftover temp files from an interrupted write are removed when the store opens.
 * <p>
 * Conditional writes are serialized inside this instance only; separate processes
 * sharing a directory are not coordinated.
 */
public final class FileObjectStore implements ObjectStore {
    private static final Logger log = Logger.getLogger(FileObjectStore.class.getName());
    private static final char MARK = '~';
    private static final String DIR_SUFFIX = "~";
    private static final String TMP_SUFFIX = "~tmp";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Path root;
    private final Object writeLock = new Object();

    public FileObjectStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("Cannot create store directory " + this.root, e);
        }
        removeStaleTempFiles();
    }

    public Path root() { return root; }

    /** File that holds {@code key}, whether or not it exists. */
    public Path pathOf(String key) {
        String[] segments = ObjectStore.checkKey(key).split("/");
        Path p = root;
        for (int i = 0; i < segments.length - 1; i++) {
            p = p.resolve(encodeSegment(segments[i]) + DIR_SUFFIX);
        }
        return p.resolve(encodeSegment(segments[segments.length - 1]));
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = pathOf(key);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Cannot read " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] data) {
        Objects.requireNonNull(data, "data");
        synchronized (writeLock) {
            writeAtomically(key, data);
        }
    }

    @Override
    public boolean delete(String key) {
        Path file = pathOf(key);
        synchronized (writeLock) {
            try {
                boolean existed = Files.deleteIfExists(file);
                if (existed) pruneEmptyParents(file.getParent());
                return existed;
            } catch (IOException e) {
                throw new StorageException("Cannot delete " + key, e);
            }
        }
    }

    @Override
    public List<String> list(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(this::keyOf)
                    .flatMap(Optional::stream)
                    .filter(k -> k.startsWith(prefix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Cannot list " + root, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(pathOf(key));
    }

    @Override
    public String writeConditional(String key, byte[] data, String expectedVersion) {
        Objects.requireNonNull(data, "data");
        synchronized (writeLock) {
            String actual = version(key).orElse(null);
            if (!Objects.equals(actual, expectedVersion)) {
                throw new VersionMismatchException(key, expectedVersion, actual);
            }
            writeAtomically(key, data);
            return ObjectStore.versionOf(data);
        }
    }

    private void writeAtomically(String key, byte[] data) {
        Path dst = pathOf(key);
        Path tmp = dst.resolveSibling(dst.getFileName() + TMP_SUFFIX);
        try {
            Files.createDirectories(dst.getParent());
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(data);
                while (buf.hasRemaining()) ch.write(buf);
                ch.force(true);
            }
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + key, e);
        }
    }

    /** Key for a stored file, or empty for temp files and files this store did not write. */
    private Optional<String> keyOf(Path file) {
        Path rel = root.relativize(file);
        StringBuilder key = new StringBuilder();
        int last = rel.getNameCount() - 1;
        for (int i = 0; i <= last; i++) {
            String name = rel.getName(i).toString();
            if (i < last) {
                if (!name.endsWith(DIR_SUFFIX)) return Optional.empty();
                name = name.substring(0, name.length() - DIR_SUFFIX.length());
            }
            String segment = decodeSegment(name);
            if (segment == null) return Optional.empty();
            if (i > 0) key.append('/');
            key.append(segment);
        }
        return Optional.of(key.toString());
    }

    static String encodeSegment(String segment) {
        boolean dotsOnly = segment.chars().allMatch(ch -> ch == '.');
        StringBuilder out = new StringBuilder(segment.length());
        for (byte b : segment.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            boolean plain = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '_' || c == '-' || (c == '.' && !dotsOnly);
            if (plain) {
                out.append((char) c);
            } else {
                out.append('%').append(HEX[c >> 4]).append(HEX[c & 0xF]);
            }
        }
        return out.toString();
    }

    /** Inverse of {@link #encodeSegment}; null for names it cannot have produced. */
    static String decodeSegment(String name) {
        if (name.isEmpty() || name.indexOf(MARK) >= 0) return null;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(name.length());
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (ch != '%') {
                bytes.write(ch);
                continue;
            }
            if (i + 2 >= name.length()) return null;
            int hi = Character.digit(name.charAt(i + 1), 16);
            int lo = Character.digit(name.charAt(i + 2), 16);
            if (hi < 0 || lo < 0) return null;
            bytes.write((hi << 4) | lo);
            i += 2;
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private void pruneEmptyParents(Path dir) throws IOException {
        while (dir != null && !dir.equals(root)) {
            try {
                Files.delete(dir);
            } catch (DirectoryNotEmptyException e) {
                return;
            }
            dir = dir.getParent();
        }
    }

    private void removeStaleTempFiles() {
        try (Stream<Path> files = Files.walk(root)) {
            List<Path> stale = files.filter(p -> p.getFileName().toString().endsWith(TMP_SUFFIX)).toList();
            for (Path p : stale) {
                log.log(Level.WARNING, "Removing incomplete write " + root.relativize(p));
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot scan " + root, e);
        }
    }
}
