package io.meshlite.storage;

import io.meshlite.core.ContentHash;
import io.meshlite.core.ContentNotFoundException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Content store backed by one file per object on local disk.
 * <p>
 * Layout:
 *   root/
 *     ab/abcdef0123...   (shard directory = first two hex chars of the hash)
 *     .tmp/              (in-flight writes)
 * <p>
 * Sharding by hash prefix caps any single directory at a 1/256 slice of the
 * catalog.
 * <p>
 * Atomicity:
 *   - bytes are written and fsynced to a unique file under .tmp/,
 *   - then moved into place with ATOMIC_MOVE,
 *   - so a crash or I/O error mid-write never exposes a partial object.
 * <p>
 * The directory is owned by a single process; concurrent writers from
 * several processes are not supported.
 */
public final class FileContentStore implements ContentStore {
    private static final Logger log = Logger.getLogger(FileContentStore.class.getName());
    private static final String TMP_DIR = ".tmp";

    private final Path root;
    private final Path tmp;

    public FileContentStore(Path root) {
        this.root = root;
        this.tmp = root.resolve(TMP_DIR);
        try {
            Files.createDirectories(root);
            Files.createDirectories(tmp);
        } catch (IOException e) {
            throw new StorageException("failed to initialize content store at " + root, e);
        }
        clearStaleTempFiles();
        log.info("Content store initialized at " + root);
    }

    @Override
    public String store(byte[] content) {
        String hash = ContentHash.of(content);
        write(hash, content);
        return hash;
    }

    @Override
    public void store(String contentHash, byte[] content) {
        ContentHash.requireValid(contentHash);
        if (!ContentHash.matches(content, contentHash)) {
            throw new IllegalArgumentException("content does not hash to " + contentHash);
        }
        write(contentHash, content);
    }

    @Override
    public byte[] retrieve(String contentHash) {
        Path path = pathFor(contentHash);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ContentNotFoundException(contentHash);
        } catch (IOException e) {
            throw new StorageException("failed to read " + contentHash, e);
        }
    }

    @Override
    public boolean exists(String contentHash) {
        if (!ContentHash.isValid(contentHash)) {
            return false;
        }
        return Files.isRegularFile(pathFor(contentHash));
    }

    @Override
    public boolean delete(String contentHash) {
        try {
            boolean removed = Files.deleteIfExists(pathFor(contentHash));
            if (removed) {
                log.info("Deleted content " + ContentHash.shortForm(contentHash));
            }
            return removed;
        } catch (IOException e) {
            throw new StorageException("failed to delete " + contentHash, e);
        }
    }

    @Override
    public List<String> list() {
        List<String> out = new ArrayList<>();
        try (Stream<Path> objects = objectFiles()) {
            objects.forEach(p -> out.add(p.getFileName().toString()));
        }
        return out;
    }

    @Override
    public long totalBytes() {
        try (Stream<Path> objects = objectFiles()) {
            return objects.mapToLong(p -> {
                try {
                    return Files.size(p);
                } catch (IOException e) {
                    throw new StorageException("failed to stat " + p, e);
                }
            }).sum();
        }
    }

    /** Final location of an object: root/hash[0:2]/hash. */
    Path pathFor(String contentHash) {
        ContentHash.requireValid(contentHash);
        return root.resolve(contentHash.substring(0, 2)).resolve(contentHash);
    }

    // ---------- internals ----------

    private void write(String hash, byte[] content) {
        Path dst = pathFor(hash);
        if (Files.exists(dst)) {
            log.fine(() -> "Content " + ContentHash.shortForm(hash) + " already stored");
            return;
        }

        Path staged = null;
        try {
            Files.createDirectories(dst.getParent());
            staged = Files.createTempFile(tmp, hash.substring(0, 8) + "-", ".part");
            try (FileChannel ch = FileChannel.open(staged, WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(content);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            try {
                Files.move(staged, dst, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                // .tmp lives under root, so this only happens on exotic filesystems.
                Files.move(staged, dst);
            }
            staged = null;
            log.info("Stored content " + ContentHash.shortForm(hash) + " (" + content.length + " bytes)");
        } catch (IOException e) {
            throw new StorageException("failed to store " + hash, e);
        } finally {
            if (staged != null) {
                deleteQuietly(staged);
            }
        }
    }

    private Stream<Path> objectFiles() {
        try {
            return Files.walk(root, 2)
                    .filter(p -> !p.startsWith(tmp))
                    .filter(Files::isRegularFile)
                    .filter(p -> ContentHash.isValid(p.getFileName().toString()));
        } catch (IOException e) {
            throw new StorageException("failed to list " + root, e);
        }
    }

    private void clearStaleTempFiles() {
        try (DirectoryStream<Path> leftovers = Files.newDirectoryStream(tmp)) {
            for (Path p : leftovers) {
                deleteQuietly(p);
            }
        } catch (IOException e) {
            throw new StorageException("failed to scan " + tmp, e);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.log(Level.WARNING, "could not remove staged file " + p, e);
        }
    }
}
