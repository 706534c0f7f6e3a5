package io.meshlite.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.meshlite.core.ContentRecord;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * JSON catalog kept in a single file.
 * <p>
 * Format: a JSON array of ContentRecord transport objects, sorted by
 * content hash so that identical catalogs produce identical files.
 * <p>
 * Atomicity:
 *   - write "catalog.json.tmp" and fsync it,
 *   - then move over "catalog.json" using ATOMIC_MOVE.
 */
public final class FileCatalogStore implements CatalogStore {
    private static final TypeReference<List<ContentRecord>> RECORDS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public FileCatalogStore(Path file) {
        this.file = file;
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new StorageException("failed to create catalog directory for " + file, e);
        }
    }

    @Override
    public List<ContentRecord> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return List.copyOf(json.readValue(file.toFile(), RECORDS));
        } catch (IOException e) {
            throw new StorageException("failed to load catalog " + file, e);
        }
    }

    @Override
    public void save(Collection<ContentRecord> records) {
        List<ContentRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(ContentRecord::contentHash));

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            ByteBuffer buf = ByteBuffer.wrap(json.writeValueAsBytes(sorted));
            try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            try {
                Files.move(tmp, file, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("failed to save catalog " + file, e);
        }
    }
}
