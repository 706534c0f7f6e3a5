package io.meshlite.storage;

import java.util.List;

/**
 * Durable, deduplicated byte storage addressed solely by content hash.
 * <p>
 * Semantics:
 *  - store() is idempotent: storing bytes that are already present is a
 *    successful no-op, since identical addresses imply identical bytes.
 *  - An object becomes visible to exists()/retrieve() only once it is
 *    completely written. A failed store leaves nothing behind.
 *  - retrieve() returns exactly the stored bytes, untouched.
 *  - I/O failures surface as {@link StorageException}.
 */
public interface ContentStore {

    /**
     * Hash {@code content} and persist it under that hash.
     *
     * @return the content hash
     */
    String store(byte[] content);

    /**
     * Persist {@code content} under a precomputed hash, verifying it first.
     *
     * @throws IllegalArgumentException if {@code content} does not hash to {@code contentHash}
     */
    void store(String contentHash, byte[] content);

    /**
     * @throws io.meshlite.core.ContentNotFoundException if no object has this hash
     */
    byte[] retrieve(String contentHash);

    /** Existence check that does not read the payload. */
    boolean exists(String contentHash);

    /** @return true if an object was removed */
    boolean delete(String contentHash);

    /** All stored hashes, in no particular order. */
    List<String> list();

    /** Sum of stored object sizes in bytes. */
    long totalBytes();
}
