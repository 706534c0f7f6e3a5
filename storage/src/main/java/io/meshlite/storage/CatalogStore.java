package io.meshlite.storage;

import io.meshlite.core.ContentRecord;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for the node's local catalog (hash -> ContentRecord).
 * <p>
 * The catalog is small compared to the content itself, so implementations
 * rewrite it whole on every save. A save must be atomic: after a crash the
 * previous or the new catalog is visible, never a mix.
 */
public interface CatalogStore {

    /** @return previously saved records, or an empty list if nothing was saved yet */
    List<ContentRecord> load();

    void save(Collection<ContentRecord> records);
}
