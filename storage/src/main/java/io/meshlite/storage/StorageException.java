package io.meshlite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * A filesystem failure while storing or reading content (disk full,
 * permission denied, corruption). Always propagated to the caller.
 */
public class StorageException extends UncheckedIOException {

    public StorageException(String message, IOException cause) {
        super(message, cause);
    }
}
