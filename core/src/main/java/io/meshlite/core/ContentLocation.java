package io.meshlite.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Where a piece of content can be obtained, as answered by a content lookup.
 * <p>
 * Three outcomes:
 *  - {@link Local}:    this node stores the bytes.
 *  - {@link Remote}:   a known peer advertises the hash; fetch from it.
 *  - {@link NotFound}: neither this node nor any known peer claims it.
 */
public sealed interface ContentLocation
        permits ContentLocation.Local, ContentLocation.Remote, ContentLocation.NotFound {

    String contentHash();

    /**
     * @param contentHash requested hash
     * @param record      catalog entry, or null when the bytes were cached from a
     *                    peer and carry no local metadata
     */
    record Local(String contentHash, ContentRecord record) implements ContentLocation {
        public Local {
            Objects.requireNonNull(contentHash, "contentHash");
        }

        public Optional<ContentRecord> catalogEntry() {
            return Optional.ofNullable(record);
        }
    }

    /**
     * @param contentHash requested hash
     * @param peer        snapshot of the preferred peer at lookup time
     */
    record Remote(String contentHash, PeerRecord peer) implements ContentLocation {
        public Remote {
            Objects.requireNonNull(contentHash, "contentHash");
            Objects.requireNonNull(peer, "peer");
        }

        public String peerId() {
            return peer.peerId();
        }
    }

    record NotFound(String contentHash) implements ContentLocation {
        public NotFound {
            Objects.requireNonNull(contentHash, "contentHash");
        }
    }
}
