package io.meshlite.server.protocol;

import io.meshlite.core.ContentRecord;
import io.meshlite.core.PeerRecord;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client side of the node-to-node protocol.
 * <p>
 * Implementations can be:
 *  - HTTP/JSON against a remote node ({@link HttpPeerProtocol}),
 *  - scripted in-process fakes for tests.
 * <p>
 * Every call is asynchronous and bounded by a timeout. Failures complete the
 * future exceptionally with {@link PeerUnreachableException} (no answer, or a
 * non-success status) or {@link ProtocolViolationException} (an answer of the
 * wrong shape). Implementations never touch node state; turning results into
 * peer-table updates is the caller's job.
 */
public interface PeerProtocol {

    /**
     * One-round discovery handshake: announce {@code self} (and optionally
     * {@code localTracks}) to host:port, and build a PeerRecord from the reply.
     * The returned record's availableContent is exactly the hash list the
     * remote returned.
     */
    CompletableFuture<PeerRecord> discover(String host, int port, PeerRecord self, Collection<String> localTracks);

    /** Liveness probe. Completes with the responder's peer id. */
    CompletableFuture<String> ping(String host, int port);

    /**
     * Download the raw bytes stored under {@code contentHash}.
     * Callers must verify the bytes against the hash; this method does not.
     */
    CompletableFuture<byte[]> fetchContent(PeerRecord peer, String contentHash);

    /** The remote node's local catalog. */
    CompletableFuture<List<ContentRecord>> listTracks(PeerRecord peer);

    /** The remote node's peer table. */
    CompletableFuture<List<PeerRecord>> listPeers(PeerRecord peer);

    /** Release client resources. */
    default void close() {
    }
}
