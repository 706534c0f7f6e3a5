package io.meshlite.server;

import io.meshlite.core.ContentHash;
import io.meshlite.core.ContentLocation;
import io.meshlite.core.ContentNotFoundException;
import io.meshlite.core.ContentRecord;
import io.meshlite.core.PeerRecord;
import io.meshlite.core.PeerSelectionPolicy;
import io.meshlite.core.TrackMetadata;
import io.meshlite.server.dto.DiscoverRequest;
import io.meshlite.server.dto.DiscoverResponse;
import io.meshlite.server.dto.NodeStats;
import io.meshlite.server.protocol.Failures;
import io.meshlite.server.protocol.HttpPeerProtocol;
import io.meshlite.server.protocol.PeerProtocol;
import io.meshlite.server.protocol.PeerUnreachableException;
import io.meshlite.server.protocol.ProtocolViolationException;
import io.meshlite.storage.CatalogStore;
import io.meshlite.storage.ContentStore;
import io.meshlite.storage.FileCatalogStore;
import io.meshlite.storage.FileContentStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One participant of the mesh.
 *
 * Responsibilities:
 *  - Own the local catalog (hash -> ContentRecord) and the peer table
 *    (peerId -> PeerRecord). Nothing else holds or mutates them; callers get
 *    copies.
 *  - Ingest content: hash, persist bytes via the ContentStore, register the record.
 *  - Drive outbound discovery through a {@link PeerProtocol} and fold the results
 *    into the peer table.
 *  - Answer content lookups (local, remote candidate, or not found) and fetch
 *    remote content with hash verification.
 *  - Bind and release the HTTP surface ({@link WebServer}).
 *
 * Lifecycle: stopped -> start() -> running -> stop() -> stopped. Every operation
 * except serving inbound requests works in both states.
 *
 * Concurrency:
 *  - Both maps are ConcurrentHashMaps; ingest of distinct hashes never contends,
 *    and duplicate ingests collapse on putIfAbsent.
 *  - Discovery and fetch are asynchronous; a handshake in flight with one peer
 *    blocks nothing else. The peer table is only written once a handshake has
 *    fully succeeded, so a failed or timed-out attempt leaves it untouched.
 */
public final class MeshNode implements AutoCloseable {
    private static final Logger log = Logger.getLogger(MeshNode.class.getName());

    private final PeerRecord self;
    private final ContentStore store;
    private final CatalogStore catalog;
    private final PeerProtocol protocol;
    private final PeerSelectionPolicy selectionPolicy;

    private final Map<String, ContentRecord> localContent = new ConcurrentHashMap<>();
    private final Map<String, PeerRecord> peers = new ConcurrentHashMap<>();
    private final Object catalogLock = new Object();

    // guarded by this
    private WebServer web;

    public MeshNode(PeerRecord self,
                    ContentStore store,
                    CatalogStore catalog,
                    PeerProtocol protocol,
                    PeerSelectionPolicy selectionPolicy) {
        this.self = Objects.requireNonNull(self, "self");
        this.store = Objects.requireNonNull(store, "store");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.selectionPolicy = Objects.requireNonNull(selectionPolicy, "selectionPolicy");
        restoreCatalog();
        log.info("Initialized node " + self);
    }

    /** Wire a node with file-backed storage and the HTTP protocol client. */
    public static MeshNode create(NodeConfig cfg) {
        var store = new FileContentStore(cfg.contentDir());
        var catalog = new FileCatalogStore(cfg.catalogFile());
        var protocol = new HttpPeerProtocol(
                Duration.ofMillis(cfg.timeoutMillis()),
                Duration.ofMillis(cfg.timeoutMillis()),
                Duration.ofMillis(cfg.fetchTimeoutMillis())
        );
        return new MeshNode(
                PeerRecord.newLocal(cfg.host(), cfg.port()),
                store,
                catalog,
                protocol,
                PeerSelectionPolicy.freshestFirst()
        );
    }

    // ---------- lifecycle ----------

    /**
     * Bind the HTTP surface. No-op if already running. If binding fails the
     * listener is released and the node stays stopped.
     */
    public synchronized void start() {
        if (web != null) {
            log.warning("Node already running");
            return;
        }
        WebServer candidate = new WebServer(self.host(), self.port(), this);
        candidate.start();
        web = candidate;
        log.info("Node started at " + self.address());
    }

    /** Release the HTTP surface. No-op if already stopped. */
    public synchronized void stop() {
        if (web == null) {
            return;
        }
        try {
            web.stop();
        } finally {
            web = null;
            log.info("Node stopped");
        }
    }

    public synchronized boolean isRunning() {
        return web != null;
    }

    @Override
    public void close() {
        stop();
        protocol.close();
    }

    // ---------- local content ----------

    /**
     * Ingest bytes with their metadata.
     *
     * Steps:
     *  1) Compute the content hash (bytes only).
     *  2) Persist bytes in the ContentStore (idempotent).
     *  3) Register the record unless this hash is already catalogued, in which
     *     case the existing record is returned unchanged.
     *  4) Persist the catalog.
     *
     * @throws io.meshlite.storage.StorageException if bytes or catalog cannot be written
     */
    public ContentRecord addContent(byte[] content, TrackMetadata metadata) {
        ContentRecord candidate = ContentRecord.create(content, metadata);
        String hash = candidate.contentHash();

        store.store(hash, content);

        ContentRecord existing = localContent.putIfAbsent(hash, candidate);
        if (existing != null) {
            log.fine(() -> "Track " + ContentHash.shortForm(hash) + " already in catalog");
            return existing;
        }
        self.addContent(hash);

        try {
            persistCatalog();
        } catch (RuntimeException e) {
            localContent.remove(hash, candidate);
            self.removeContent(hash);
            throw e;
        }
        log.info("Added track: " + candidate);
        return candidate;
    }

    /**
     * @throws IllegalArgumentException if {@code contentHash} is not a hex SHA-256 digest
     */
    public Optional<ContentRecord> getTrack(String contentHash) {
        ContentHash.requireValid(contentHash);
        return Optional.ofNullable(localContent.get(contentHash));
    }

    /** Snapshot of the local catalog, ordered by content hash. */
    public List<ContentRecord> localContent() {
        return localContent.values().stream()
                .sorted(Comparator.comparing(ContentRecord::contentHash))
                .toList();
    }

    /**
     * Bytes held by this node's store, catalogued or cached from a peer.
     *
     * @throws ContentNotFoundException if not stored locally
     */
    public byte[] readContent(String contentHash) {
        ContentHash.requireValid(contentHash);
        return store.retrieve(contentHash);
    }

    // ---------- peers ----------

    /** Self-description as announced to peers: identity, address, local hashes. */
    public PeerRecord selfDescription() {
        PeerRecord copy = self.copy();
        copy.touch();
        return copy;
    }

    public String peerId() {
        return self.peerId();
    }

    /** Snapshot of the peer table. Records are copies; mutating them has no effect here. */
    public List<PeerRecord> peers() {
        return peers.values().stream()
                .map(PeerRecord::copy)
                .sorted(Comparator.comparing(PeerRecord::peerId))
                .toList();
    }

    public Optional<PeerRecord> peer(String peerId) {
        PeerRecord p = peers.get(peerId);
        return p == null ? Optional.empty() : Optional.of(p.copy());
    }

    /**
     * Discovery handshake with host:port; on success the returned PeerRecord is
     * inserted into the peer table (replacing any previous entry for that peer id).
     *
     * Outcomes:
     *  - success: completes with the peer (a copy),
     *  - peer unreachable (refused, timeout, bad status): logged, completes with
     *    Optional.empty(),
     *  - protocol violation: completes exceptionally with ProtocolViolationException.
     *
     * The peer table is never touched by a failed attempt.
     */
    public CompletableFuture<Optional<PeerRecord>> connectToPeer(String host, int port) {
        CompletableFuture<PeerRecord> handshake;
        try {
            handshake = protocol.discover(host, port, selfDescription(), localHashes());
        } catch (RuntimeException e) {
            handshake = CompletableFuture.failedFuture(e);
        }

        return handshake.handle((peer, err) -> {
            if (err != null) {
                Throwable cause = Failures.unwrap(err);
                if (cause instanceof PeerUnreachableException) {
                    log.warning("Failed to connect to " + host + ":" + port + ": " + cause.getMessage());
                    return Optional.<PeerRecord>empty();
                }
                log.log(Level.WARNING, "Discovery with " + host + ":" + port + " failed", cause);
                throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
            }
            if (peer.peerId().equals(self.peerId())) {
                log.info("Ignoring discovery of self at " + host + ":" + port);
                return Optional.<PeerRecord>empty();
            }
            peers.put(peer.peerId(), peer.copy());
            log.info("Connected to peer " + peer);
            return Optional.of(peer.copy());
        });
    }

    /**
     * Server side of the handshake: record the caller from its self-description
     * and answer with ours.
     *
     * @param observedHost the caller's address as seen on the socket; replaces a
     *                     wildcard host in the self-description. May be null.
     */
    public DiscoverResponse handleDiscover(DiscoverRequest request, String observedHost) {
        PeerRecord announced = request.peer();
        if (!announced.peerId().equals(self.peerId())) {
            String host = isWildcard(announced.host()) && observedHost != null
                    ? observedHost
                    : announced.host();
            Set<String> advertised = new HashSet<>(announced.availableContent());
            advertised.addAll(request.tracks());

            PeerRecord caller = new PeerRecord(announced.peerId(), host, announced.port(),
                    null, advertised, announced.metadata());
            caller.touch();
            peers.put(caller.peerId(), caller);
            log.info("Discovered peer " + caller);
        }
        return new DiscoverResponse(selfDescription(), List.copyOf(localHashes()));
    }

    /**
     * Probe a known peer. Success refreshes its lastSeen. Failures are soft:
     * the future completes with false.
     */
    public CompletableFuture<Boolean> pingPeer(String peerId) {
        PeerRecord p = peers.get(peerId);
        if (p == null) {
            return CompletableFuture.completedFuture(false);
        }
        return protocol.ping(p.host(), p.port()).handle((answeredId, err) -> {
            if (err != null) {
                log.fine(() -> "Ping failed to " + p + ": " + Failures.unwrap(err).getMessage());
                return false;
            }
            if (!peerId.equals(answeredId)) {
                log.info("Peer at " + p.address() + " now answers as " + answeredId + ", not " + peerId);
                return false;
            }
            touchPeer(peerId);
            return true;
        });
    }

    /** Re-run discovery against every known peer. Individual failures are logged and skipped. */
    public CompletableFuture<Void> refreshPeers() {
        List<CompletableFuture<?>> rounds = new ArrayList<>();
        for (PeerRecord p : peers.values()) {
            rounds.add(connectToPeer(p.host(), p.port()).exceptionally(err -> {
                log.warning("Refresh of " + p + " failed: " + Failures.unwrap(err).getMessage());
                return Optional.empty();
            }));
        }
        return CompletableFuture.allOf(rounds.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Remove peers whose lastSeen is older than {@code maxAge}. Nothing in the
     * node calls this on its own; expiry is the caller's policy.
     *
     * @return number of peers removed
     */
    public int evictStalePeers(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge");
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        for (Map.Entry<String, PeerRecord> e : peers.entrySet()) {
            PeerRecord p = e.getValue();
            if (p.lastSeen().isBefore(cutoff) && peers.remove(e.getKey(), p)) {
                removed++;
                log.info("Evicted stale peer " + p + " (last seen " + p.lastSeen() + ")");
            }
        }
        return removed;
    }

    // ---------- lookup and fetch ----------

    /**
     * Where can {@code contentHash} be obtained?
     *  1) this node's catalog or store -> Local,
     *  2) otherwise the best-ranked peer advertising it -> Remote,
     *  3) otherwise NotFound.
     * Ranking among several advertising peers is the node's PeerSelectionPolicy
     * (freshest lastSeen first by default).
     *
     * @throws IllegalArgumentException if {@code contentHash} is not a hex SHA-256 digest
     */
    public ContentLocation findContent(String contentHash) {
        ContentHash.requireValid(contentHash);
        ContentRecord rec = localContent.get(contentHash);
        if (rec != null) {
            return new ContentLocation.Local(contentHash, rec);
        }
        if (store.exists(contentHash)) {
            return new ContentLocation.Local(contentHash, null);
        }
        List<PeerRecord> candidates = candidatesFor(contentHash);
        if (candidates.isEmpty()) {
            return new ContentLocation.NotFound(contentHash);
        }
        return new ContentLocation.Remote(contentHash, candidates.get(0).copy());
    }

    /**
     * Obtain the bytes for {@code contentHash}, from the local store or from the
     * mesh. Remote candidates are tried in policy order; bytes are verified
     * against the hash and cached in the local store before completing.
     *
     * Failures:
     *  - ContentNotFoundException: nobody advertises the hash,
     *  - PeerUnreachableException: peers advertise it but none delivered,
     *  - ProtocolViolationException: every peer that answered sent wrong bytes,
     *  - StorageException: local read or cache write failed.
     */
    public CompletableFuture<byte[]> fetchContent(String contentHash) {
        if (!ContentHash.isValid(contentHash)) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("invalid content hash: " + contentHash));
        }
        if (store.exists(contentHash)) {
            try {
                return CompletableFuture.completedFuture(store.retrieve(contentHash));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        List<PeerRecord> candidates = candidatesFor(contentHash);
        if (candidates.isEmpty()) {
            log.warning("No peers have track " + ContentHash.shortForm(contentHash));
            return CompletableFuture.failedFuture(new ContentNotFoundException(contentHash,
                    "content " + contentHash + " is not stored locally and no known peer advertises it"));
        }

        return fetchFrom(contentHash, candidates, 0, new ArrayList<>()).thenApply(bytes -> {
            store.store(contentHash, bytes);
            return bytes;
        });
    }

    public NodeStats stats() {
        return new NodeStats(
                self.peerId(),
                self.address(),
                isRunning(),
                peers.size(),
                localContent.size(),
                store.totalBytes()
        );
    }

    // ---------- internals ----------

    private CompletableFuture<byte[]> fetchFrom(String hash, List<PeerRecord> candidates, int index,
                                                List<Throwable> failures) {
        if (index >= candidates.size()) {
            return CompletableFuture.failedFuture(exhausted(hash, candidates.size(), failures));
        }

        PeerRecord peer = candidates.get(index);
        CompletableFuture<byte[]> attempt;
        try {
            attempt = protocol.fetchContent(peer, hash);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        return attempt
                .thenApply(bytes -> {
                    if (!ContentHash.matches(bytes, hash)) {
                        throw new ProtocolViolationException(peer.address(),
                                "peer " + peer.peerId() + " sent bytes that do not hash to " + hash);
                    }
                    return bytes;
                })
                .handle((bytes, err) -> {
                    if (err == null) {
                        touchPeer(peer.peerId());
                        log.info("Downloaded track " + ContentHash.shortForm(hash) + " from " + peer);
                        return CompletableFuture.completedFuture(bytes);
                    }
                    Throwable cause = Failures.unwrap(err);
                    failures.add(cause);
                    log.warning("Failed to download " + ContentHash.shortForm(hash) + " from " + peer
                            + ": " + cause.getMessage());
                    return fetchFrom(hash, candidates, index + 1, failures);
                })
                .thenCompose(Function.identity());
    }

    private static RuntimeException exhausted(String hash, int attempted, List<Throwable> failures) {
        boolean anyUnreachable = failures.stream().anyMatch(f -> !(f instanceof ProtocolViolationException));
        RuntimeException ex = anyUnreachable
                ? new PeerUnreachableException(hash,
                        "all " + attempted + " peers advertising " + hash + " failed")
                : new ProtocolViolationException(hash,
                        "all " + attempted + " peers advertising " + hash + " sent invalid data");
        failures.forEach(ex::addSuppressed);
        return ex;
    }

    private List<PeerRecord> candidatesFor(String contentHash) {
        List<PeerRecord> advertising = peers.values().stream()
                .filter(p -> p.hasContent(contentHash))
                .toList();
        return advertising.isEmpty() ? List.of() : selectionPolicy.rank(advertising);
    }

    private void touchPeer(String peerId) {
        PeerRecord p = peers.get(peerId);
        if (p != null) {
            p.touch();
        }
    }

    private Set<String> localHashes() {
        return new TreeSet<>(localContent.keySet());
    }

    private void persistCatalog() {
        synchronized (catalogLock) {
            catalog.save(List.copyOf(localContent.values()));
        }
    }

    private void restoreCatalog() {
        int dropped = 0;
        for (ContentRecord r : catalog.load()) {
            if (!store.exists(r.contentHash())) {
                dropped++;
                log.warning("Dropping catalog entry " + r + ": bytes missing from store");
                continue;
            }
            localContent.put(r.contentHash(), r);
            self.addContent(r.contentHash());
        }
        if (!localContent.isEmpty() || dropped > 0) {
            log.info("Restored " + localContent.size() + " catalog entries (" + dropped + " dropped)");
        }
    }

    private static boolean isWildcard(String host) {
        return "0.0.0.0".equals(host) || "::".equals(host) || "[::]".equals(host);
    }
}
