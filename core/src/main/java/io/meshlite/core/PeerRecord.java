package io.meshlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * What this node believes about one participant of the mesh.
 * <p>
 * Fields:
 *  - peerId:           generated once by the peer itself; the identity key.
 *  - host/port:        where the peer is currently reachable.
 *  - availableContent: content hashes the peer has asserted it serves.
 *  - lastSeen:         time of the last successful interaction.
 * <p>
 * Pure bookkeeping: no networking here. The advertised set and lastSeen are
 * safe to update from multiple threads. Equality is by peerId only, so a peer
 * that moved to a new address is still the same peer.
 */
@JsonPropertyOrder({"peer_id", "host", "port", "last_seen", "available_content", "metadata"})
public final class PeerRecord {

    private final String peerId;
    private final String host;
    private final int port;
    private final Set<String> availableContent = ConcurrentHashMap.newKeySet();
    private final Map<String, String> metadata;
    private volatile Instant lastSeen;

    public PeerRecord(String peerId, String host, int port, Instant lastSeen,
                      Collection<String> availableContent, Map<String, String> metadata) {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(host, "host");
        if (peerId.isBlank()) throw new IllegalArgumentException("peerId must not be blank");
        if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);

        this.peerId = peerId;
        this.host = host;
        this.port = port;
        this.lastSeen = lastSeen == null ? Instant.now() : lastSeen;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (availableContent != null) {
            for (String hash : availableContent) {
                addContent(hash);
            }
        }
    }

    public PeerRecord(String peerId, String host, int port) {
        this(peerId, host, port, null, null, null);
    }

    /** Self-description for a new local node: a fresh random peer id. */
    public static PeerRecord newLocal(String host, int port) {
        return new PeerRecord(UUID.randomUUID().toString(), host, port);
    }

    /** Transport form reader. Missing identity fields reject the payload. */
    @JsonCreator
    public static PeerRecord fromTransport(
            @JsonProperty(value = "peer_id", required = true) String peerId,
            @JsonProperty(value = "host", required = true) String host,
            @JsonProperty(value = "port", required = true) int port,
            @JsonProperty("last_seen") String lastSeen,
            @JsonProperty("available_content") Collection<String> availableContent,
            @JsonProperty("metadata") Map<String, String> metadata
    ) {
        Instant seen = lastSeen == null ? null : Instant.parse(lastSeen);
        return new PeerRecord(peerId, host, port, seen, availableContent, metadata);
    }

    @JsonProperty("peer_id")
    public String peerId() {
        return peerId;
    }

    @JsonProperty("host")
    public String host() {
        return host;
    }

    @JsonProperty("port")
    public int port() {
        return port;
    }

    /** "host:port". */
    @JsonIgnore
    public String address() {
        return host + ":" + port;
    }

    @JsonIgnore
    public Instant lastSeen() {
        return lastSeen;
    }

    @JsonProperty("last_seen")
    String lastSeenIso() {
        return lastSeen.toString();
    }

    /** Sorted snapshot of the advertised hashes. */
    @JsonProperty("available_content")
    public Set<String> availableContent() {
        return new TreeSet<>(availableContent);
    }

    @JsonProperty("metadata")
    public Map<String, String> metadata() {
        return metadata;
    }

    /**
     * Record that this peer serves {@code contentHash}. Idempotent.
     *
     * @return true if the hash was not advertised before
     */
    public boolean addContent(String contentHash) {
        return availableContent.add(ContentHash.requireValid(contentHash));
    }

    /** @return true if the hash was advertised before */
    public boolean removeContent(String contentHash) {
        return availableContent.remove(contentHash);
    }

    public boolean hasContent(String contentHash) {
        return contentHash != null && availableContent.contains(contentHash);
    }

    /** Mark a successful interaction now. */
    public void touch() {
        touch(Instant.now());
    }

    /** Mark a successful interaction at {@code when}; never moves lastSeen backwards. */
    public synchronized void touch(Instant when) {
        Objects.requireNonNull(when, "when");
        if (when.isAfter(lastSeen)) {
            lastSeen = when;
        }
    }

    /** Independent copy, for handing state out without sharing the mutable set. */
    public PeerRecord copy() {
        return new PeerRecord(peerId, host, port, lastSeen, availableContent, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerRecord other)) return false;
        return peerId.equals(other.peerId);
    }

    @Override
    public int hashCode() {
        return peerId.hashCode();
    }

    @Override
    public String toString() {
        String shortId = peerId.length() > 8 ? peerId.substring(0, 8) + "..." : peerId;
        return "Peer(" + shortId + " @ " + address() + ", tracks=" + availableContent.size() + ")";
    }
}
