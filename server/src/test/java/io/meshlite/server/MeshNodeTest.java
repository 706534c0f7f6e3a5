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
import io.meshlite.server.protocol.PeerUnreachableException;
import io.meshlite.server.protocol.ProtocolViolationException;
import io.meshlite.storage.FileCatalogStore;
import io.meshlite.storage.FileContentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MeshNode behavior against a scripted PeerProtocol. The node is never started,
 * so nothing here binds a port.
 */
class MeshNodeTest {

    private static final byte[] ABC = "abc".getBytes(StandardCharsets.US_ASCII);
    private static final String H_ABC = ContentHash.of(ABC);
    private static final byte[] XYZ = "xyz".getBytes(StandardCharsets.US_ASCII);
    private static final String H_XYZ = ContentHash.of(XYZ);

    @TempDir
    Path dataDir;

    private ScriptedPeerProtocol protocol;
    private FileContentStore store;
    private MeshNode node;

    @BeforeEach
    void setUp() {
        protocol = new ScriptedPeerProtocol();
        node = newNode(protocol);
    }

    @AfterEach
    void tearDown() {
        node.close();
    }

    private MeshNode newNode(ScriptedPeerProtocol p) {
        store = new FileContentStore(dataDir.resolve("content"));
        return new MeshNode(
                new PeerRecord("self", "127.0.0.1", 19100),
                store,
                new FileCatalogStore(dataDir.resolve("catalog.json")),
                p,
                PeerSelectionPolicy.freshestFirst()
        );
    }

    private static PeerRecord remote(String id, int port, Instant lastSeen, String... hashes) {
        return new PeerRecord(id, "10.0.0.1", port, lastSeen, List.of(hashes), Map.of());
    }

    // ---------- local content ----------

    @Test
    void add_content_registers_record_and_advertises_hash() {
        ContentRecord rec = node.addContent(ABC, TrackMetadata.of("Song", "Artist", 180));

        assertEquals(H_ABC, rec.contentHash());
        assertEquals(3, rec.size());
        assertEquals(Optional.of(rec), node.getTrack(H_ABC));
        assertTrue(node.selfDescription().hasContent(H_ABC));
        assertArrayEquals(ABC, node.readContent(H_ABC));
    }

    @Test
    void adding_same_bytes_twice_keeps_first_record() {
        ContentRecord first = node.addContent(ABC, TrackMetadata.of("First", "A", 1));
        ContentRecord second = node.addContent(ABC, TrackMetadata.of("Second", "B", 2));

        assertSame(first, second);
        assertEquals(1, node.localContent().size());
        assertEquals("First", node.localContent().get(0).title());
        assertEquals(List.of(H_ABC), store.list());
    }

    @Test
    void catalog_survives_restart() {
        node.addContent(ABC, TrackMetadata.of("Song", "Artist", 180));
        node.close();

        node = newNode(new ScriptedPeerProtocol());

        assertEquals(1, node.localContent().size());
        assertEquals("Song", node.getTrack(H_ABC).orElseThrow().title());
        assertTrue(node.selfDescription().hasContent(H_ABC));
    }

    @Test
    void restored_entries_without_bytes_are_dropped() {
        node.addContent(ABC, TrackMetadata.of("Song", "Artist", 180));
        node.close();
        store.delete(H_ABC);

        node = newNode(new ScriptedPeerProtocol());

        assertTrue(node.localContent().isEmpty());
        assertFalse(node.selfDescription().hasContent(H_ABC));
    }

    @Test
    void concurrent_ingest_keeps_one_entry_per_hash() throws Exception {
        int payloads = 8;
        int tasks = 64;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ContentRecord>> results = new ArrayList<>();
        try {
            for (int i = 0; i < tasks; i++) {
                int n = i % payloads;
                results.add(pool.submit(() -> {
                    go.await();
                    byte[] bytes = ("payload-" + n).getBytes(StandardCharsets.US_ASCII);
                    return node.addContent(bytes, TrackMetadata.of("Track " + n, "Artist", n));
                }));
            }
            go.countDown();
            for (Future<ContentRecord> f : results) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Set<String> expected = new HashSet<>();
        for (int n = 0; n < payloads; n++) {
            expected.add(ContentHash.of(("payload-" + n).getBytes(StandardCharsets.US_ASCII)));
        }
        assertEquals(payloads, node.localContent().size());
        assertEquals(expected, Set.copyOf(store.list()));

        List<ContentRecord> persisted = new FileCatalogStore(dataDir.resolve("catalog.json")).load();
        assertEquals(expected, persisted.stream().map(ContentRecord::contentHash).collect(Collectors.toSet()));
        assertEquals(payloads, persisted.size());

        node.close();
        node = newNode(new ScriptedPeerProtocol());
        assertEquals(payloads, node.localContent().size());
    }

    @Test
    void lookups_reject_malformed_hash() {
        assertThrows(IllegalArgumentException.class, () -> node.getTrack(null));
        assertThrows(IllegalArgumentException.class, () -> node.getTrack("ABC"));
        assertThrows(IllegalArgumentException.class, () -> node.findContent(null));
        assertThrows(IllegalArgumentException.class, () -> node.findContent("../etc/passwd"));
    }

    @Test
    void read_content_of_unknown_hash_is_not_found() {
        assertThrows(ContentNotFoundException.class, () -> node.readContent(H_XYZ));
    }

    // ---------- discovery ----------

    @Test
    void successful_discovery_records_peer_with_advertised_content() {
        node.addContent(XYZ, TrackMetadata.of("Mine", "Me", 1));
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_ABC));

        Optional<PeerRecord> result = node.connectToPeer("10.0.0.1", 9001).join();

        assertTrue(result.isPresent());
        assertEquals("peer-a", result.get().peerId());
        PeerRecord stored = node.peer("peer-a").orElseThrow();
        assertEquals(Set.of(H_ABC), stored.availableContent());
        assertEquals(List.of(List.of(H_XYZ)), protocol.announcedTracks);
    }

    @Test
    void unreachable_peer_yields_empty_and_leaves_table_untouched() {
        Optional<PeerRecord> result = node.connectToPeer("10.0.0.9", 9009).join();

        assertTrue(result.isEmpty());
        assertTrue(node.peers().isEmpty());
    }

    @Test
    void protocol_violation_fails_and_leaves_table_untouched() {
        protocol.failDiscover("10.0.0.1", 9001,
                new ProtocolViolationException("10.0.0.1:9001", "missing peer_id"));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> node.connectToPeer("10.0.0.1", 9001).join());

        assertInstanceOf(ProtocolViolationException.class, ex.getCause());
        assertTrue(node.peers().isEmpty());
    }

    @Test
    void rediscovery_replaces_advertised_content() {
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();

        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_XYZ));
        node.connectToPeer("10.0.0.1", 9001).join();

        assertEquals(1, node.peers().size());
        assertEquals(Set.of(H_XYZ), node.peer("peer-a").orElseThrow().availableContent());
    }

    @Test
    void discovering_self_is_ignored() {
        protocol.answerDiscover("127.0.0.1", 19100, new PeerRecord("self", "127.0.0.1", 19100));

        assertTrue(node.connectToPeer("127.0.0.1", 19100).join().isEmpty());
        assertTrue(node.peers().isEmpty());
    }

    @Test
    void inbound_discover_records_caller_and_answers_with_local_hashes() {
        node.addContent(ABC, TrackMetadata.of("Song", "Artist", 1));
        PeerRecord caller = new PeerRecord("caller", "0.0.0.0", 9005, null, List.of(H_XYZ), Map.of());

        DiscoverResponse resp = node.handleDiscover(new DiscoverRequest(caller, List.of()), "192.168.1.7");

        assertEquals("self", resp.peer().peerId());
        assertEquals(List.of(H_ABC), resp.tracks());
        PeerRecord recorded = node.peer("caller").orElseThrow();
        assertEquals("192.168.1.7", recorded.host());
        assertEquals(9005, recorded.port());
        assertTrue(recorded.hasContent(H_XYZ));
    }

    @Test
    void inbound_discover_from_self_is_not_recorded() {
        node.handleDiscover(new DiscoverRequest(node.selfDescription(), null), "127.0.0.1");
        assertTrue(node.peers().isEmpty());
    }

    @Test
    void returned_peers_are_copies() {
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();

        node.peers().get(0).addContent(H_XYZ);

        assertFalse(node.peer("peer-a").orElseThrow().hasContent(H_XYZ));
    }

    // ---------- lookup ----------

    @Test
    void find_content_prefers_local_copy() {
        node.addContent(ABC, TrackMetadata.of("Song", "Artist", 1));
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();

        ContentLocation loc = node.findContent(H_ABC);

        assertInstanceOf(ContentLocation.Local.class, loc);
        assertTrue(((ContentLocation.Local) loc).catalogEntry().isPresent());
    }

    @Test
    void find_content_picks_most_recently_seen_peer() {
        Instant now = Instant.now();
        protocol.answerDiscover("10.0.0.1", 9001, remote("stale", 9001, now.minusSeconds(60), H_ABC));
        protocol.answerDiscover("10.0.0.1", 9002, remote("fresh", 9002, now, H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();
        node.connectToPeer("10.0.0.1", 9002).join();

        ContentLocation loc = node.findContent(H_ABC);

        assertInstanceOf(ContentLocation.Remote.class, loc);
        assertEquals("fresh", ((ContentLocation.Remote) loc).peerId());
    }

    @Test
    void find_content_with_no_source_is_not_found() {
        assertEquals(new ContentLocation.NotFound(H_XYZ), node.findContent(H_XYZ));
    }

    // ---------- fetch ----------

    @Test
    void fetch_downloads_verifies_and_caches() {
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_ABC));
        protocol.serve("peer-a", H_ABC, ABC);
        node.connectToPeer("10.0.0.1", 9001).join();

        assertArrayEquals(ABC, node.fetchContent(H_ABC).join());
        assertTrue(store.exists(H_ABC));

        // Second fetch is served locally.
        node.fetchContent(H_ABC).join();
        assertEquals(List.of("peer-a"), protocol.fetchCalls);

        ContentLocation loc = node.findContent(H_ABC);
        assertInstanceOf(ContentLocation.Local.class, loc);
        assertTrue(((ContentLocation.Local) loc).catalogEntry().isEmpty());
    }

    @Test
    void fetch_falls_back_when_first_peer_sends_wrong_bytes() {
        Instant now = Instant.now();
        protocol.answerDiscover("10.0.0.1", 9001, remote("liar", 9001, now, H_ABC));
        protocol.answerDiscover("10.0.0.1", 9002, remote("honest", 9002, now.minusSeconds(60), H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();
        node.connectToPeer("10.0.0.1", 9002).join();
        protocol.serve("liar", H_ABC, XYZ);
        protocol.serve("honest", H_ABC, ABC);

        assertArrayEquals(ABC, node.fetchContent(H_ABC).join());
        assertEquals(List.of("liar", "honest"), protocol.fetchCalls);
        assertArrayEquals(ABC, store.retrieve(H_ABC));
    }

    @Test
    void fetch_with_every_peer_down_is_unreachable() {
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_ABC));
        protocol.answerDiscover("10.0.0.1", 9002, remote("peer-b", 9002, null, H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();
        node.connectToPeer("10.0.0.1", 9002).join();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> node.fetchContent(H_ABC).join());

        assertInstanceOf(PeerUnreachableException.class, ex.getCause());
        assertEquals(2, ex.getCause().getSuppressed().length);
        assertFalse(store.exists(H_ABC));
    }

    @Test
    void fetch_where_every_peer_lies_is_protocol_violation() {
        protocol.answerDiscover("10.0.0.1", 9001, remote("liar", 9001, null, H_ABC));
        protocol.serve("liar", H_ABC, XYZ);
        node.connectToPeer("10.0.0.1", 9001).join();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> node.fetchContent(H_ABC).join());

        assertInstanceOf(ProtocolViolationException.class, ex.getCause());
        assertFalse(store.exists(H_ABC));
    }

    @Test
    void fetch_with_no_advertising_peer_is_not_found() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> node.fetchContent(H_XYZ).join());
        assertInstanceOf(ContentNotFoundException.class, ex.getCause());
        assertTrue(protocol.fetchCalls.isEmpty());
    }

    @Test
    void fetch_rejects_malformed_hash() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> node.fetchContent("not-a-hash").join());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    // ---------- peer maintenance ----------

    @Test
    void evict_removes_only_peers_older_than_max_age() {
        Instant now = Instant.now();
        protocol.answerDiscover("10.0.0.1", 9001, remote("old", 9001, now.minus(Duration.ofHours(1)), H_ABC));
        protocol.answerDiscover("10.0.0.1", 9002, remote("new", 9002, now, H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();
        node.connectToPeer("10.0.0.1", 9002).join();
        assertEquals(2, node.peers().size());

        assertEquals(1, node.evictStalePeers(Duration.ofMinutes(5)));
        assertTrue(node.peer("old").isEmpty());
        assertTrue(node.peer("new").isPresent());
    }

    @Test
    void ping_touches_known_peer_that_answers_with_its_id() {
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_ABC));
        node.connectToPeer("10.0.0.1", 9001).join();
        Instant before = node.peer("peer-a").orElseThrow().lastSeen();

        protocol.answerPing("10.0.0.1", 9001, "peer-a");
        assertTrue(node.pingPeer("peer-a").join());
        assertFalse(node.peer("peer-a").orElseThrow().lastSeen().isBefore(before));

        protocol.answerPing("10.0.0.1", 9001, "someone-else");
        assertFalse(node.pingPeer("peer-a").join());
        assertFalse(node.pingPeer("unknown").join());
    }

    @Test
    void stats_reflect_catalog_and_peer_table() {
        node.addContent(ABC, TrackMetadata.of("Song", "Artist", 1));
        protocol.answerDiscover("10.0.0.1", 9001, remote("peer-a", 9001, null, H_XYZ));
        node.connectToPeer("10.0.0.1", 9001).join();

        NodeStats stats = node.stats();

        assertEquals("self", stats.peerId());
        assertEquals("127.0.0.1:19100", stats.address());
        assertFalse(stats.running());
        assertEquals(1, stats.peers());
        assertEquals(1, stats.tracks());
        assertEquals(3L, stats.storageBytes());
    }
}
