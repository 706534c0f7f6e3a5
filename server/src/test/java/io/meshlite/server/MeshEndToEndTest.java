package io.meshlite.server;

import io.meshlite.core.ContentHash;
import io.meshlite.core.ContentRecord;
import io.meshlite.core.PeerRecord;
import io.meshlite.core.TrackMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two real nodes on loopback talking HTTP to each other.
 */
class MeshEndToEndTest {

    private static final int PORT_A = 19001;
    private static final int PORT_B = 19002;

    @TempDir
    Path tmp;

    private final List<MeshNode> nodes = new ArrayList<>();

    @AfterEach
    void stopNodes() {
        nodes.forEach(MeshNode::close);
    }

    private MeshNode startNode(String name, int port) {
        var cfg = NodeConfig.defaults("127.0.0.1", port, tmp.resolve(name).toString());
        MeshNode node = MeshNode.create(cfg);
        nodes.add(node);
        node.start();
        return node;
    }

    @Test
    void node_b_discovers_a_and_downloads_its_content() throws Exception {
        MeshNode a = startNode("a", PORT_A);
        ContentRecord rec = a.addContent("abc".getBytes(StandardCharsets.US_ASCII),
                TrackMetadata.of("Song", "Artist", 180));
        String h = rec.contentHash();
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", h);

        MeshNode b = startNode("b", PORT_B);
        Optional<PeerRecord> found = b.connectToPeer("127.0.0.1", PORT_A).join();

        assertTrue(found.isPresent());
        assertEquals(a.peerId(), found.get().peerId());
        assertEquals(Set.of(h), b.peer(a.peerId()).orElseThrow().availableContent());

        // A learned about B from the inbound handshake.
        assertEquals(PORT_B, a.peer(b.peerId()).orElseThrow().port());

        HttpRequest req = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + PORT_A + "/content/" + h))
                .GET().build();
        HttpResponse<byte[]> resp = HttpClient.newHttpClient().send(req, HttpResponse.BodyHandlers.ofByteArray());
        assertEquals(200, resp.statusCode());
        assertArrayEquals("abc".getBytes(StandardCharsets.US_ASCII), resp.body());

        assertArrayEquals("abc".getBytes(StandardCharsets.US_ASCII), b.fetchContent(h).join());
        assertArrayEquals("abc".getBytes(StandardCharsets.US_ASCII), b.readContent(h));
    }

    @Test
    void discovery_reports_every_advertised_hash() {
        MeshNode a = startNode("a", PORT_A);
        String h1 = a.addContent(new byte[]{1, 2, 3}, TrackMetadata.of("One", "X", 1)).contentHash();
        String h2 = a.addContent(new byte[]{4, 5, 6}, TrackMetadata.of("Two", "X", 2)).contentHash();

        MeshNode b = startNode("b", PORT_B);
        PeerRecord peer = b.connectToPeer("127.0.0.1", PORT_A).join().orElseThrow();

        assertEquals(Set.of(h1, h2), peer.availableContent());
        assertEquals("127.0.0.1:" + PORT_A, peer.address());
    }

    @Test
    void connecting_to_a_stopped_node_is_soft_failure() {
        MeshNode b = startNode("b", PORT_B);

        assertTrue(b.connectToPeer("127.0.0.1", PORT_A).join().isEmpty());
        assertTrue(b.peers().isEmpty());
    }

    @Test
    void restarted_node_serves_previous_content() {
        MeshNode a = startNode("a", PORT_A);
        String h = a.addContent("persisted".getBytes(StandardCharsets.UTF_8),
                TrackMetadata.of("Kept", "X", 1)).contentHash();
        a.close();
        nodes.remove(a);

        MeshNode again = startNode("a", PORT_A);
        assertTrue(again.getTrack(h).isPresent());
        assertTrue(ContentHash.matches(again.readContent(h), h));
    }
}
