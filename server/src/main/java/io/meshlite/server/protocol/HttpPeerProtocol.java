package io.meshlite.server.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meshlite.core.ContentRecord;
import io.meshlite.core.PeerRecord;
import io.meshlite.server.dto.DiscoverRequest;
import io.meshlite.server.dto.DiscoverResponse;
import io.meshlite.server.dto.PeerListResponse;
import io.meshlite.server.dto.PingResponse;
import io.meshlite.server.dto.TrackListResponse;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP/JSON implementation of {@link PeerProtocol}.
 * <p>
 * Talks to a remote node's service surface:
 *   POST /discover          handshake
 *   GET  /ping              liveness
 *   GET  /content/{hash}    raw bytes
 *   GET  /tracks, /peers    catalog and peer table
 * <p>
 * This class:
 *  - performs the request with java.net.http (non-blocking sendAsync),
 *  - bounds each exchange by a connect timeout plus a per-request timeout,
 *  - parses JSON with Jackson into explicit DTOs, so a malformed payload fails
 *    here as a ProtocolViolationException instead of further downstream.
 */
public final class HttpPeerProtocol implements PeerProtocol {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client;
    private final Duration requestTimeout;
    private final Duration transferTimeout;

    /**
     * @param connectTimeout  bound on opening the TCP connection
     * @param requestTimeout  bound on JSON exchanges (discover, ping, listings)
     * @param transferTimeout bound on content downloads
     */
    public HttpPeerProtocol(Duration connectTimeout, Duration requestTimeout, Duration transferTimeout) {
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.transferTimeout = Objects.requireNonNull(transferTimeout, "transferTimeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                .build();
    }

    /** Defaults: 5s connect, 10s for JSON calls, 60s for content. */
    public HttpPeerProtocol() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(60));
    }

    @Override
    public CompletableFuture<PeerRecord> discover(String host, int port, PeerRecord self,
                                                  Collection<String> localTracks) {
        String target = host + ":" + port;
        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(new DiscoverRequest(self, List.copyOf(localTracks)));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("cannot encode self-description", e));
        }

        HttpRequest req;
        try {
            req = request(target, host, port, "/discover", requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build();
        } catch (PeerUnreachableException e) {
            return CompletableFuture.failedFuture(e);
        }

        return sendJson(target, req, DiscoverResponse.class).thenApply(resp -> {
            PeerRecord remote = resp.peer();
            // Address is where we actually reached the peer; identity comes from the reply.
            PeerRecord peer = new PeerRecord(remote.peerId(), host, port, null, resp.tracks(), remote.metadata());
            peer.touch();
            return peer;
        });
    }

    @Override
    public CompletableFuture<String> ping(String host, int port) {
        String target = host + ":" + port;
        HttpRequest req;
        try {
            req = request(target, host, port, "/ping", requestTimeout).GET().build();
        } catch (PeerUnreachableException e) {
            return CompletableFuture.failedFuture(e);
        }

        return sendJson(target, req, PingResponse.class).thenApply(resp -> {
            if (!resp.isOk()) {
                throw new ProtocolViolationException(target, "ping status was " + resp.status());
            }
            return resp.peerId();
        });
    }

    @Override
    public CompletableFuture<byte[]> fetchContent(PeerRecord peer, String contentHash) {
        String target = peer.address();
        HttpRequest req;
        try {
            req = request(target, peer.host(), peer.port(), "/content/" + contentHash, transferTimeout).GET().build();
        } catch (PeerUnreachableException e) {
            return CompletableFuture.failedFuture(e);
        }
        return send(target, req, HttpResponse.BodyHandlers.ofByteArray()).thenApply(HttpResponse::body);
    }

    @Override
    public CompletableFuture<List<ContentRecord>> listTracks(PeerRecord peer) {
        HttpRequest req;
        try {
            req = request(peer.address(), peer.host(), peer.port(), "/tracks", requestTimeout).GET().build();
        } catch (PeerUnreachableException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendJson(peer.address(), req, TrackListResponse.class).thenApply(TrackListResponse::tracks);
    }

    @Override
    public CompletableFuture<List<PeerRecord>> listPeers(PeerRecord peer) {
        HttpRequest req;
        try {
            req = request(peer.address(), peer.host(), peer.port(), "/peers", requestTimeout).GET().build();
        } catch (PeerUnreachableException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendJson(peer.address(), req, PeerListResponse.class).thenApply(PeerListResponse::peers);
    }

    // ---------- helpers ----------

    private <T> CompletableFuture<T> sendJson(String target, HttpRequest req, Class<T> type) {
        return send(target, req, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(resp -> decode(target, resp.body(), type));
    }

    /**
     * Send and require a 200. Transport failures and other statuses become
     * PeerUnreachableException; the future never completes with a raw IOException.
     */
    private <B> CompletableFuture<HttpResponse<B>> send(String target, HttpRequest req,
                                                       HttpResponse.BodyHandler<B> handler) {
        return client.sendAsync(req, handler)
                .handle((resp, err) -> {
                    if (err != null) {
                        Throwable cause = Failures.unwrap(err);
                        throw new PeerUnreachableException(target,
                                "request " + req.method() + " " + req.uri().getPath() + " to " + target
                                        + " failed: " + describe(cause), cause);
                    }
                    if (resp.statusCode() != 200) {
                        throw new PeerUnreachableException(target,
                                "peer " + target + " returned HTTP " + resp.statusCode()
                                        + " for " + req.uri().getPath());
                    }
                    return resp;
                });
    }

    private static <T> T decode(String target, byte[] body, Class<T> type) {
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException | RuntimeException e) {
            throw new ProtocolViolationException(target,
                    "malformed " + type.getSimpleName() + " from " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Request builder for http://host:port/path. IPv6 literals are bracketed
     * by the URI constructor. An address that cannot form a usable URI is a peer
     * we cannot reach, so it fails the same way a refused connection does.
     */
    private static HttpRequest.Builder request(String target, String host, int port, String path,
                                               Duration timeout) {
        try {
            URI uri = new URI("http", null, host, port, path, null, null);
            return HttpRequest.newBuilder(uri).timeout(timeout);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new PeerUnreachableException(target, "invalid address " + target + ": " + e.getMessage(), e);
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + msg;
    }
}
