package io.meshlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meshlite.core.ContentHash;
import io.meshlite.core.ContentNotFoundException;
import io.meshlite.core.ContentRecord;
import io.meshlite.core.TrackMetadata;
import io.meshlite.server.dto.DiscoverRequest;
import io.meshlite.server.dto.DiscoverResponse;
import io.meshlite.server.dto.IngestRequest;
import io.meshlite.server.dto.PeerListResponse;
import io.meshlite.server.dto.PingResponse;
import io.meshlite.server.dto.TrackListResponse;
import io.meshlite.storage.StorageException;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link MeshNode}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert node results back into JSON (or raw bytes for content).
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET  /ping               {"status":"ok","peer_id":...}
 *   - GET  /peers              peer table
 *   - GET  /tracks             local catalog
 *   - POST /discover           handshake; records the caller, answers with self
 *   - GET  /content/{hash}     raw bytes, application/octet-stream
 *   - GET  /admin/stats        node statistics
 *   - POST /admin/tracks       ingest a track (Base64 body)
 *
 * Status mapping: 400 bad input, 404 unknown path or content, 405 wrong method,
 * 413 oversized body, 500 storage or unexpected failure.
 *
 * Handlers that read request bodies or touch the content store run on Undertow's
 * worker pool, never on the IO thread.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 64 * 1024 * 1024; // 64 MiB

    private static final String CONTENT_PREFIX = "/content/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final MeshNode node;
    private final int maxBodyBytes;

    public WebServer(String host, int port, MeshNode node) {
        this(host, port, node, MAX_BODY_BYTES);
    }

    WebServer(String host, int port, MeshNode node, int maxBodyBytes) {
        this.node = node;
        this.maxBodyBytes = maxBodyBytes;
        this.server = Undertow.builder()
                .addHttpListener(port, host)
                .setHandler(this::route)
                .build();
    }

    /** Bind the listener. If binding fails, whatever was started is released before rethrowing. */
    public void start() {
        try {
            server.start();
        } catch (RuntimeException e) {
            try {
                server.stop();
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange exchange) throws Exception {
        var path = exchange.getRequestPath();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        switch (path) {
            case "/ping" -> onlyIf(exchange, "GET", this::handlePing);
            case "/peers" -> onlyIf(exchange, "GET", this::handlePeers);
            case "/tracks" -> onlyIf(exchange, "GET", this::handleTracks);
            case "/discover" -> onlyIf(exchange, "POST", blocking(this::handleDiscover));
            case "/admin/stats" -> onlyIf(exchange, "GET", blocking(this::handleStats));
            case "/admin/tracks" -> onlyIf(exchange, "POST", blocking(this::handleIngest));
            default -> {
                if (path.startsWith(CONTENT_PREFIX)) {
                    onlyIf(exchange, "GET", blocking(this::handleContent));
                } else {
                    send(exchange, 404, Map.of("error", "not found"));
                    RequestLogger.logRequest(exchange, 404);
                }
            }
        }
    }

    private void onlyIf(HttpServerExchange ex, String allowed, HttpHandler handler) throws Exception {
        if (!allowed.equals(ex.getRequestMethod().toString())) {
            ex.getResponseHeaders().put(Headers.ALLOW, allowed);
            send(ex, 405, Map.of("error", "method not allowed"));
            RequestLogger.logRequest(ex, 405);
            return;
        }
        handler.handleRequest(ex);
    }

    /** Move the handler off the IO thread and switch the exchange to blocking IO. */
    private static HttpHandler blocking(HttpHandler handler) {
        return ex -> {
            if (ex.isInIoThread()) {
                ex.dispatch(ex2 -> {
                    ex2.startBlocking();
                    handler.handleRequest(ex2);
                });
                return;
            }
            if (!ex.isBlocking()) {
                ex.startBlocking();
            }
            handler.handleRequest(ex);
        };
    }

    // ---------- handlers ----------

    /** GET /ping */
    private void handlePing(HttpServerExchange ex) {
        send(ex, 200, PingResponse.ok(node.peerId()));
        RequestLogger.logRequest(ex, 200);
    }

    /** GET /peers */
    private void handlePeers(HttpServerExchange ex) {
        send(ex, 200, new PeerListResponse(node.peers()));
        RequestLogger.logRequest(ex, 200);
    }

    /** GET /tracks */
    private void handleTracks(HttpServerExchange ex) {
        send(ex, 200, new TrackListResponse(node.localContent()));
        RequestLogger.logRequest(ex, 200);
    }

    /** POST /discover */
    private void handleDiscover(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        String caller = null;
        Throwable error = null;
        try {
            byte[] body = readBody(ex);
            if (body == null) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
                return;
            }
            var req = json.readValue(body, DiscoverRequest.class);
            caller = "peer=" + req.peer().peerId();
            DiscoverResponse resp = node.handleDiscover(req, sourceHost(ex));
            send(ex, status, resp);
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid discover request: " + jsonEx.getOriginalMessage()));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            sendFailure(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex, status, totalMs, -1, caller, error);
        }
    }

    /** GET /content/{hash} */
    private void handleContent(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        long storageMs = -1L;
        Throwable error = null;
        try {
            String hash = ex.getRequestPath().substring(CONTENT_PREFIX.length());
            if (!ContentHash.isValid(hash)) {
                status = 400;
                send(ex, status, Map.of("error", "invalid content hash"));
                return;
            }

            long sStart = System.nanoTime();
            byte[] bytes = node.readContent(hash);
            storageMs = (System.nanoTime() - sStart) / 1_000_000L;

            ex.setStatusCode(status);
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/octet-stream");
            ex.getResponseHeaders().put(Headers.CONTENT_LENGTH, bytes.length);
            ex.getResponseSender().send(ByteBuffer.wrap(bytes));
        } catch (ContentNotFoundException nf) {
            status = 404;
            send(ex, status, Map.of("error", "content not found"));
        } catch (Exception e) {
            status = 500;
            error = e;
            sendFailure(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex, status, totalMs, storageMs, null, error);
        }
    }

    /** GET /admin/stats */
    private void handleStats(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            send(ex, status, node.stats());
        } catch (Exception e) {
            status = 500;
            error = e;
            sendFailure(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex, status, totalMs, -1, null, error);
        }
    }

    /** POST /admin/tracks */
    private void handleIngest(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        long storageMs = -1L;
        String track = null;
        Throwable error = null;
        try {
            byte[] body = readBody(ex);
            if (body == null) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
                return;
            }
            var req = json.readValue(body, IngestRequest.class);
            if (req.contentBase64 == null) {
                throw new IllegalArgumentException("contentBase64 is required");
            }
            byte[] content = Base64.getDecoder().decode(req.contentBase64);
            var meta = new TrackMetadata(req.title, req.artist, req.album, req.duration,
                    req.format, req.year, req.genre, req.metadata);

            long sStart = System.nanoTime();
            ContentRecord rec = node.addContent(content, meta);
            track = "track=" + ContentHash.shortForm(rec.contentHash());
            storageMs = (System.nanoTime() - sStart) / 1_000_000L;

            send(ex, status, rec);
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException | NullPointerException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            sendFailure(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex, status, totalMs, storageMs, track, error);
        }
    }

    // ---------- helpers ----------

    /** Read the whole body, or return null if it exceeds the size limit. */
    private byte[] readBody(HttpServerExchange ex) throws IOException {
        long declared = ex.getRequestContentLength();
        if (declared > maxBodyBytes) {
            return null;
        }
        byte[] body = ex.getInputStream().readNBytes(maxBodyBytes + 1);
        return body.length > maxBodyBytes ? null : body;
    }

    private static String sourceHost(HttpServerExchange ex) {
        InetSocketAddress source = ex.getSourceAddress();
        if (source == null || source.getAddress() == null) {
            return null;
        }
        return source.getAddress().getHostAddress();
    }

    private void sendFailure(HttpServerExchange ex, Exception e) {
        String kind = e instanceof StorageException ? "storage failure" : e.getClass().getSimpleName();
        send(ex, 500, Map.of("error", kind, "message", String.valueOf(e.getMessage())));
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
