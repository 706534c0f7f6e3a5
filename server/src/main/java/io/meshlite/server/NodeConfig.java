package io.meshlite.server;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-node configuration parsed from CLI args, optionally seeded from JSON.
 *
 * Supports:
 *  - host:               address to bind and advertise to peers
 *  - port:               HTTP service port
 *  - dataDir:            root for the content store and catalog
 *  - bootstrapPeers:     peers to discover on start (host:port)
 *  - refreshSeconds:     delay between discovery refresh rounds (0 disables)
 *  - peerTtlSeconds:     evict peers not seen for this long (0 never evicts)
 *  - timeoutMillis:      bound on discovery/ping exchanges
 *  - fetchTimeoutMillis: bound on content downloads
 */
public record NodeConfig(
        String host,
        int port,
        String dataDir,
        List<PeerAddress> bootstrapPeers,
        long refreshSeconds,
        long peerTtlSeconds,
        long timeoutMillis,
        long fetchTimeoutMillis
) {

    public record PeerAddress(String host, int port) {
        public PeerAddress {
            Objects.requireNonNull(host, "host");
            if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        }

        /** Parse "host:port". */
        public static PeerAddress parse(String s) {
            Objects.requireNonNull(s, "address");
            int colon = s.lastIndexOf(':');
            if (colon <= 0 || colon == s.length() - 1) {
                throw new IllegalArgumentException("expected host:port, got: " + s);
            }
            try {
                return new PeerAddress(s.substring(0, colon), Integer.parseInt(s.substring(colon + 1)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid port in: " + s, e);
            }
        }

        @Override
        public String toString() {
            return host + ":" + port;
        }
    }

    public NodeConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(dataDir, "dataDir");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (refreshSeconds < 0) throw new IllegalArgumentException("refreshSeconds must be >= 0");
        if (peerTtlSeconds < 0) throw new IllegalArgumentException("peerTtlSeconds must be >= 0");
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be > 0");
        if (fetchTimeoutMillis <= 0) throw new IllegalArgumentException("fetchTimeoutMillis must be > 0");
        bootstrapPeers = bootstrapPeers == null ? List.of() : List.copyOf(bootstrapPeers);
    }

    /** Defaults for local dev, with an explicit host/port/data dir. */
    public static NodeConfig defaults(String host, int port, String dataDir) {
        return new NodeConfig(host, port, dataDir, List.of(), 30, 0, 10_000, 60_000);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --host,       -H   <host>
     *   --port,       -p   <port>
     *   --data-dir,   -d   <path>
     *   --peer,       -P   <host:port>   (repeatable)
     *   --refresh-seconds <seconds>
     *   --peer-ttl-seconds <seconds>
     *   --timeout-ms <millis>
     *   --fetch-timeout-ms <millis>
     *   --config,     -c   <path>        JSON file; flags after it override its values
     *   --help,       -h
     *
     * @throws IllegalArgumentException on a missing or malformed value
     */
    public static NodeConfig fromArgs(String[] args) {
        // Defaults
        String host = "127.0.0.1";
        int port = 8080;
        String dataDir = Path.of(System.getProperty("user.home"), ".meshlite").toString();
        List<PeerAddress> peers = new ArrayList<>();
        long refreshSeconds = 30;
        long peerTtlSeconds = 0;
        long timeoutMillis = 10_000;
        long fetchTimeoutMillis = 60_000;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--host", "-H" -> host = valueAt(args, ++i, "--host");

                case "--port", "-p" -> port = parseInt(valueAt(args, ++i, "--port"), "port");

                case "--data-dir", "-d" -> dataDir = valueAt(args, ++i, "--data-dir");

                case "--peer", "-P" -> peers.add(PeerAddress.parse(valueAt(args, ++i, "--peer")));

                case "--refresh-seconds" -> refreshSeconds = parseLong(valueAt(args, ++i, "--refresh-seconds"), "refresh-seconds");

                case "--peer-ttl-seconds" -> peerTtlSeconds = parseLong(valueAt(args, ++i, "--peer-ttl-seconds"), "peer-ttl-seconds");

                case "--timeout-ms" -> timeoutMillis = parseLong(valueAt(args, ++i, "--timeout-ms"), "timeout-ms");

                case "--fetch-timeout-ms" -> fetchTimeoutMillis = parseLong(valueAt(args, ++i, "--fetch-timeout-ms"), "fetch-timeout-ms");

                case "--config", "-c" -> {
                    JsonNodeConfig json = loadJson(Path.of(valueAt(args, ++i, "--config")));
                    if (json.host != null) host = json.host;
                    if (json.port != null) port = json.port;
                    if (json.dataDir != null) dataDir = json.dataDir;
                    if (json.peers != null) json.peers.forEach(p -> peers.add(PeerAddress.parse(p)));
                    if (json.refreshSeconds != null) refreshSeconds = json.refreshSeconds;
                    if (json.peerTtlSeconds != null) peerTtlSeconds = json.peerTtlSeconds;
                    if (json.timeoutMs != null) timeoutMillis = json.timeoutMs;
                    if (json.fetchTimeoutMs != null) fetchTimeoutMillis = json.fetchTimeoutMs;
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new NodeConfig(
                host,
                port,
                dataDir,
                peers,
                refreshSeconds,
                peerTtlSeconds,
                timeoutMillis,
                fetchTimeoutMillis
        );
    }

    public Path contentDir() {
        return Path.of(dataDir, "content");
    }

    public Path catalogFile() {
        return Path.of(dataDir, "catalog.json");
    }

    /** JSON shape accepted by --config. Every field is optional. */
    public static class JsonNodeConfig {
        public String host;
        public Integer port;
        public String dataDir;
        public List<String> peers;
        public Long refreshSeconds;
        public Long peerTtlSeconds;
        public Long timeoutMs;
        public Long fetchTimeoutMs;
    }

    static JsonNodeConfig loadJson(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), JsonNodeConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load node config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static String valueAt(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + option);
        }
        return args[i];
    }

    private static int parseInt(String s, String name) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + s, e);
        }
    }

    private static long parseLong(String s, String name) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + s, e);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: meshlite-node [options]

            Options:
              --host,         -H   Host to bind and advertise (default: 127.0.0.1)
              --port,         -p   HTTP port (default: 8080)
              --data-dir,     -d   Data directory (default: ~/.meshlite)
              --peer,         -P   Bootstrap peer host:port (repeatable)
              --refresh-seconds    Discovery refresh interval, 0 disables (default: 30)
              --peer-ttl-seconds   Evict peers unseen for this long, 0 never (default: 0)
              --timeout-ms         Discovery/ping timeout (default: 10000)
              --fetch-timeout-ms   Content download timeout (default: 60000)
              --config,       -c   JSON config file; later flags override it
              --help,         -h   Show this help message
            """);
        System.exit(0);
    }
}
