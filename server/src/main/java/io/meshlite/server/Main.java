package io.meshlite.server;

import io.meshlite.server.refresh.PeerRefreshDaemon;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single mesh node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire storage, protocol client and node (MeshNode.create).
 *  - Start the HTTP surface.
 *  - Discover bootstrap peers.
 *  - Start the background peer refresh daemon.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();

        NodeConfig cfg;
        try {
            cfg = NodeConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
            return;
        }

        var node = startNode(cfg);
        log.info(String.format("Node %s listening on http://%s:%d (data in %s)",
                node.peerId(), cfg.host(), cfg.port(), cfg.dataDir()));

        bootstrap(node, cfg);

        PeerRefreshDaemon daemon = null;
        if (cfg.refreshSeconds() > 0) {
            daemon = PeerRefreshDaemon.fromConfig(node, cfg);
            daemon.start();
        }

        final PeerRefreshDaemon refresh = daemon;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (refresh != null) {
                refresh.stop();
            }
            node.close();
        }, "shutdown"));
    }

    /** Wire and bind a node. A node that fails to bind is closed before the failure propagates. */
    static MeshNode startNode(NodeConfig cfg) {
        var node = MeshNode.create(cfg);
        try {
            node.start();
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Could not start node on " + cfg.host() + ":" + cfg.port(), e);
            node.close();
            throw e;
        }
        return node;
    }

    private static void bootstrap(MeshNode node, NodeConfig cfg) {
        List<CompletableFuture<?>> handshakes = new ArrayList<>();
        for (NodeConfig.PeerAddress addr : cfg.bootstrapPeers()) {
            handshakes.add(node.connectToPeer(addr.host(), addr.port()).exceptionally(err -> {
                log.log(Level.WARNING, "Bootstrap peer " + addr + " rejected discovery", err);
                return Optional.empty();
            }));
        }
        CompletableFuture.allOf(handshakes.toArray(new CompletableFuture<?>[0])).join();
        if (!handshakes.isEmpty()) {
            log.info("Bootstrap done: " + node.peers().size() + " peers known");
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("warning: could not load logging.properties: " + e.getMessage());
        }
    }
}
