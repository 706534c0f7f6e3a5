package io.meshlite.server.refresh;

import io.meshlite.core.PeerRecord;
import io.meshlite.server.MeshNode;
import io.meshlite.server.NodeConfig;
import io.meshlite.server.protocol.Failures;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background daemon that keeps the peer table warm.
 *
 * Each round:
 *  1) re-runs discovery against every known peer (refreshes lastSeen and
 *     their advertised content),
 *  2) dials bootstrap addresses that are not in the peer table yet,
 *  3) evicts peers not seen within the TTL, if a TTL is configured.
 *
 * A single-threaded scheduler with a fixed delay means at most one round runs
 * at a time; a round waits for its handshakes before the next delay starts.
 */
public final class PeerRefreshDaemon {
    private static final Logger log = Logger.getLogger(PeerRefreshDaemon.class.getName());

    private final MeshNode node;
    private final List<NodeConfig.PeerAddress> bootstrap;
    private final Duration interval;
    private final Duration peerTtl; // Duration.ZERO disables eviction
    private final ScheduledExecutorService scheduler;

    public PeerRefreshDaemon(MeshNode node,
                             List<NodeConfig.PeerAddress> bootstrap,
                             Duration interval,
                             Duration peerTtl) {
        this.node = Objects.requireNonNull(node, "node");
        this.bootstrap = List.copyOf(bootstrap);
        this.interval = Objects.requireNonNull(interval, "interval");
        this.peerTtl = Objects.requireNonNull(peerTtl, "peerTtl");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "peer-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    public static PeerRefreshDaemon fromConfig(MeshNode node, NodeConfig cfg) {
        return new PeerRefreshDaemon(
                node,
                cfg.bootstrapPeers(),
                Duration.ofSeconds(cfg.refreshSeconds()),
                Duration.ofSeconds(cfg.peerTtlSeconds())
        );
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(
                this::tickSafe,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("Peer refresh every " + interval.toSeconds() + "s"
                + (peerTtl.isZero() ? "" : ", evicting after " + peerTtl.toSeconds() + "s"));
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            tick();
        } catch (Exception e) {
            log.log(Level.WARNING, "peer refresh round failed", e);
        }
    }

    /** One refresh round; blocks until every handshake of the round has settled. */
    void tick() {
        List<CompletableFuture<?>> round = new ArrayList<>();
        round.add(node.refreshPeers());

        Set<String> known = new HashSet<>();
        for (PeerRecord p : node.peers()) {
            known.add(p.address());
        }
        for (NodeConfig.PeerAddress addr : bootstrap) {
            if (known.contains(addr.toString())) {
                continue;
            }
            round.add(node.connectToPeer(addr.host(), addr.port()).exceptionally(err -> {
                log.warning("Bootstrap peer " + addr + " rejected discovery: "
                        + Failures.unwrap(err).getMessage());
                return Optional.empty();
            }));
        }
        CompletableFuture.allOf(round.toArray(new CompletableFuture<?>[0])).join();

        if (!peerTtl.isZero()) {
            int evicted = node.evictStalePeers(peerTtl);
            if (evicted > 0) {
                log.info("Evicted " + evicted + " stale peers");
            }
        }
    }
}
