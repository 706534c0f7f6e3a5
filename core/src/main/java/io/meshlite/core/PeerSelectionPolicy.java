package io.meshlite.core;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Policy for ordering the peers that advertise the same content hash.
 * <p>
 * The first element of {@link #rank} is the peer a lookup reports; a fetch
 * walks the list in order until one peer delivers valid bytes. Nodes accept
 * any implementation, so callers can plug in latency- or load-aware ordering.
 */
public interface PeerSelectionPolicy {

    /**
     * Order candidates best-first. The input is never empty and every element
     * advertises the hash in question.
     */
    List<PeerRecord> rank(Collection<PeerRecord> candidates);

    /** Default policy: most recently seen peer first. */
    static PeerSelectionPolicy freshestFirst() {
        return new FreshestFirst();
    }

    /**
     * Prefers the peer with the newest lastSeen, the freshest liveness signal.
     * Ties are broken by peerId so the order is deterministic.
     */
    final class FreshestFirst implements PeerSelectionPolicy {
        private static final Comparator<PeerRecord> ORDER =
                Comparator.comparing(PeerRecord::lastSeen).reversed()
                        .thenComparing(PeerRecord::peerId);

        @Override
        public List<PeerRecord> rank(Collection<PeerRecord> candidates) {
            if (candidates == null || candidates.isEmpty())
                throw new IllegalArgumentException("candidates must not be empty");
            return candidates.stream().sorted(ORDER).toList();
        }
    }
}
