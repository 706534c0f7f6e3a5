package io.meshlite.server.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.meshlite.core.ContentHash;
import io.meshlite.core.PeerRecord;

import java.util.List;
import java.util.Objects;

/**
 * JSON body for POST /discover.
 * Example:
 *   {
 *     "peer":   { "peer_id": "...", "host": "127.0.0.1", "port": 9002, ... },
 *     "tracks": [ "ba7816bf...", ... ]
 *   }
 * "tracks" is optional; a caller may announce its catalog or only itself.
 */
public record DiscoverRequest(
        @JsonProperty("peer") PeerRecord peer,
        @JsonProperty("tracks") List<String> tracks
) {
    @JsonCreator
    public DiscoverRequest(
            @JsonProperty(value = "peer", required = true) PeerRecord peer,
            @JsonProperty("tracks") List<String> tracks
    ) {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.tracks = tracks == null ? List.of() : List.copyOf(tracks);
        this.tracks.forEach(ContentHash::requireValid);
    }
}
