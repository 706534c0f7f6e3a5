package io.meshlite.server.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.meshlite.core.ContentHash;
import io.meshlite.core.PeerRecord;

import java.util.List;
import java.util.Objects;

/**
 * JSON response for POST /discover: the responder's self-description and the
 * content hashes it currently serves.
 *   {
 *     "peer":   { "peer_id": "...", "host": "127.0.0.1", "port": 9001, ... },
 *     "tracks": [ "ba7816bf...", ... ]
 *   }
 */
public record DiscoverResponse(
        @JsonProperty("peer") PeerRecord peer,
        @JsonProperty("tracks") List<String> tracks
) {
    @JsonCreator
    public DiscoverResponse(
            @JsonProperty(value = "peer", required = true) PeerRecord peer,
            @JsonProperty(value = "tracks", required = true) List<String> tracks
    ) {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.tracks = List.copyOf(Objects.requireNonNull(tracks, "tracks"));
        this.tracks.forEach(ContentHash::requireValid);
    }
}
