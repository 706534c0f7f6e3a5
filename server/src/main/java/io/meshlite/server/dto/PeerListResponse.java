package io.meshlite.server.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.meshlite.core.PeerRecord;

import java.util.List;

/** JSON response for GET /peers: {"peers":[...]}. */
public record PeerListResponse(@JsonProperty("peers") List<PeerRecord> peers) {

    @JsonCreator
    public PeerListResponse(@JsonProperty(value = "peers", required = true) List<PeerRecord> peers) {
        this.peers = peers == null ? List.of() : List.copyOf(peers);
    }
}
