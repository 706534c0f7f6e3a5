package io.meshlite.server.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** JSON response for GET /ping: {"status":"ok","peer_id":"..."}. */
public record PingResponse(
        @JsonProperty("status") String status,
        @JsonProperty("peer_id") String peerId
) {
    public static final String OK = "ok";

    @JsonCreator
    public PingResponse(
            @JsonProperty(value = "status", required = true) String status,
            @JsonProperty(value = "peer_id", required = true) String peerId
    ) {
        this.status = Objects.requireNonNull(status, "status");
        this.peerId = Objects.requireNonNull(peerId, "peer_id");
    }

    public static PingResponse ok(String peerId) {
        return new PingResponse(OK, peerId);
    }

    public boolean isOk() {
        return OK.equals(status);
    }
}
