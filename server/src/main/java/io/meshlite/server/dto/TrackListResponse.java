package io.meshlite.server.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.meshlite.core.ContentRecord;

import java.util.List;

/** JSON response for GET /tracks: {"tracks":[...]}. */
public record TrackListResponse(@JsonProperty("tracks") List<ContentRecord> tracks) {

    @JsonCreator
    public TrackListResponse(@JsonProperty(value = "tracks", required = true) List<ContentRecord> tracks) {
        this.tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }
}
