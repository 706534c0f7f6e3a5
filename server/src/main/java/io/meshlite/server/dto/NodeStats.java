package io.meshlite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON response for GET /admin/stats.
 *
 * @param peerId       local peer id
 * @param address      advertised host:port
 * @param running      whether the HTTP surface is bound
 * @param peers        size of the peer table
 * @param tracks       size of the local catalog
 * @param storageBytes bytes held by the content store (catalog and cached objects)
 */
public record NodeStats(
        @JsonProperty("peer_id") String peerId,
        @JsonProperty("address") String address,
        @JsonProperty("running") boolean running,
        @JsonProperty("connected_peers") int peers,
        @JsonProperty("tracks") int tracks,
        @JsonProperty("storage_size") long storageBytes
) {}
