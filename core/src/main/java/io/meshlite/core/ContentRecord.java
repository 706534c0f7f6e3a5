package io.meshlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one stored track plus its content address.
 * <p>
 * Invariants:
 *  - {@code contentHash} is the SHA-256 of the raw bytes only (see {@link ContentHash}).
 *  - Records are never mutated after construction; a new ingest creates a new record.
 * <p>
 * The same JSON shape is used for the on-disk catalog, {@code GET /tracks} and
 * the CLI, so the field names here are the wire contract.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentRecord(
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("title") String title,
        @JsonProperty("artist") String artist,
        @JsonProperty("album") String album,
        @JsonProperty("duration") int durationSeconds,
        @JsonProperty("size") long size,
        @JsonProperty("format") String format,
        @JsonProperty("year") Integer year,
        @JsonProperty("genre") String genre,
        @JsonProperty("metadata") Map<String, String> extra,
        @JsonProperty("timestamp") String timestamp
) {

    @JsonCreator
    public ContentRecord(
            @JsonProperty(value = "content_hash", required = true) String contentHash,
            @JsonProperty(value = "title", required = true) String title,
            @JsonProperty(value = "artist", required = true) String artist,
            @JsonProperty("album") String album,
            @JsonProperty("duration") int durationSeconds,
            @JsonProperty(value = "size", required = true) long size,
            @JsonProperty("format") String format,
            @JsonProperty("year") Integer year,
            @JsonProperty("genre") String genre,
            @JsonProperty("metadata") Map<String, String> extra,
            @JsonProperty("timestamp") String timestamp
    ) {
        this.contentHash = ContentHash.requireValid(contentHash);
        this.title = Objects.requireNonNull(title, "title");
        this.artist = Objects.requireNonNull(artist, "artist");
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("duration must be >= 0");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.album = album;
        this.durationSeconds = durationSeconds;
        this.size = size;
        this.format = (format == null || format.isBlank()) ? TrackMetadata.DEFAULT_FORMAT : format;
        this.year = year;
        this.genre = genre;
        this.extra = extra == null ? Map.of() : Map.copyOf(extra);
        this.timestamp = timestamp == null ? Instant.now().toString() : timestamp;
    }

    /**
     * Build a record for freshly ingested bytes. The hash is computed here,
     * from {@code content} alone.
     */
    public static ContentRecord create(byte[] content, TrackMetadata meta) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(meta, "meta");
        return new ContentRecord(
                ContentHash.of(content),
                meta.title(),
                meta.artist(),
                meta.album(),
                meta.durationSeconds(),
                content.length,
                meta.format(),
                meta.year(),
                meta.genre(),
                meta.extra(),
                null
        );
    }

    /** Metadata portion of this record, without address, size or timestamp. */
    public TrackMetadata toMetadata() {
        return new TrackMetadata(title, artist, album, durationSeconds, format, year, genre, extra);
    }

    @Override
    public String toString() {
        return artist + " - " + title + " (" + format + ", " + durationSeconds + "s, "
                + ContentHash.shortForm(contentHash) + ")";
    }
}
