package io.meshlite.core;

import java.util.Map;
import java.util.Objects;

/**
 * Descriptive metadata supplied by whoever ingests a track.
 * <p>
 * None of these fields participate in the content address; they are carried
 * into the {@link ContentRecord} as-is.
 *
 * @param title           track title (required)
 * @param artist          artist name (required)
 * @param album           album name, may be null
 * @param durationSeconds playing time in seconds, {@code >= 0}
 * @param format          audio container, defaults to "mp3"
 * @param year            release year, may be null
 * @param genre           genre, may be null
 * @param extra           free-form string attributes, never null
 */
public record TrackMetadata(
        String title,
        String artist,
        String album,
        int durationSeconds,
        String format,
        Integer year,
        String genre,
        Map<String, String> extra
) {
    public static final String DEFAULT_FORMAT = "mp3";

    public TrackMetadata {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(artist, "artist");
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0");
        }
        format = (format == null || format.isBlank()) ? DEFAULT_FORMAT : format;
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    /** Title/artist/duration only; everything else defaulted. */
    public static TrackMetadata of(String title, String artist, int durationSeconds) {
        return new TrackMetadata(title, artist, null, durationSeconds, null, null, null, null);
    }
}
