package io.meshlite.server.dto;

import java.util.Map;

/**
 * JSON body for POST /admin/tracks.
 * Example:
 *   {
 *     "title": "Mesh Melody",
 *     "artist": "Decentralized Artist",
 *     "duration": 180,
 *     "contentBase64": "U2FtcGxlIGF1ZGlv..."
 *   }
 */
public class IngestRequest {
    public String title;
    public String artist;
    public String album;
    public int duration;          // seconds
    public String format;
    public Integer year;
    public String genre;
    public Map<String, String> metadata;
    public String contentBase64;  // raw track bytes encoded as Base64
}
