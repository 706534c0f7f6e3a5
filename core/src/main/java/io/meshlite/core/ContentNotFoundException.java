package io.meshlite.core;

/**
 * The requested content hash is unknown: absent locally and, where the
 * operation consults the mesh, not advertised by any known peer.
 */
public class ContentNotFoundException extends RuntimeException {

    private final String contentHash;

    public ContentNotFoundException(String contentHash) {
        super("content not found: " + contentHash);
        this.contentHash = contentHash;
    }

    public ContentNotFoundException(String contentHash, String message) {
        super(message);
        this.contentHash = contentHash;
    }

    public String contentHash() {
        return contentHash;
    }
}
