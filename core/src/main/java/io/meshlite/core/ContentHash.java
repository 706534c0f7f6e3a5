package io.meshlite.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Content addressing: SHA-256 over raw content bytes, rendered as lowercase hex.
 * <p>
 * The hash is computed only over the payload, never over descriptive metadata,
 * so two byte-identical payloads always share one address. This is the
 * deduplication key for both the local store and the peer table.
 */
public final class ContentHash {

    private static final Pattern HEX_SHA256 = Pattern.compile("[0-9a-f]{64}");
    private static final HexFormat HEX = HexFormat.of();

    private ContentHash() {
        // utility
    }

    /**
     * Compute the content address of {@code content}.
     * Pure and deterministic: same bytes, same hash, across calls and restarts.
     */
    public static String of(byte[] content) {
        Objects.requireNonNull(content, "content");
        return HEX.formatHex(sha256().digest(content));
    }

    /** True if {@code hash} looks like a hex SHA-256 address produced by {@link #of(byte[])}. */
    public static boolean isValid(String hash) {
        return hash != null && HEX_SHA256.matcher(hash).matches();
    }

    /**
     * Validate and return {@code hash}.
     *
     * @throws IllegalArgumentException if the value is not a lowercase hex SHA-256 digest
     */
    public static String requireValid(String hash) {
        if (!isValid(hash)) {
            throw new IllegalArgumentException("invalid content hash: " + hash);
        }
        return hash;
    }

    /** True if {@code content} hashes to {@code expectedHash}. */
    public static boolean matches(byte[] content, String expectedHash) {
        return of(content).equals(expectedHash);
    }

    /** First 16 hex chars, for log lines. */
    public static String shortForm(String hash) {
        if (hash == null) {
            return "null";
        }
        return hash.length() <= 16 ? hash : hash.substring(0, 16) + "...";
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
