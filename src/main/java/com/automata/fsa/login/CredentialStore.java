package com.automata.fsa.login;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Identifier -> SHA-256 digest table used to validate login submissions.
 *
 * Only digests are kept in memory. Comparison goes through
 * {@link MessageDigest#isEqual(byte[], byte[])} so the time taken does not
 * depend on how many leading bytes match.
 */
public final class CredentialStore {
    private static final HexFormat HEX = HexFormat.of();

    private final Map<String, byte[]> digests;

    private CredentialStore(Map<String, byte[]> digests) {
        this.digests = digests;
    }

    /** Builds a store from clear-text secrets, hashing each one. */
    public static CredentialStore ofPlaintext(Map<String, String> secrets) {
        Map<String, byte[]> out = new HashMap<>(secrets.size() * 2);
        secrets.forEach((user, secret) -> out.put(user, sha256(secret)));
        return new CredentialStore(Collections.unmodifiableMap(out));
    }

    /**
     * Builds a store from hex-encoded SHA-256 digests, as found in
     * configuration files.
     *
     * @throws IllegalArgumentException if a digest is not 64 hex characters.
     */
    public static CredentialStore ofHexDigests(Map<String, String> hexDigests) {
        Map<String, byte[]> out = new HashMap<>(hexDigests.size() * 2);
        hexDigests.forEach((user, hex) -> {
            if (hex == null || hex.length() != 64)
                throw new IllegalArgumentException("Digest for '" + user + "' is not a SHA-256 hex string");
            out.put(user, HEX.parseHex(hex));
        });
        return new CredentialStore(Collections.unmodifiableMap(out));
    }

    public boolean isKnown(String identifier) {
        return identifier != null && digests.containsKey(identifier);
    }

    /** False for unknown identifiers and null secrets. */
    public boolean matches(String identifier, String secret) {
        if (identifier == null || secret == null)
            return false;
        byte[] expected = digests.get(identifier);
        return expected != null && MessageDigest.isEqual(expected, sha256(secret));
    }

    public int size() {
        return digests.size();
    }

    public static String sha256Hex(String secret) {
        return HEX.formatHex(sha256(secret));
    }

    static byte[] sha256(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
