package com.uimigrator.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic ID generation for tracked components.
 *
 * <p>IDs are the first 16 hex characters of a SHA-256 digest over the given parts, so the same
 * component discovered on another run or machine keeps its ID.
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;
    private static final String SEPARATOR = "\u0000";

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a short ID from one or more parts.
     *
     * <p>Parts are joined with a separator that cannot appear in a path, so
     * {@code ("ab", "c")} and {@code ("a", "bc")} yield different IDs.
     *
     * @param components parts to hash, e.g. name, normalized path and type label
     * @return 16-character lower-case hex ID
     * @throws IllegalArgumentException if no parts are given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return generateFullHash(String.join(SEPARATOR, components)).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Generates a short ID from a single string.
     *
     * @param input non-blank input
     * @return 16-character lower-case hex ID
     */
    public static String generateFromString(String input) {
        return generateFullHash(input).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Returns the full SHA-256 hex digest of a string.
     *
     * @param input non-blank input
     * @return 64-character lower-case hex digest
     */
    public static String generateFullHash(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
