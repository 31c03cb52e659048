package com.evidence.consensus.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Generates stable, deterministic display keys for drugs.
 *
 * <p>Format: {@code DRG-{NAME}-{CHECKSUM}}, e.g. {@code DRG-UPADACITINIB-7A2F}. NAME is the
 * upper-cased name with everything but letters and digits removed, truncated to 50 characters.
 * CHECKSUM is the first 4 hex digits of the SHA-256 of NAME, or of {@code NAME:additional}
 * when additional data (such as a CAS number) is supplied to separate colliding names.</p>
 */
public final class DrugKeyGenerator {

    public static final String PREFIX = "DRG";
    private static final int CHECKSUM_LENGTH = 4;
    private static final int MAX_NAME_LENGTH = 50;
    private static final Pattern KEY_PATTERN = Pattern.compile("^DRG-[A-Z0-9]{1,50}-[A-F0-9]{4}$");

    private DrugKeyGenerator() {
        // Utility class
    }

    public static String generate(String genericName) {
        return generate(genericName, null);
    }

    /**
     * Generates a key.
     *
     * @throws IllegalArgumentException if the name has no letters or digits
     */
    public static String generate(String genericName, String additionalData) {
        String normalized = normalizeName(genericName);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Cannot generate drug key for name: '" + genericName + "'");
        }
        return PREFIX + "-" + normalized + "-" + checksum(normalized, additionalData);
    }

    /**
     * Same as {@link #generate(String, String)} but empty for names without letters or digits.
     */
    public static Optional<String> tryGenerate(String genericName, String additionalData) {
        String normalized = normalizeName(genericName);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PREFIX + "-" + normalized + "-" + checksum(normalized, additionalData));
    }

    public static boolean validate(String drugKey) {
        return drugKey != null && KEY_PATTERN.matcher(drugKey).matches();
    }

    public static Optional<String> extractName(String drugKey) {
        if (!validate(drugKey)) {
            return Optional.empty();
        }
        return Optional.of(drugKey.split("-")[1]);
    }

    static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String normalized = name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
        return normalized.length() > MAX_NAME_LENGTH ? normalized.substring(0, MAX_NAME_LENGTH) : normalized;
    }

    private static String checksum(String normalizedName, String additionalData) {
        String data = additionalData != null && !additionalData.isEmpty()
                ? normalizedName + ":" + additionalData
                : normalizedName;
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().withUpperCase().formatHex(hash).substring(0, CHECKSUM_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
