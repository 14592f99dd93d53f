package com.cvtailor.ai.service.text;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes text and derives content fingerprints.
 *
 * Normalization only removes formatting noise (Unicode compatibility forms,
 * whitespace runs, leading/trailing blanks); it never changes wording or
 * case, so two inputs share a fingerprint only when they read the same.
 */
public final class ContentHasher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int SKETCH_DIMENSIONS = 256;

    private ContentHasher() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String nfkc = Normalizer.normalize(text, Normalizer.Form.NFKC);
        return WHITESPACE.matcher(nfkc).replaceAll(" ").trim();
    }

    /**
     * SHA-256 of the normalized text, hex encoded.
     */
    public static String fingerprint(String text) {
        return sha256(normalize(text));
    }

    /**
     * Fingerprint of several parts, order-sensitive. Used for derived outputs
     * whose key spans more than one input (prompt + model).
     */
    public static String fingerprint(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (String part : parts) {
            String normalized = normalize(part);
            joined.append(normalized.length()).append(':').append(normalized).append('|');
        }
        return sha256(joined.toString());
    }

    /**
     * Cheap lexical vector (hashed character trigrams, case-folded) used to spot
     * near-duplicate inputs without calling an embedding provider.
     */
    public static float[] sketch(String text) {
        String normalized = normalize(text).toLowerCase(Locale.ROOT);
        float[] vector = new float[SKETCH_DIMENSIONS];
        if (normalized.length() < 3) {
            if (!normalized.isEmpty()) {
                vector[Math.floorMod(normalized.hashCode(), SKETCH_DIMENSIONS)] = 1f;
            }
            return vector;
        }
        for (int i = 0; i + 3 <= normalized.length(); i++) {
            int bucket = Math.floorMod(normalized.substring(i, i + 3).hashCode(), SKETCH_DIMENSIONS);
            vector[bucket] += 1f;
        }
        return vector;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
