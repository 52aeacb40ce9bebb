package com.ideia.contentgen.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text canonicalization shared by validation, deduplication and the hash index.
 *
 * <p>{@link #normalize(String)} applies, in order:
 * <ol>
 *   <li>lower-casing (locale independent)</li>
 *   <li>NFD decomposition and removal of combining marks (diacritics)</li>
 *   <li>every character that is not a letter, digit or whitespace becomes a space</li>
 *   <li>whitespace collapse and trim</li>
 * </ol>
 */
public final class TextNormalizer {
    private TextNormalizer() {}

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static String normalize(String input) {
        if (input == null) return "";
        String s = input.toLowerCase(Locale.ROOT);
        s = Normalizer.normalize(s, Normalizer.Form.NFD);
        s = COMBINING_MARKS.matcher(s).replaceAll("");
        s = NON_ALNUM.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    /** Fixed-width (40 hex chars) SHA-1 fingerprint of already normalized text. */
    public static String fingerprint(String normalized) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            byte[] d = md.digest((normalized == null ? "" : normalized).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(d);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /** Normalizes then fingerprints; returns null when nothing is left after normalization. */
    public static String fingerprintOf(String raw) {
        String n = normalize(raw);
        return n.isEmpty() ? null : fingerprint(n);
    }

    public static int wordCount(String s) {
        if (s == null) return 0;
        String t = s.trim();
        if (t.isEmpty()) return 0;
        return WHITESPACE.split(t).length;
    }
}
