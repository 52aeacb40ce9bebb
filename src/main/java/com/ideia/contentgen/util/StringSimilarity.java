package com.ideia.contentgen.util;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Sørensen–Dice coefficient over character bigrams, whitespace ignored. Scores are in [0, 1];
 * identical strings score 1.
 */
public final class StringSimilarity {
    private StringSimilarity() {}

    public static double compare(String first, String second) {
        String a = first == null ? "" : first.replaceAll("\\s+", "");
        String b = second == null ? "" : second.replaceAll("\\s+", "");
        if (a.equals(b)) return 1.0;
        if (a.length() < 2 || b.length() < 2) return 0.0;

        Map<String, Integer> bigrams = new HashMap<>();
        for (int i = 0; i < a.length() - 1; i++) {
            bigrams.merge(a.substring(i, i + 2), 1, Integer::sum);
        }
        int intersection = 0;
        for (int i = 0; i < b.length() - 1; i++) {
            String bg = b.substring(i, i + 2);
            Integer count = bigrams.get(bg);
            if (count != null && count > 0) {
                bigrams.put(bg, count - 1);
                intersection++;
            }
        }
        return (2.0 * intersection) / (a.length() + b.length() - 2);
    }

    /** Highest score of {@code candidate} against any entry; 0 for an empty collection. */
    public static double bestMatch(String candidate, Collection<String> targets) {
        double best = 0.0;
        if (targets == null) return best;
        for (String t : targets) {
            if (t == null) continue;
            double r = compare(candidate, t);
            if (r > best) {
                best = r;
                if (best >= 1.0) break;
            }
        }
        return best;
    }
}
