package com.sandy.aiot.gateway.tools;

import java.util.Locale;

/**
 * Edit distance for fuzzy device-name matching. Comparison is case-insensitive and trims input.
 */
public final class Levenshtein {

    private Levenshtein() {
    }

    public static int distance(String a, String b) {
        String s1 = normalize(a);
        String s2 = normalize(b);
        if (s1.equals(s2)) return 0;
        if (s1.isEmpty()) return s2.length();
        if (s2.isEmpty()) return s1.length();
        if (s1.length() > s2.length()) {
            String t = s1; s1 = s2; s2 = t;
        }
        int[] prev = new int[s1.length() + 1];
        int[] cur = new int[s1.length() + 1];
        for (int j = 0; j <= s1.length(); j++) prev[j] = j;
        for (int i = 1; i <= s2.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= s1.length(); j++) {
                int cost = s1.charAt(j - 1) == s2.charAt(i - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(prev[j] + 1, cur[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] swap = prev; prev = cur; cur = swap;
        }
        return prev[s1.length()];
    }

    /** 1.0 identical, 0.0 nothing in common. */
    public static double similarity(String a, String b) {
        String s1 = normalize(a);
        String s2 = normalize(b);
        int max = Math.max(s1.length(), s2.length());
        if (max == 0) return 1.0;
        return 1.0 - (double) distance(s1, s2) / max;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
