package com.imperium.exhibitlinker.match;

/**
 * Levenshtein 编辑距离与归一化相似度。
 */
public final class EditDistance {

    public static int levenshtein(String s1, String s2) {
        int m = s1.length();
        int n = s2.length();
        if (m == 0) return n;
        if (n == 0) return m;
        if (s1.equals(s2)) return 0;

        int[] prev = new int[n + 1];
        int[] curr = new int[n + 1];
        for (int j = 0; j <= n; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= m; i++) {
            curr[0] = i;
            for (int j = 1; j <= n; j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[n];
    }

    /** 1 表示相同，0 表示完全不同 */
    public static double similarity(String s1, String s2) {
        int maxLength = Math.max(s1.length(), s2.length());
        return maxLength > 0 ? 1.0 - ((double) levenshtein(s1, s2) / maxLength) : 1.0;
    }

    private EditDistance() {}
}
