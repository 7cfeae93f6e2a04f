package selfheal.strategy;

/** String distance helpers shared by the strategies. */
final class TextSimilarity {

    private TextSimilarity() {}

    /** Classic Levenshtein edit distance. */
    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /** Levenshtein distance divided by the longer length: 0 identical, 1 disjoint. */
    static double normalizedDistance(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) return 0.0;
        return (double) levenshtein(a, b) / longest;
    }
}
