package domain.correct;

/**
 * Ratcliff/Obershelp similarity: {@code 2*M / (|a| + |b|)} where M is the
 * total length of the matching blocks found by repeatedly taking the longest
 * common substring and recursing on both sides of it.
 *
 * <p>Among equally long common substrings the one that ends first in
 * {@code a} wins, then the one that starts first in {@code b}.</p>
 */
public final class SimilarityRatio {

    private SimilarityRatio() {
    }

    public static double ratio(String a, String b) {
        String x = a == null ? "" : a;
        String y = b == null ? "" : b;
        int total = x.length() + y.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(x, y) / total;
    }

    static int matchingCharacters(String a, String b) {
        return matching(a, 0, a.length(), b, 0, b.length());
    }

    private static int matching(String a, int alo, int ahi, String b, int blo, int bhi) {
        if (alo >= ahi || blo >= bhi) return 0;

        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        // prev[j - blo] = length of common suffix ending at a[i-1], b[j]
        int width = bhi - blo;
        int[] prev = new int[width];
        int[] cur = new int[width];

        for (int i = alo; i < ahi; i++) {
            char ca = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                int k = 0;
                if (ca == b.charAt(j)) {
                    k = (j > blo ? prev[j - blo - 1] : 0) + 1;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
                cur[j - blo] = k;
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }

        if (bestSize == 0) return 0;
        return bestSize
                + matching(a, alo, bestI, b, blo, bestJ)
                + matching(a, bestI + bestSize, ahi, b, bestJ + bestSize, bhi);
    }
}
