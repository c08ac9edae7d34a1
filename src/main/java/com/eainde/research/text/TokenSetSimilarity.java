package com.eainde.research.text;

import java.util.Locale;
import java.util.Set;

/**
 * Sørensen–Dice coefficient over folded content-token sets:
 * {@code 2·|A∩B| / (|A| + |B|)}.
 *
 * <pre>
 * "Raft is widely used in production"  vs  itself                              → 1.00
 * 5 tokens                             vs  the same 5 plus 1 more detail token → 0.91
 * 5 tokens                             vs  the same 5 plus 3 more              → 0.77
 * </pre>
 */
public class TokenSetSimilarity implements TextSimilarity {

    @Override
    public double score(String left, String right) {
        Set<String> a = TextTokens.contentTokens(left);
        Set<String> b = TextTokens.contentTokens(right);
        if (a.isEmpty() || b.isEmpty()) {
            return sameText(left, right) ? 1.0 : 0.0;
        }
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) shared++;
        }
        return (2.0 * shared) / (a.size() + b.size());
    }

    private static boolean sameText(String left, String right) {
        if (left == null || right == null) return false;
        return !left.isBlank()
                && left.trim().toLowerCase(Locale.ROOT).equals(right.trim().toLowerCase(Locale.ROOT));
    }
}
