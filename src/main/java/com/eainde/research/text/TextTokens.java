package com.eainde.research.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word-level normalization shared by decomposition, claim dedup and theming.
 *
 * <p>Content tokens are lower-cased word tokens with stop words removed and a trailing
 * plural "s" folded ("systems" → "system"; "analysis", "status", "class" unchanged).</p>
 */
public final class TextTokens {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "nor", "of", "in", "on", "at", "to", "for",
            "from", "by", "with", "without", "about", "into", "over", "under", "as", "is", "are",
            "was", "were", "be", "been", "being", "am", "it", "its", "this", "that", "these",
            "those", "there", "their", "they", "them", "we", "our", "you", "your", "he", "she",
            "his", "her", "i", "me", "my", "do", "does", "did", "doing", "has", "have", "had",
            "having", "can", "could", "should", "would", "will", "shall", "may", "might", "must",
            "not", "no", "so", "than", "then", "too", "very", "also", "just", "what", "which",
            "who", "whom", "whose", "when", "where", "why", "how", "all", "any", "both", "each",
            "more", "most", "other", "some", "such", "only", "own", "same", "if", "because",
            "while", "between", "through", "during", "before", "after", "above", "below", "up",
            "down", "out", "off", "again", "further", "once", "here", "s", "t", "us", "vs");

    private TextTokens() {
    }

    /** Lower-cased words of {@code text} with stop words removed, original spelling, in order. */
    public static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank()) return words;
        for (String raw : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (!raw.isEmpty() && !STOP_WORDS.contains(raw)) {
                words.add(raw);
            }
        }
        return words;
    }

    /** Folded content tokens in first-seen order, without duplicates. */
    public static Set<String> contentTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String word : words(text)) {
            tokens.add(fold(word));
        }
        return tokens;
    }

    /** Folded content tokens in order, duplicates kept (used for frequency counting). */
    public static List<String> contentTokenList(String text) {
        List<String> tokens = new ArrayList<>();
        for (String word : words(text)) {
            tokens.add(fold(word));
        }
        return tokens;
    }

    static String fold(String word) {
        if (word.length() > 3 && word.endsWith("s")
                && !word.endsWith("ss") && !word.endsWith("us") && !word.endsWith("is")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
