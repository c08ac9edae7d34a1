package com.eainde.research.theme;

import com.eainde.research.aggregate.AggregationResult;
import com.eainde.research.model.Claim;
import com.eainde.research.model.Theme;
import com.eainde.research.text.TextSimilarity;
import com.eainde.research.text.TextTokens;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Regroups deduplicated claims by theme, across subtopics.
 *
 * <p>Single-link clustering: two claims share a theme when their similarity reaches the
 * threshold or the aggregator cross-referenced them. Subtopic of origin plays no part.</p>
 *
 * <h3>Ordering:</h3>
 * <pre>
 * members: confidence (high first), then aggregation index
 * themes:  high count ↓, medium count ↓, distinct sources ↓, earliest member index ↑
 * title:   three most frequent content tokens (ties alphabetical), title-cased, " / "-joined
 * </pre>
 */
@Log4j2
public class ThemeOrganizer {

    static final String FALLBACK_TITLE = "General findings";
    private static final int TITLE_TOKENS = 3;

    private final TextSimilarity similarity;
    private final double threshold;

    public ThemeOrganizer(TextSimilarity similarity, double threshold) {
        this.similarity = similarity;
        this.threshold = threshold;
    }

    public List<Theme> organize(AggregationResult aggregate) {
        List<Claim> claims = aggregate.claims();
        if (claims.isEmpty()) {
            return List.of();
        }

        int[] parent = new int[claims.size()];
        for (int i = 0; i < parent.length; i++) parent[i] = i;

        for (int i = 0; i < claims.size(); i++) {
            for (int related : claims.get(i).relatedClaimIndexes()) {
                if (related >= 0 && related < claims.size()) union(parent, i, related);
            }
            for (int j = i + 1; j < claims.size(); j++) {
                if (similarity.score(claims.get(i).text(), claims.get(j).text()) >= threshold) {
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<Claim>> groups = new LinkedHashMap<>();
        for (int i = 0; i < claims.size(); i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(claims.get(i));
        }

        List<Theme> themes = groups.values().stream()
                .map(ThemeOrganizer::toTheme)
                .sorted(THEME_ORDER)
                .toList();
        log.info("Organized {} claims into {} themes", claims.size(), themes.size());
        return themes;
    }

    static final Comparator<Claim> MEMBER_ORDER = Comparator
            .comparing(Claim::confidence)
            .thenComparingInt(Claim::index);

    static final Comparator<Theme> THEME_ORDER = Comparator
            .comparingInt(Theme::highCount).reversed()
            .thenComparing(Comparator.comparingInt(Theme::mediumCount).reversed())
            .thenComparing(Comparator.comparingInt(Theme::distinctSources).reversed())
            .thenComparingInt(Theme::firstClaimIndex);

    private static Theme toTheme(List<Claim> members) {
        List<Claim> sorted = members.stream().sorted(MEMBER_ORDER).toList();
        int high = 0;
        int medium = 0;
        int low = 0;
        Set<String> sources = new LinkedHashSet<>();
        int first = Integer.MAX_VALUE;
        for (Claim claim : sorted) {
            switch (claim.confidence()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
            sources.addAll(claim.citationUrls());
            first = Math.min(first, claim.index());
        }
        return new Theme(titleOf(sorted), sorted, high, medium, low, sources.size(), first);
    }

    static String titleOf(List<Claim> members) {
        Map<String, Integer> counts = new HashMap<>();
        for (Claim claim : members) {
            for (String token : TextTokens.contentTokenList(claim.text())) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return FALLBACK_TITLE;
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TITLE_TOKENS)
                .map(e -> capitalize(e.getKey()))
                .collect(Collectors.joining(" / "));
    }

    private static String capitalize(String token) {
        return token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1);
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA == rootB) return;
        // lower index becomes root so grouping order follows aggregation order
        if (rootA < rootB) parent[rootB] = rootA;
        else parent[rootA] = rootB;
    }
}
