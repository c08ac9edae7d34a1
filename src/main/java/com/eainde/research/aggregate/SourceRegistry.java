package com.eainde.research.aggregate;

import com.eainde.research.model.ReportedSource;
import com.eainde.research.model.Source;
import com.eainde.research.text.TextSimilarity;
import com.eainde.research.text.UrlDomains;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable source registry owned by one aggregation pass. Keyed by exact URL.
 *
 * <p>Registering a URL again keeps the higher credibility, unions relevance notes and fills
 * metadata the first report left empty. Registering the same source twice changes nothing.</p>
 */
final class SourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    static final int MIN_CREDIBILITY = 1;
    static final int MAX_CREDIBILITY = 5;

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private int registered;
    private int skipped;

    /**
     * Records one reported source.
     *
     * @return the registry key (trimmed URL), or {@code null} if the source has no URL
     */
    String register(ReportedSource reported) {
        if (reported == null || reported.url() == null || reported.url().isBlank()) {
            skipped++;
            log.debug("Skipping source without a URL: {}", reported);
            return null;
        }
        registered++;
        String url = reported.url().trim();
        int credibility = clamp(reported.credibility());

        Entry entry = entries.get(url);
        if (entry == null) {
            entry = new Entry(url, entries.size());
            entries.put(url, entry);
            entry.credibility = credibility;
        } else {
            entry.credibility = Math.max(entry.credibility, credibility);
        }
        entry.title = firstNonBlank(entry.title, reported.title());
        entry.author = firstNonBlank(entry.author, reported.author());
        entry.organization = firstNonBlank(entry.organization, reported.organization());
        entry.republishedFrom = firstNonBlank(entry.republishedFrom, reported.republishedFrom());
        if (reported.relevance() != null && !reported.relevance().isBlank()) {
            entry.notes.add(reported.relevance().trim());
        }
        return url;
    }

    int registered() {
        return registered;
    }

    int skipped() {
        return skipped;
    }

    int size() {
        return entries.size();
    }

    /**
     * Publishes immutable sources, cross-referencing same-site sources whose titles score
     * above {@code relatedTitleThreshold}. Related sources stay distinct.
     */
    List<Source> publish(TextSimilarity similarity, double relatedTitleThreshold) {
        List<Entry> ordered = new ArrayList<>(entries.values());
        Map<String, Set<String>> related = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            Entry a = ordered.get(i);
            for (int j = i + 1; j < ordered.size(); j++) {
                Entry b = ordered.get(j);
                if (UrlDomains.sameSite(a.domain, b.domain)
                        && a.title != null && b.title != null
                        && similarity.score(a.title, b.title) > relatedTitleThreshold) {
                    related.computeIfAbsent(a.url, k -> new LinkedHashSet<>()).add(b.url);
                    related.computeIfAbsent(b.url, k -> new LinkedHashSet<>()).add(a.url);
                }
            }
        }

        List<Source> sources = new ArrayList<>(ordered.size());
        for (Entry e : ordered) {
            sources.add(new Source(e.url, e.title != null ? e.title : e.url, e.domain, e.credibility,
                    new ArrayList<>(e.notes), e.author, e.organization, e.republishedFrom,
                    new ArrayList<>(related.getOrDefault(e.url, Set.of())), e.index));
        }
        return sources;
    }

    static int clamp(Integer credibility) {
        if (credibility == null) return MIN_CREDIBILITY;
        return Math.max(MIN_CREDIBILITY, Math.min(MAX_CREDIBILITY, credibility));
    }

    private static String firstNonBlank(String current, String candidate) {
        if (current != null && !current.isBlank()) return current;
        return candidate != null && !candidate.isBlank() ? candidate.trim() : current;
    }

    private static final class Entry {
        final String url;
        final String domain;
        final int index;
        final Set<String> notes = new LinkedHashSet<>();
        String title;
        String author;
        String organization;
        String republishedFrom;
        int credibility;

        Entry(String url, int index) {
            this.url = url;
            this.domain = UrlDomains.domainOf(url);
            this.index = index;
        }
    }
}
