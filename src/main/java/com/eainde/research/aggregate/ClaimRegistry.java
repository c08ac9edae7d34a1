package com.eainde.research.aggregate;

import com.eainde.research.text.TextSimilarity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fuzzy claim clustering for one aggregation pass.
 *
 * <p>An incoming claim is compared with each cluster's current representative only. It joins
 * the best-scoring cluster strictly above the merge threshold (earliest cluster on ties),
 * otherwise it opens a new cluster. A strictly longer wording becomes the representative.</p>
 */
final class ClaimRegistry {

    private final TextSimilarity similarity;
    private final double mergeThreshold;
    private final List<Cluster> clusters = new ArrayList<>();
    private int ingested;

    ClaimRegistry(TextSimilarity similarity, double mergeThreshold) {
        this.similarity = similarity;
        this.mergeThreshold = mergeThreshold;
    }

    void add(String text, String evidence, Collection<String> citationUrls, int subtopicId) {
        ingested++;
        String wording = text.trim();

        Cluster best = null;
        double bestScore = mergeThreshold;
        for (Cluster cluster : clusters) {
            double score = similarity.score(cluster.text, wording);
            if (score > bestScore) {
                best = cluster;
                bestScore = score;
            }
        }

        if (best == null) {
            clusters.add(new Cluster(wording, evidence, citationUrls, subtopicId));
            return;
        }
        best.merge(wording, evidence, citationUrls, subtopicId);
    }

    int ingested() {
        return ingested;
    }

    List<Cluster> clusters() {
        return clusters;
    }

    static final class Cluster {
        private String text;
        private String evidence;
        private final Set<String> citations = new LinkedHashSet<>();
        private final Set<Integer> subtopicIds = new LinkedHashSet<>();
        private int mergedCount = 1;

        private Cluster(String text, String evidence, Collection<String> citationUrls, int subtopicId) {
            this.text = text;
            this.evidence = evidence != null ? evidence : "";
            this.citations.addAll(citationUrls);
            this.subtopicIds.add(subtopicId);
        }

        private void merge(String wording, String incomingEvidence, Collection<String> citationUrls, int subtopicId) {
            citations.addAll(citationUrls);
            subtopicIds.add(subtopicId);
            mergedCount++;
            if (wording.length() > text.length()) {
                text = wording;
                if (incomingEvidence != null && !incomingEvidence.isBlank()) {
                    evidence = incomingEvidence;
                }
            }
        }

        String text() {
            return text;
        }

        String evidence() {
            return evidence;
        }

        List<String> citations() {
            return List.copyOf(citations);
        }

        List<Integer> subtopicIds() {
            return List.copyOf(subtopicIds);
        }

        int mergedCount() {
            return mergedCount;
        }
    }
}
