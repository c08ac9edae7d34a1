package com.eainde.research.aggregate;

import com.eainde.research.model.Claim;
import com.eainde.research.model.ConfidenceLevel;
import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.Gap;
import com.eainde.research.model.ReportedClaim;
import com.eainde.research.model.ReportedSource;
import com.eainde.research.model.Source;
import com.eainde.research.model.Subtopic;
import com.eainde.research.model.SubtopicFindings;
import com.eainde.research.text.TextSimilarity;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges every subtopic's findings into one deduplicated, confidence-scored registry.
 *
 * <h3>Pass:</h3>
 * <pre>
 * order documents by subtopic id
 * for each document:
 *   failed     → carry the dispatcher's gap
 *   malformed  → discard claims, MALFORMED_DOCUMENT gap
 *   otherwise  → carry worker-reported gaps
 *                register each source (exact URL key)
 *                cluster each claim (similarity &gt; merge threshold)
 *                no usable claim → NO_CLAIMS gap
 * publish sources (related same-domain titles cross-referenced)
 * publish claims  (confidence from the final citation set, related claims cross-referenced)
 * </pre>
 *
 * <p>Single-threaded. The registries live only for one call, the result is immutable.</p>
 */
@Log4j2
public class FindingsAggregator {

    private final TextSimilarity similarity;
    private final ConfidenceScorer confidenceScorer;
    private final double claimMergeThreshold;
    private final double crossReferenceThreshold;
    private final double relatedTitleThreshold;

    public FindingsAggregator(TextSimilarity similarity,
                              ConfidenceScorer confidenceScorer,
                              double claimMergeThreshold,
                              double crossReferenceThreshold,
                              double relatedTitleThreshold) {
        if (crossReferenceThreshold > claimMergeThreshold) {
            throw new IllegalArgumentException("cross-reference threshold " + crossReferenceThreshold
                    + " exceeds the merge threshold " + claimMergeThreshold);
        }
        this.similarity = similarity;
        this.confidenceScorer = confidenceScorer;
        this.claimMergeThreshold = claimMergeThreshold;
        this.crossReferenceThreshold = crossReferenceThreshold;
        this.relatedTitleThreshold = relatedTitleThreshold;
    }

    public AggregationResult aggregate(List<SubtopicFindings> findings) {
        List<SubtopicFindings> ordered = findings.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(f -> f.subtopic().id()))
                .toList();

        SourceRegistry sources = new SourceRegistry();
        ClaimRegistry claims = new ClaimRegistry(similarity, claimMergeThreshold);
        List<Gap> gaps = new ArrayList<>();
        int failed = 0;
        int malformed = 0;
        int skippedClaims = 0;

        for (SubtopicFindings f : ordered) {
            Subtopic subtopic = f.subtopic();
            if (f.isFailed()) {
                failed++;
                gaps.add(f.failure());
                continue;
            }
            FindingsDocument document = f.document();
            if (document == null || !document.isStructurallyValid()) {
                malformed++;
                log.warn("Discarding malformed findings for subtopic {} ({})", subtopic.id(), subtopic.title());
                gaps.add(Gap.malformedDocument(subtopic));
                continue;
            }
            for (String reported : document.gaps()) {
                if (reported != null && !reported.isBlank()) {
                    gaps.add(Gap.reported(subtopic, reported.trim()));
                }
            }
            int usable = 0;
            for (ReportedClaim claim : document.claims()) {
                if (claim == null || claim.claim() == null || claim.claim().isBlank()) {
                    skippedClaims++;
                    continue;
                }
                usable++;
                Set<String> citationUrls = new LinkedHashSet<>();
                for (ReportedSource source : claim.sources()) {
                    String url = sources.register(source);
                    if (url != null) citationUrls.add(url);
                }
                claims.add(claim.claim(), claim.evidence(), citationUrls, subtopic.id());
            }
            if (usable == 0) {
                log.warn("Subtopic {} ({}) returned no usable claims", subtopic.id(), subtopic.title());
                gaps.add(Gap.noClaims(subtopic));
            }
        }
        if (skippedClaims > 0) {
            log.warn("Skipped {} claims without text", skippedClaims);
        }

        List<Source> publishedSources = sources.publish(similarity, relatedTitleThreshold);
        List<Claim> publishedClaims = publishClaims(claims.clusters(), publishedSources);

        int relatedPairs = publishedSources.stream().mapToInt(s -> s.relatedUrls().size()).sum() / 2;
        AggregationStats stats = new AggregationStats(
                ordered.size(), failed, malformed,
                claims.ingested(), publishedClaims.size(), skippedClaims,
                sources.registered(), sources.size(), sources.skipped(),
                relatedPairs);
        boolean degraded = publishedClaims.isEmpty();

        if (degraded) {
            log.warn("Aggregation produced no claims ({} of {} subtopics failed); report will be degraded",
                    failed + malformed, ordered.size());
        }
        log.info("Aggregated {} claims into {} ({} merged), {} sources into {}, {} gaps",
                stats.claimsBeforeMerge(), stats.claimsAfterMerge(), stats.duplicatesMerged(),
                stats.sourcesBeforeMerge(), stats.sourcesAfterMerge(), gaps.size());
        return new AggregationResult(publishedClaims, publishedSources, gaps, stats, degraded);
    }

    private List<Claim> publishClaims(List<ClaimRegistry.Cluster> clusters, List<Source> sources) {
        Map<String, Source> byUrl = new HashMap<>();
        sources.forEach(s -> byUrl.put(s.url(), s));

        List<List<Integer>> related = new ArrayList<>();
        clusters.forEach(c -> related.add(new ArrayList<>()));
        for (int i = 0; i < clusters.size(); i++) {
            for (int j = i + 1; j < clusters.size(); j++) {
                double score = similarity.score(clusters.get(i).text(), clusters.get(j).text());
                if (score >= crossReferenceThreshold && score <= claimMergeThreshold) {
                    related.get(i).add(j);
                    related.get(j).add(i);
                }
            }
        }

        List<Claim> published = new ArrayList<>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            ClaimRegistry.Cluster cluster = clusters.get(i);
            List<String> citations = cluster.citations();
            List<Source> cited = citations.stream().map(byUrl::get).filter(Objects::nonNull).toList();
            ConfidenceLevel confidence = confidenceScorer.score(cited);
            published.add(new Claim(i, cluster.text(), cluster.evidence(), citations, confidence,
                    cluster.subtopicIds(), cluster.mergedCount(), related.get(i)));
        }
        return published;
    }
}
