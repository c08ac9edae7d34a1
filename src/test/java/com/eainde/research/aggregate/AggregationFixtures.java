package com.eainde.research.aggregate;

import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.Gap;
import com.eainde.research.model.ReportedClaim;
import com.eainde.research.model.ReportedSource;
import com.eainde.research.model.Source;
import com.eainde.research.model.Subtopic;
import com.eainde.research.model.SubtopicFindings;
import com.eainde.research.text.TokenSetSimilarity;
import com.eainde.research.text.UrlDomains;

import java.time.Duration;
import java.util.List;

/** Builders shared by the aggregation, theming and report tests. */
public final class AggregationFixtures {

    private AggregationFixtures() {
    }

    public static FindingsAggregator aggregator() {
        return new FindingsAggregator(new TokenSetSimilarity(), new ConfidenceScorer(new SourceIndependence()),
                0.8, 0.5, 0.8);
    }

    public static Subtopic subtopic(int id) {
        return new Subtopic(id, "Subtopic " + id, List.of("raft", "angle " + id, "extra " + id), "angle " + id, "why");
    }

    public static ReportedSource source(String url, int credibility) {
        return new ReportedSource(url, "Title of " + url, credibility, "supports the claim");
    }

    public static ReportedClaim claim(String text, ReportedSource... sources) {
        return new ReportedClaim(text, "evidence for " + text, List.of(sources));
    }

    public static SubtopicFindings findings(int subtopicId, ReportedClaim... claims) {
        Subtopic subtopic = subtopic(subtopicId);
        return SubtopicFindings.completed(subtopic,
                new FindingsDocument(subtopic.title(), List.of(claims), List.of(), List.of()));
    }

    public static SubtopicFindings timedOut(int subtopicId) {
        Subtopic subtopic = subtopic(subtopicId);
        return SubtopicFindings.failed(subtopic, Gap.timeout(subtopic, Duration.ofMinutes(5)));
    }

    public static Source registered(String url, int credibility) {
        return registered(url, credibility, null, null, null);
    }

    public static Source registered(String url, int credibility, String author, String organization,
                                    String republishedFrom) {
        return new Source(url, "Title of " + url, UrlDomains.domainOf(url), credibility, List.of(),
                author, organization, republishedFrom, List.of(), 0);
    }
}
