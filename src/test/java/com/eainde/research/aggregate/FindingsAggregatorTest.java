package com.eainde.research.aggregate;

import com.eainde.research.model.Claim;
import com.eainde.research.model.ConfidenceLevel;
import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.Gap;
import com.eainde.research.model.GapKind;
import com.eainde.research.model.ReportedClaim;
import com.eainde.research.model.ReportedSource;
import com.eainde.research.model.Source;
import com.eainde.research.model.Subtopic;
import com.eainde.research.model.SubtopicFindings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static com.eainde.research.aggregate.AggregationFixtures.aggregator;
import static com.eainde.research.aggregate.AggregationFixtures.claim;
import static com.eainde.research.aggregate.AggregationFixtures.findings;
import static com.eainde.research.aggregate.AggregationFixtures.source;
import static com.eainde.research.aggregate.AggregationFixtures.subtopic;
import static com.eainde.research.aggregate.AggregationFixtures.timedOut;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingsAggregatorTest {

    private final FindingsAggregator aggregator = aggregator();

    // =========================================================================
    //  Claim dedup
    // =========================================================================

    @Nested
    @DisplayName("Claim dedup")
    class ClaimDedup {

        @Test
        @DisplayName("two workers, same claim, independent credible sources → one high-confidence claim")
        void scenarioIndependentCorroboration() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production", source("https://aws.com/raft", 4))),
                    findings(2, claim("Raft is widely used in production", source("https://sre.google/raft", 4)))));

            assertThat(result.claims()).hasSize(1);
            Claim claim = result.claims().get(0);
            assertThat(claim.citationUrls()).containsExactly("https://aws.com/raft", "https://sre.google/raft");
            assertThat(claim.confidence()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(claim.subtopicIds()).containsExactly(1, 2);
            assertThat(claim.mergedCount()).isEqualTo(2);
            assertThat(result.stats().duplicatesMerged()).isEqualTo(1);
        }

        @Test
        @DisplayName("a single personal blog citation → low confidence")
        void scenarioSingleBlog() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft performs poorly on wide-area networks",
                            source("https://someone.blogspot.com/raft", 2)))));

            assertThat(result.claims()).singleElement()
                    .extracting(Claim::confidence).isEqualTo(ConfidenceLevel.LOW);
        }

        @Test
        @DisplayName("keeps the longer wording as canonical, with its evidence")
        void longerWordingWins() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production", source("https://aws.com/raft", 4))),
                    findings(2, claim("Raft is widely used in production systems", source("https://sre.google/raft", 4)))));

            assertThat(result.claims()).singleElement().satisfies(c -> {
                assertThat(c.text()).isEqualTo("Raft is widely used in production systems");
                assertThat(c.evidence()).isEqualTo("evidence for Raft is widely used in production systems");
            });
        }

        @Test
        @DisplayName("merge is commutative in the final citation set for mutually similar claims")
        void commutativeMerge() {
            String a = "Raft consensus is widely used in production systems";
            String b = "Raft consensus is widely used in production systems today";
            String c = "Raft consensus is widely used in large production systems";

            AggregationResult forward = aggregator.aggregate(List.of(
                    findings(1, claim(a, source("https://a.com/1", 3))),
                    findings(2, claim(b, source("https://b.com/1", 3))),
                    findings(3, claim(c, source("https://c.com/1", 3)))));
            AggregationResult reversed = aggregator.aggregate(List.of(
                    findings(1, claim(c, source("https://c.com/1", 3))),
                    findings(2, claim(b, source("https://b.com/1", 3))),
                    findings(3, claim(a, source("https://a.com/1", 3)))));

            assertThat(forward.claims()).hasSize(1);
            assertThat(reversed.claims()).hasSize(1);
            assertThat(new HashSet<>(forward.claims().get(0).citationUrls()))
                    .isEqualTo(new HashSet<>(reversed.claims().get(0).citationUrls()));
            assertThat(forward.claims().get(0).confidence()).isEqualTo(reversed.claims().get(0).confidence());
        }

        @Test
        @DisplayName("related claims below the merge threshold stay distinct and are cross-referenced")
        void crossReferences() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft elects a leader using randomized timeouts", source("https://a.com/1", 3))),
                    findings(2, claim("Raft leader election uses randomized timeouts to avoid split votes",
                            source("https://b.com/1", 3))),
                    findings(3, claim("Etcd stores Kubernetes cluster state", source("https://c.com/1", 3)))));

            assertThat(result.claims()).hasSize(3);
            assertThat(result.claims().get(0).relatedClaimIndexes()).containsExactly(1);
            assertThat(result.claims().get(1).relatedClaimIndexes()).containsExactly(0);
            assertThat(result.claims().get(2).relatedClaimIndexes()).isEmpty();
        }

        @Test
        @DisplayName("compares only with the current representative, never re-checking earlier wordings")
        void representativeOnly() {
            String first = "Raft leader election relies on randomized timeouts to prevent split votes at cluster startup";
            String longer = first + " in etcd consul and cockroach deployments";
            String close = "Raft leader election relies on randomized timeouts to prevent split votes at cluster";

            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim(first, source("https://a.com/1", 3))),
                    findings(2, claim(longer, source("https://b.com/1", 3))),
                    findings(3, claim(close, source("https://c.com/1", 3)))));

            // close scores 0.95 against first but exactly 0.8 against the longer representative
            assertThat(result.claims()).extracting(Claim::text).containsExactly(longer, close);
            assertThat(result.claims().get(0).citationUrls()).containsExactly("https://a.com/1", "https://b.com/1");
            assertThat(result.claims().get(1).citationUrls()).containsExactly("https://c.com/1");
            assertThat(result.claims().get(1).relatedClaimIndexes()).containsExactly(0);
        }

        @Test
        @DisplayName("a similarity of exactly 0.8 does not merge")
        void mergeThresholdIsStrict() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Etcd replicates cluster state", source("https://a.com/1", 3))),
                    findings(2, claim("Etcd replicates cluster state using Raft", source("https://b.com/1", 3)))));

            assertThat(result.claims()).hasSize(2);
            assertThat(result.stats().duplicatesMerged()).isZero();
            assertThat(result.claims().get(0).relatedClaimIndexes()).containsExactly(1);
        }

        @Test
        @DisplayName("skips null claim and source entries without losing the rest of the document")
        void nullEntries() {
            Subtopic first = subtopic(1);
            ReportedClaim valid = new ReportedClaim("Raft elects a single leader per term", "evidence",
                    Arrays.asList(null, source("https://a.com/1", 3)));
            SubtopicFindings withNulls = SubtopicFindings.completed(first, new FindingsDocument(first.title(),
                    Arrays.asList(null, valid), List.of(), List.of()));

            AggregationResult result = aggregator.aggregate(List.of(withNulls));

            assertThat(result.claims()).singleElement()
                    .extracting(Claim::citationUrls).isEqualTo(List.of("https://a.com/1"));
            assertThat(result.stats().claimsSkipped()).isEqualTo(1);
            assertThat(result.stats().sourcesSkipped()).isEqualTo(1);
            assertThat(result.gaps()).isEmpty();
        }

        @Test
        @DisplayName("ingests documents in subtopic order regardless of arrival order")
        void canonicalOrder() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(2, claim("Etcd stores Kubernetes cluster state", source("https://c.com/1", 3))),
                    findings(1, claim("Raft elects a single leader per term", source("https://a.com/1", 3)))));

            assertThat(result.claims()).extracting(Claim::text)
                    .containsExactly("Raft elects a single leader per term", "Etcd stores Kubernetes cluster state");
            assertThat(result.claims()).extracting(Claim::index).containsExactly(0, 1);
        }

        @Test
        @DisplayName("skips claims without text")
        void blankClaims() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("  ", source("https://a.com/1", 3)),
                            claim("Raft elects a single leader per term", source("https://a.com/1", 3)))));

            assertThat(result.claims()).hasSize(1);
            assertThat(result.stats().claimsSkipped()).isEqualTo(1);
        }
    }

    // =========================================================================
    //  Source dedup
    // =========================================================================

    @Nested
    @DisplayName("Source dedup")
    class SourceDedup {

        @Test
        @DisplayName("same URL with credibility 3 and 5 → one source, credibility 5, both notes")
        void scenarioMaxCredibility() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production",
                            new ReportedSource("https://aws.com/raft", "Raft at AWS", 3, "production usage"))),
                    findings(2, claim("Etcd stores Kubernetes cluster state",
                            new ReportedSource("https://aws.com/raft", "Raft at AWS", 5, "etcd background")))));

            assertThat(result.sources()).singleElement().satisfies(s -> {
                assertThat(s.credibility()).isEqualTo(5);
                assertThat(s.relevanceNotes()).containsExactly("production usage", "etcd background");
            });
            assertThat(result.stats().sourcesBeforeMerge()).isEqualTo(2);
            assertThat(result.stats().sourcesAfterMerge()).isEqualTo(1);
        }

        @Test
        @DisplayName("registering the same source again changes nothing")
        void idempotent() {
            ReportedSource aws = new ReportedSource("https://aws.com/raft", "Raft at AWS", 4, "production usage");

            List<Source> once = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production", aws)))).sources();
            List<Source> twice = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production", aws, aws)),
                    findings(2, claim("Raft is widely used in production", aws)))).sources();

            assertThat(twice).isEqualTo(once);
        }

        @Test
        @DisplayName("same-domain sources with similar titles are cross-referenced, not merged")
        void relatedSources() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production",
                            new ReportedSource("https://example.com/raft", "Raft consensus explained for beginners", 3, "intro"),
                            new ReportedSource("https://example.com/raft-v2",
                                    "Raft consensus explained for beginners (updated)", 3, "intro")))));

            assertThat(result.sources()).hasSize(2);
            assertThat(result.sources().get(0).relatedUrls()).containsExactly("https://example.com/raft-v2");
            assertThat(result.sources().get(1).relatedUrls()).containsExactly("https://example.com/raft");
            assertThat(result.stats().relatedSourcePairs()).isEqualTo(1);
            // same domain is not independent corroboration
            assertThat(result.claims().get(0).confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
        }

        @Test
        @DisplayName("pages on two subdomains of one site are cross-referenced and do not corroborate each other")
        void relatedAcrossSubdomains() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production",
                            new ReportedSource("https://en.wikipedia.org/wiki/Raft",
                                    "Raft consensus explained for beginners", 4, "intro"),
                            new ReportedSource("https://de.wikipedia.org/wiki/Raft",
                                    "Raft consensus explained for beginners (updated)", 4, "intro")))));

            assertThat(result.sources().get(0).relatedUrls()).containsExactly("https://de.wikipedia.org/wiki/Raft");
            assertThat(result.claims().get(0).confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
        }

        @Test
        @DisplayName("clamps credibility into 1-5 and skips sources without a URL")
        void clampAndSkip() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production",
                            new ReportedSource("https://a.com/1", "A", 9, "x"),
                            new ReportedSource("https://b.com/1", "B", 0, "x"),
                            new ReportedSource("https://c.com/1", "C", null, "x"),
                            new ReportedSource(" ", "blank", 5, "x")))));

            assertThat(result.sources()).extracting(Source::credibility).containsExactly(5, 1, 1);
            assertThat(result.stats().sourcesSkipped()).isEqualTo(1);
            assertThat(result.claims().get(0).citationUrls()).hasSize(3);
        }

        @Test
        @DisplayName("records the domain of each source")
        void domains() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production", source("https://www.AWS.com/raft", 4)))));

            assertThat(result.source("https://www.AWS.com/raft")).get()
                    .extracting(Source::domain).isEqualTo("aws.com");
        }
    }

    // =========================================================================
    //  Gaps and degraded aggregates
    // =========================================================================

    @Nested
    @DisplayName("Gaps")
    class Gaps {

        @Test
        @DisplayName("a malformed document is discarded with a gap; the rest still aggregates")
        void malformedDocument() {
            Subtopic second = subtopic(2);
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production", source("https://aws.com/raft", 4))),
                    SubtopicFindings.completed(second, new FindingsDocument(second.title(), null, List.of(), List.of()))));

            assertThat(result.claims()).hasSize(1);
            assertThat(result.gaps()).singleElement().satisfies(g -> {
                assertThat(g.kind()).isEqualTo(GapKind.MALFORMED_DOCUMENT);
                assertThat(g.description()).isEqualTo("subtopic 2 (Subtopic 2) returned malformed data");
            });
            assertThat(result.stats().documentsMalformed()).isEqualTo(1);
        }

        @Test
        @DisplayName("dispatcher failures and worker-reported gaps are carried over")
        void carriesGaps() {
            Subtopic first = subtopic(1);
            SubtopicFindings withGap = SubtopicFindings.completed(first, new FindingsDocument(first.title(),
                    List.of(claim("Raft is widely used in production", source("https://aws.com/raft", 4))),
                    List.of("no benchmarks after 2023"), List.of()));

            AggregationResult result = aggregator.aggregate(List.of(withGap, timedOut(3)));

            assertThat(result.gaps()).extracting(Gap::kind)
                    .containsExactly(GapKind.WORKER_REPORTED, GapKind.WORKER_TIMEOUT);
            assertThat(result.gaps().get(0).description()).isEqualTo("no benchmarks after 2023");
            assertThat(result.gaps().get(1).subtopicId()).isEqualTo(3);
            assertThat(result.stats().documentsFailed()).isEqualTo(1);
            assertThat(result.degraded()).isFalse();
        }

        @Test
        @DisplayName("a document whose claims are all empty records a NO_CLAIMS gap")
        void documentWithoutUsableClaims() {
            AggregationResult result = aggregator.aggregate(List.of(
                    findings(1, claim("Raft is widely used in production", source("https://aws.com/raft", 4))),
                    findings(2, claim(" ", source("https://a.com/1", 3)))));

            assertThat(result.degraded()).isFalse();
            assertThat(result.gaps()).singleElement().satisfies(g -> {
                assertThat(g.kind()).isEqualTo(GapKind.NO_CLAIMS);
                assertThat(g.description()).isEqualTo("subtopic 2 (Subtopic 2) returned no claims");
            });
        }

        @Test
        @DisplayName("no claims at all → degraded aggregate that still lists every gap")
        void emptyAggregate() {
            AggregationResult result = aggregator.aggregate(List.of(timedOut(1), timedOut(2)));

            assertThat(result.degraded()).isTrue();
            assertThat(result.claims()).isEmpty();
            assertThat(result.sources()).isEmpty();
            assertThat(result.gaps()).hasSize(2);
        }
    }

    @Test
    @DisplayName("rejects a cross-reference threshold above the merge threshold")
    void invalidThresholds() {
        assertThatThrownBy(() -> new FindingsAggregator(null, null, 0.5, 0.8, 0.8))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("every worker succeeding with no claims → degraded aggregate with a gap per subtopic")
    void emptyClaimsList() {
        ReportedClaim[] none = new ReportedClaim[0];
        AggregationResult result = aggregator.aggregate(List.of(findings(1, none), findings(2, none)));

        assertThat(result.claims()).isEmpty();
        assertThat(result.degraded()).isTrue();
        assertThat(result.gaps()).extracting(Gap::kind).containsExactly(GapKind.NO_CLAIMS, GapKind.NO_CLAIMS);
        assertThat(result.gaps()).extracting(Gap::subtopicId).containsExactly(1, 2);
    }
}
