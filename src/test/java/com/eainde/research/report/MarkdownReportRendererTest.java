package com.eainde.research.report;

import com.eainde.research.aggregate.AggregationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.eainde.research.aggregate.AggregationFixtures.aggregator;
import static com.eainde.research.aggregate.AggregationFixtures.timedOut;
import static com.eainde.research.report.ReportComposerTest.CLOCK;
import static com.eainde.research.report.ReportComposerTest.QUERY;
import static com.eainde.research.report.ReportComposerTest.SUBTOPICS;
import static org.assertj.core.api.Assertions.assertThat;

class MarkdownReportRendererTest {

    private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();
    private final ReportComposer composer = new ReportComposer(10, CLOCK);

    private Report sampleReport() {
        AggregationResult aggregate = ReportComposerTest.sampleAggregate();
        return composer.compose(QUERY, "run-1", SUBTOPICS, aggregate, ReportComposerTest.themesOf(aggregate));
    }

    @Test
    @DisplayName("emits the six section headings in order")
    void headings() {
        String markdown = renderer.render(sampleReport());

        int previous = -1;
        for (String heading : MarkdownReportRenderer.SECTION_HEADINGS) {
            int position = markdown.indexOf("## " + heading + "\n");
            assertThat(position).as(heading).isGreaterThan(previous);
            previous = position;
        }
    }

    @Test
    @DisplayName("marks findings with confidence and inline citation numbers")
    void findings() {
        String markdown = renderer.render(sampleReport());

        assertThat(markdown)
                .contains("1. **[High confidence]** Raft elects a leader using randomized timeouts [1][2]")
                .contains("- Raft leader election uses randomized timeouts to avoid split votes [3][4] _(High confidence)_")
                .contains("### Leader / Raft / Randomized");
    }

    @Test
    @DisplayName("lists sources by tier with their citation numbers")
    void sources() {
        String markdown = renderer.render(sampleReport());

        assertThat(markdown)
                .contains("### High credibility (5-4)")
                .contains("[1] Title of https://aws.com/raft. https://aws.com/raft (credibility 4)")
                .contains("### Medium credibility (3)")
                .contains("[6] Title of https://someblog.net/etcd. https://someblog.net/etcd (credibility 2)");
    }

    @Test
    @DisplayName("renders statistics and gaps")
    void statisticsAndGaps() {
        String markdown = renderer.render(sampleReport());

        assertThat(markdown)
                .contains("| High | 2 | 50.0% |")
                .contains("- Average source credibility: 3.17")
                .contains("- Total unique sources: 6")
                .contains("timed out after 300s");
    }

    @Test
    @DisplayName("re-rendering never renumbers citations")
    void stableRendering() {
        Report report = sampleReport();

        assertThat(renderer.render(report)).isEqualTo(renderer.render(report));
    }

    @Test
    @DisplayName("a degraded report says so and still has every section")
    void degraded() {
        AggregationResult empty = aggregator().aggregate(List.of(timedOut(1), timedOut(2)));
        String markdown = renderer.render(composer.compose(QUERY, "run-2", SUBTOPICS, empty, List.of()));

        assertThat(markdown).contains("**Degraded report:**").contains("_No findings._").contains("_None._");
        MarkdownReportRenderer.SECTION_HEADINGS.forEach(h -> assertThat(markdown).contains("## " + h));
    }
}
