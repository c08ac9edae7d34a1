package com.eainde.research.config;

import com.eainde.research.aggregate.ConfidenceScorer;
import com.eainde.research.aggregate.FindingsAggregator;
import com.eainde.research.aggregate.SourceIndependence;
import com.eainde.research.decompose.QueryDecomposer;
import com.eainde.research.dispatch.ResearchDispatcher;
import com.eainde.research.dispatch.ResearchWorker;
import com.eainde.research.report.MarkdownReportRenderer;
import com.eainde.research.report.ReportComposer;
import com.eainde.research.text.TextSimilarity;
import com.eainde.research.text.TokenSetSimilarity;
import com.eainde.research.theme.ThemeOrganizer;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the framework-free pipeline stages from {@code research.*} properties.
 */
@Log4j2
@Configuration
public class ResearchPipelineConfig {

    // ── Depth budgets ───────────────────────────────────────────────────

    @Value("${research.depth.quick.worker-budget:3m}")
    private Duration quickBudget;

    @Value("${research.depth.medium.worker-budget:5m}")
    private Duration mediumBudget;

    @Value("${research.depth.deep.worker-budget:10m}")
    private Duration deepBudget;

    // ── Stage tuning ────────────────────────────────────────────────────

    @Value("${research.dispatch.max-pool-size:10}")
    private int maxPoolSize;

    @Value("${research.decomposition.keyword-overlap-bound:1}")
    private int keywordOverlapBound;

    @Value("${research.aggregation.claim-similarity-threshold:0.8}")
    private double claimSimilarityThreshold;

    @Value("${research.aggregation.cross-reference-threshold:0.5}")
    private double crossReferenceThreshold;

    @Value("${research.aggregation.related-title-threshold:0.8}")
    private double relatedTitleThreshold;

    @Value("${research.themes.similarity-threshold:0.3}")
    private double themeSimilarityThreshold;

    @Value("${research.report.key-findings-limit:10}")
    private int keyFindingsLimit;

    @Bean
    public DepthBudgets depthBudgets() {
        log.info("Worker budgets: quick={}, medium={}, deep={}", quickBudget, mediumBudget, deepBudget);
        return new DepthBudgets(quickBudget, mediumBudget, deepBudget);
    }

    @Bean
    public TextSimilarity textSimilarity() {
        return new TokenSetSimilarity();
    }

    @Bean
    public QueryDecomposer queryDecomposer() {
        return new QueryDecomposer(keywordOverlapBound);
    }

    @Bean
    public ResearchDispatcher researchDispatcher(ResearchWorker researchWorker) {
        return new ResearchDispatcher(researchWorker, maxPoolSize);
    }

    @Bean
    public FindingsAggregator findingsAggregator(TextSimilarity textSimilarity) {
        return new FindingsAggregator(textSimilarity, new ConfidenceScorer(new SourceIndependence()),
                claimSimilarityThreshold, crossReferenceThreshold, relatedTitleThreshold);
    }

    @Bean
    public ThemeOrganizer themeOrganizer(TextSimilarity textSimilarity) {
        return new ThemeOrganizer(textSimilarity, themeSimilarityThreshold);
    }

    @Bean
    public ReportComposer reportComposer() {
        return new ReportComposer(keyFindingsLimit, Clock.systemUTC());
    }

    @Bean
    public MarkdownReportRenderer markdownReportRenderer() {
        return new MarkdownReportRenderer();
    }
}
