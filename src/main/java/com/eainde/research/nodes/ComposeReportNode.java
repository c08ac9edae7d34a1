package com.eainde.research.nodes;

import com.eainde.research.aggregate.AggregationResult;
import com.eainde.research.report.Report;
import com.eainde.research.report.ReportComposer;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class ComposeReportNode implements AsyncNodeAction<ResearchState> {

    private final ReportComposer composer;

    public ComposeReportNode(ReportComposer composer) {
        this.composer = composer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        try {
            AggregationResult aggregate = state.getAggregate()
                    .orElseThrow(() -> new IllegalStateException("no aggregate to compose"));
            // themes is absent when the organize stage was skipped for an empty aggregate
            Report report = composer.compose(state.getQuery(), state.getRunId(), state.getSubtopics(),
                    aggregate, state.getThemes());
            return CompletableFuture.completedFuture(Map.of(ResearchState.REPORT, report));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
