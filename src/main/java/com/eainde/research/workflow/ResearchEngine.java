package com.eainde.research.workflow;

import com.eainde.research.decompose.InsufficientScopeException;
import com.eainde.research.model.ResearchQuery;
import com.eainde.research.report.Report;
import com.eainde.research.state.ResearchState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for research runs.
 * <p>
 * Facade over the compiled research graph: callers hand in a {@link ResearchQuery} and get
 * back the finished {@link Report} without dealing with graph state or run ids.
 * </p>
 *
 * <h3>Per run:</h3>
 * <ul>
 * <li>Generates a run id, used as the graph thread id and placed in the MDC as {@code runId}.</li>
 * <li>Invokes the graph synchronously.</li>
 * <li>Rethrows {@link InsufficientScopeException} unchanged, wraps anything else in
 * {@link ResearchPipelineException}.</li>
 * </ul>
 */
@Log4j2
@Service
public class ResearchEngine {

    public static final String MDC_RUN_ID = "runId";

    private final CompiledGraph<ResearchState> workflow;

    public ResearchEngine(@Qualifier("researchWorkflow") CompiledGraph<ResearchState> workflow) {
        this.workflow = workflow;
    }

    /**
     * Runs the full pipeline for one query.
     *
     * @param query the validated query
     * @return the composed report; degraded when every worker failed
     * @throws InsufficientScopeException if the query cannot be decomposed at the requested depth
     * @throws ResearchPipelineException  if the graph fails for any other reason
     */
    public Report run(ResearchQuery query) {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        try {
            log.info("Starting research run for '{}' at depth {}", query.text(), query.depth().label());
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();
            Map<String, Object> inputs = Map.of(
                    ResearchState.QUERY, query,
                    ResearchState.RUN_ID, runId);

            Optional<ResearchState> result;
            try {
                result = workflow.invoke(inputs, config);
            } catch (Exception e) {
                throw translate(e);
            }

            Report report = result.flatMap(ResearchState::getReport)
                    .orElseThrow(() -> new ResearchPipelineException("research run " + runId + " produced no report"));
            log.info("Research run finished: {} claims, {} sources{}",
                    report.executiveSummary().totalClaims(), report.executiveSummary().totalSources(),
                    report.metadata().degraded() ? " (degraded)" : "");
            return report;
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private static RuntimeException translate(Exception failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof InsufficientScopeException scope) {
                log.warn("Query cannot be decomposed: {}", scope.getMessage());
                return scope;
            }
            if (t.getCause() == t) break;
        }
        log.error("Research run failed", failure);
        return new ResearchPipelineException("research run failed: " + failure.getMessage(), failure);
    }
}
