package com.eainde.research.edges;

import com.eainde.research.aggregate.AggregationResult;
import com.eainde.research.state.ResearchState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Routes after aggregation: an empty aggregate skips theming and goes straight to composition.
 */
@Log4j2
@Component
public class AggregateRoutingEdge implements AsyncEdgeAction<ResearchState> {

    public static final String ORGANIZE = "organize";
    public static final String COMPOSE = "compose";

    @Override
    public CompletableFuture<String> apply(ResearchState state) {
        boolean degraded = state.getAggregate().map(AggregationResult::degraded).orElse(true);
        if (degraded) {
            log.warn("Empty aggregate, skipping theme organization");
            return CompletableFuture.completedFuture(COMPOSE);
        }
        return CompletableFuture.completedFuture(ORGANIZE);
    }
}
