package com.eainde.research.nodes;

import com.eainde.research.aggregate.AggregationResult;
import com.eainde.research.aggregate.FindingsAggregator;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class AggregateNode implements AsyncNodeAction<ResearchState> {

    private final FindingsAggregator aggregator;

    public AggregateNode(FindingsAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        try {
            AggregationResult aggregate = aggregator.aggregate(state.getFindings());
            return CompletableFuture.completedFuture(Map.of(ResearchState.AGGREGATE, aggregate));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
