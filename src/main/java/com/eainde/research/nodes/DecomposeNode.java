package com.eainde.research.nodes;

import com.eainde.research.decompose.QueryDecomposer;
import com.eainde.research.model.ResearchQuery;
import com.eainde.research.model.Subtopic;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class DecomposeNode implements AsyncNodeAction<ResearchState> {

    private final QueryDecomposer decomposer;

    public DecomposeNode(QueryDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        try {
            ResearchQuery query = state.getQuery();
            List<Subtopic> subtopics = decomposer.decompose(query.text(), query.depth());
            return CompletableFuture.completedFuture(Map.of(ResearchState.SUBTOPICS, subtopics));
        } catch (RuntimeException e) {
            // InsufficientScopeException ends the run here
            return CompletableFuture.failedFuture(e);
        }
    }
}
