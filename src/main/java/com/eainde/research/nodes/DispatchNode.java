package com.eainde.research.nodes;

import com.eainde.research.config.DepthBudgets;
import com.eainde.research.dispatch.ResearchDispatcher;
import com.eainde.research.model.ResearchQuery;
import com.eainde.research.model.SubtopicFindings;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class DispatchNode implements AsyncNodeAction<ResearchState> {

    private final ResearchDispatcher dispatcher;
    private final DepthBudgets budgets;

    public DispatchNode(ResearchDispatcher dispatcher, DepthBudgets budgets) {
        this.dispatcher = dispatcher;
        this.budgets = budgets;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        try {
            ResearchQuery query = state.getQuery();
            Duration budget = query.budgetOverride().orElseGet(() -> budgets.budgetFor(query.depth()));
            List<SubtopicFindings> findings = dispatcher.dispatch(state.getSubtopics(), budget);
            return CompletableFuture.completedFuture(Map.of(ResearchState.FINDINGS, findings));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
