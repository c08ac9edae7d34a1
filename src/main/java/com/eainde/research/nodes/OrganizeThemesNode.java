package com.eainde.research.nodes;

import com.eainde.research.aggregate.AggregationResult;
import com.eainde.research.model.Theme;
import com.eainde.research.state.ResearchState;
import com.eainde.research.theme.ThemeOrganizer;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class OrganizeThemesNode implements AsyncNodeAction<ResearchState> {

    private final ThemeOrganizer organizer;

    public OrganizeThemesNode(ThemeOrganizer organizer) {
        this.organizer = organizer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        try {
            AggregationResult aggregate = state.getAggregate()
                    .orElseThrow(() -> new IllegalStateException("no aggregate to organize"));
            List<Theme> themes = organizer.organize(aggregate);
            return CompletableFuture.completedFuture(Map.of(ResearchState.THEMES, themes));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
