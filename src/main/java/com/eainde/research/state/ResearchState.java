package com.eainde.research.state;

import com.eainde.research.aggregate.AggregationResult;
import com.eainde.research.model.ResearchQuery;
import com.eainde.research.model.Subtopic;
import com.eainde.research.model.SubtopicFindings;
import com.eainde.research.model.Theme;
import com.eainde.research.report.Report;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one research run. Every stage writes exactly one key and reads only the
 * keys written before it.
 */
public class ResearchState extends AgentState {

    public static final String QUERY = "query";
    public static final String RUN_ID = "runId";
    public static final String SUBTOPICS = "subtopics";
    public static final String FINDINGS = "findings";
    public static final String AGGREGATE = "aggregate";
    public static final String THEMES = "themes";
    public static final String REPORT = "report";

    public ResearchState(Map<String, Object> initData) {
        super(initData);
    }

    public ResearchQuery getQuery() {
        return this.<ResearchQuery>value(QUERY)
                .orElseThrow(() -> new IllegalStateException("research state has no query"));
    }

    public String getRunId() {
        return this.<String>value(RUN_ID).orElse("unknown");
    }

    public List<Subtopic> getSubtopics() {
        return this.<List<Subtopic>>value(SUBTOPICS).orElse(List.of());
    }

    public List<SubtopicFindings> getFindings() {
        return this.<List<SubtopicFindings>>value(FINDINGS).orElse(List.of());
    }

    public Optional<AggregationResult> getAggregate() {
        return value(AGGREGATE);
    }

    public List<Theme> getThemes() {
        return this.<List<Theme>>value(THEMES).orElse(List.of());
    }

    public Optional<Report> getReport() {
        return value(REPORT);
    }
}
