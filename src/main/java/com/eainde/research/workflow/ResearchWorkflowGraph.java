package com.eainde.research.workflow;

import com.eainde.research.edges.AggregateRoutingEdge;
import com.eainde.research.nodes.AggregateNode;
import com.eainde.research.nodes.ComposeReportNode;
import com.eainde.research.nodes.DecomposeNode;
import com.eainde.research.nodes.DispatchNode;
import com.eainde.research.nodes.OrganizeThemesNode;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Wires the five research stages into one graph.
 *
 * <pre>
 * START → decompose → dispatch → aggregate ─┬─ organize → compose → END
 *                                           └─ (empty aggregate) ──┘
 * </pre>
 */
@Component
public class ResearchWorkflowGraph {

    public static final String DECOMPOSE = "decompose";
    public static final String DISPATCH = "dispatch";
    public static final String AGGREGATE = "aggregate";
    public static final String ORGANIZE = "organize";
    public static final String COMPOSE = "compose";

    private final DecomposeNode decomposeNode;
    private final DispatchNode dispatchNode;
    private final AggregateNode aggregateNode;
    private final OrganizeThemesNode organizeNode;
    private final ComposeReportNode composeNode;
    private final AggregateRoutingEdge routingEdge;

    public ResearchWorkflowGraph(DecomposeNode decomposeNode,
                                 DispatchNode dispatchNode,
                                 AggregateNode aggregateNode,
                                 OrganizeThemesNode organizeNode,
                                 ComposeReportNode composeNode,
                                 AggregateRoutingEdge routingEdge) {
        this.decomposeNode = decomposeNode;
        this.dispatchNode = dispatchNode;
        this.aggregateNode = aggregateNode;
        this.organizeNode = organizeNode;
        this.composeNode = composeNode;
        this.routingEdge = routingEdge;
    }

    @Bean("researchWorkflow")
    public CompiledGraph<ResearchState> build() throws GraphStateException {
        StateGraph<ResearchState> workflow = new StateGraph<>(ResearchState::new);

        workflow.addNode(DECOMPOSE, decomposeNode);
        workflow.addNode(DISPATCH, dispatchNode);
        workflow.addNode(AGGREGATE, aggregateNode);
        workflow.addNode(ORGANIZE, organizeNode);
        workflow.addNode(COMPOSE, composeNode);

        workflow.addEdge(START, DECOMPOSE);
        workflow.addEdge(DECOMPOSE, DISPATCH);
        workflow.addEdge(DISPATCH, AGGREGATE);
        workflow.addConditionalEdges(
                AGGREGATE,
                routingEdge,
                Map.of(
                        AggregateRoutingEdge.ORGANIZE, ORGANIZE,
                        AggregateRoutingEdge.COMPOSE, COMPOSE
                )
        );
        workflow.addEdge(ORGANIZE, COMPOSE);
        workflow.addEdge(COMPOSE, END);

        return workflow.compile();
    }
}
