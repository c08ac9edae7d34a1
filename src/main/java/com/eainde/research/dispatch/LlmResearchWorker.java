package com.eainde.research.dispatch;

import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.ResearchAssignment;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;

/**
 * Research worker backed by a LangChain4j {@link ChatModel}.
 *
 * <p>The assignment is rendered into a single prompt that names the subtopic, its keywords
 * and angle, the sibling topics to avoid, and the exact JSON shape expected back. The reply
 * goes through {@link FindingsDocumentParser}.</p>
 */
@Log4j2
public class LlmResearchWorker implements ResearchWorker {

    static final String PROMPT_TEMPLATE = """
            You are a research worker investigating exactly one subtopic of a larger research question.

            Subtopic: %s
            Angle: %s
            Search keywords: %s
            Do NOT cover these sibling topics (other workers own them): %s

            Rate every source's credibility from 1 (anonymous or promotional) to 5 (peer-reviewed
            or primary documentation). Record what you could not find as gaps.

            Reply with a single JSON object and nothing else:
            {
              "subtopic": "<the subtopic title>",
              "claims": [ { "claim": "<one factual statement>", "evidence": "<supporting detail>",
                            "sources": [ { "url": "<url>", "title": "<title>", "credibility": 1-5,
                                           "relevance": "<why it supports the claim>",
                                           "author": "<author or null>", "organization": "<publisher or null>",
                                           "republished_from": "<original url if republished, else null>" } ] } ],
              "gaps": [ "<missing coverage>" ],
              "search_queries_used": [ "<query>" ]
            }
            """;

    private final ChatModel chatModel;
    private final FindingsDocumentParser parser;

    public LlmResearchWorker(ChatModel chatModel, FindingsDocumentParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public FindingsDocument research(ResearchAssignment assignment) throws ResearchWorkerException {
        String prompt = renderPrompt(assignment);
        log.debug("Worker prompt for subtopic {}: {} chars", assignment.subtopic().id(), prompt.length());

        String reply;
        try {
            reply = chatModel.chat(prompt);
        } catch (RuntimeException e) {
            throw new WorkerFetchException("model call failed: " + e.getMessage(), e);
        }
        return parser.parse(reply);
    }

    String renderPrompt(ResearchAssignment assignment) {
        String avoid = assignment.coveredTopics().isEmpty()
                ? "(none)"
                : String.join("; ", assignment.coveredTopics());
        return String.format(PROMPT_TEMPLATE,
                assignment.subtopic().title(),
                assignment.angle(),
                String.join(", ", assignment.keywords()),
                avoid);
    }
}
