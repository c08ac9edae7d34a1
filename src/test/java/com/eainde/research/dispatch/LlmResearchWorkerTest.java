package com.eainde.research.dispatch;

import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.ResearchAssignment;
import com.eainde.research.model.Subtopic;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmResearchWorkerTest {

    @Mock
    private ChatModel chatModel;

    private LlmResearchWorker worker;
    private ResearchAssignment assignment;

    @BeforeEach
    void setUp() {
        worker = new LlmResearchWorker(chatModel, new FindingsDocumentParser(new ObjectMapper()));
        Subtopic limitations = new Subtopic(2, "Limitations and open problems of Raft",
                List.of("raft", "limitations", "challenges", "failure modes"), "limitations", "why");
        Subtopic current = new Subtopic(1, "Current state of Raft",
                List.of("raft", "current state"), "current state", "why");
        assignment = ResearchAssignment.forSubtopic(limitations, List.of(current, limitations));
    }

    @Test
    @DisplayName("prompt names the subtopic, angle, keywords and the topics to avoid")
    void rendersPrompt() throws Exception {
        when(chatModel.chat(anyString())).thenReturn("{\"subtopic\": \"Limitations\", \"claims\": []}");

        worker.research(assignment);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertThat(prompt.getValue())
                .contains("Subtopic: Limitations and open problems of Raft")
                .contains("Angle: limitations")
                .contains("raft, limitations, challenges, failure modes")
                .contains("Current state of Raft")
                .contains("\"search_queries_used\"");
    }

    @Test
    @DisplayName("returns the parsed findings document")
    void parsesReply() throws Exception {
        when(chatModel.chat(anyString())).thenReturn("""
                ```json
                {"subtopic": "Limitations", "claims": [{"claim": "Raft needs a majority", "sources": []}]}
                ```
                """);

        FindingsDocument document = worker.research(assignment);

        assertThat(document.claims()).extracting(c -> c.claim()).containsExactly("Raft needs a majority");
    }

    @Test
    @DisplayName("a failing model call is a fetch failure")
    void transportFailure() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("HTTP 503"));

        assertThatThrownBy(() -> worker.research(assignment))
                .isInstanceOf(WorkerFetchException.class)
                .hasMessageContaining("HTTP 503");
    }

    @Test
    @DisplayName("an unparseable reply is malformed output")
    void garbageReply() {
        when(chatModel.chat(anyString())).thenReturn("Sorry, I cannot help with that.");

        assertThatThrownBy(() -> worker.research(assignment))
                .isInstanceOf(WorkerMalformedOutputException.class);
    }

    @Test
    @DisplayName("the unconfigured worker always reports a fetch failure")
    void unconfigured() {
        assertThatThrownBy(() -> new UnconfiguredResearchWorker().research(assignment))
                .isInstanceOf(WorkerFetchException.class)
                .hasMessageContaining("research.llm.api-key");
    }
}
