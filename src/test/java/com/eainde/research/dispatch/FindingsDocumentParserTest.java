package com.eainde.research.dispatch;

import com.eainde.research.model.FindingsDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingsDocumentParserTest {

    private final FindingsDocumentParser parser = new FindingsDocumentParser(new ObjectMapper());

    private static final String DOCUMENT = """
            {
              "subtopic": "Current state of Raft",
              "claims": [
                { "claim": "Raft is widely used in production",
                  "evidence": "etcd and Consul implement it",
                  "sources": [ { "url": "https://aws.com/raft", "title": "Raft at AWS", "credibility": 4,
                                 "relevance": "production usage", "author": "J. Doe", "confidence": "ignored" } ] }
              ],
              "gaps": [ "no 2024 benchmarks found" ],
              "search_queries_used": [ "raft production" ],
              "tokens_used": 1234
            }
            """;

    @Test
    @DisplayName("reads the worker contract, ignoring unknown fields")
    void parsesDocument() throws Exception {
        FindingsDocument document = parser.parse(DOCUMENT);

        assertThat(document.subtopic()).isEqualTo("Current state of Raft");
        assertThat(document.claims()).hasSize(1);
        assertThat(document.claims().get(0).sources().get(0).credibility()).isEqualTo(4);
        assertThat(document.claims().get(0).sources().get(0).author()).isEqualTo("J. Doe");
        assertThat(document.gaps()).containsExactly("no 2024 benchmarks found");
        assertThat(document.isStructurallyValid()).isTrue();
    }

    @Test
    @DisplayName("strips Markdown fences and surrounding prose")
    void fencedReply() throws Exception {
        FindingsDocument document = parser.parse("Here are my findings:\n```json\n" + DOCUMENT + "```\nDone.");

        assertThat(document.subtopic()).isEqualTo("Current state of Raft");
    }

    @Test
    @DisplayName("null array entries do not cost the document its valid claims")
    void nullEntries() throws Exception {
        FindingsDocument document = parser.parse("""
                {"subtopic": "s",
                 "claims": [null, {"claim": "Raft is used", "evidence": "e",
                                   "sources": [null, {"url": "https://aws.com/raft", "credibility": 4}]}],
                 "gaps": [null, "no benchmarks"],
                 "search_queries_used": [null, "raft"]}
                """);

        assertThat(document.isStructurallyValid()).isTrue();
        assertThat(document.claims()).hasSize(2).containsNull();
        assertThat(document.claims().get(1).sources()).hasSize(2);
        assertThat(document.gaps()).containsExactly(null, "no benchmarks");
        assertThat(document.searchQueriesUsed()).containsExactly("raft");
    }

    @Test
    @DisplayName("a document without claims parses but is not structurally valid")
    void missingClaims() throws Exception {
        FindingsDocument document = parser.parse("{\"subtopic\": \"x\"}");

        assertThat(document.claims()).isNull();
        assertThat(document.isStructurallyValid()).isFalse();
    }

    @Test
    @DisplayName("replies without JSON are malformed output")
    void noJson() {
        assertThatThrownBy(() -> parser.parse("I could not find anything."))
                .isInstanceOf(WorkerMalformedOutputException.class)
                .hasMessageContaining("no JSON object");
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(WorkerMalformedOutputException.class);
    }

    @Test
    @DisplayName("broken JSON is malformed output")
    void brokenJson() {
        assertThatThrownBy(() -> parser.parse("{\"subtopic\": \"x\", \"claims\": [ }"))
                .isInstanceOf(WorkerMalformedOutputException.class)
                .hasMessageContaining("not a findings document");
    }
}
