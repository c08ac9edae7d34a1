package com.eainde.research.dispatch;

import com.eainde.research.model.FindingsDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a worker's raw reply into a {@link FindingsDocument}.
 *
 * <p>Model replies often wrap JSON in Markdown fences or add a sentence around it; the
 * outermost {@code {...}} block is extracted before parsing. Required-field checks are left
 * to the caller so that a document missing {@code subtopic}/{@code claims} can still be
 * reported precisely.</p>
 */
public class FindingsDocumentParser {

    private final ObjectMapper objectMapper;

    public FindingsDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FindingsDocument parse(String reply) throws WorkerMalformedOutputException {
        if (reply == null || reply.isBlank()) {
            throw new WorkerMalformedOutputException("empty reply");
        }
        String json = extractJsonObject(reply);
        if (json == null) {
            throw new WorkerMalformedOutputException("reply contains no JSON object");
        }
        try {
            FindingsDocument document = objectMapper.readValue(json, FindingsDocument.class);
            if (document == null) {
                throw new WorkerMalformedOutputException("reply is JSON null");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new WorkerMalformedOutputException("reply is not a findings document: "
                    + e.getOriginalMessage(), e);
        }
    }

    static String extractJsonObject(String reply) {
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        return reply.substring(start, end + 1);
    }
}
