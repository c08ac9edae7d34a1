package com.eainde.research.config;

import com.eainde.research.dispatch.FindingsDocumentParser;
import com.eainde.research.dispatch.LlmResearchWorker;
import com.eainde.research.dispatch.ResearchWorker;
import com.eainde.research.dispatch.UnconfiguredResearchWorker;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chooses the research worker: a chat-model-backed worker when an API key is configured,
 * otherwise a worker that fails every assignment with a fetch gap.
 */
@Log4j2
@Configuration
public class LlmWorkerConfig {

    @Value("${research.llm.api-key:}")
    private String apiKey;

    @Value("${research.llm.base-url:https://generativelanguage.googleapis.com/v1beta/openai/}")
    private String baseUrl;

    @Value("${research.llm.model-name:gemini-2.0-flash}")
    private String modelName;

    @Value("${research.llm.temperature:0.2}")
    private double temperature;

    @Value("${research.llm.timeout:2m}")
    private Duration timeout;

    @Bean
    public FindingsDocumentParser findingsDocumentParser(ObjectMapper objectMapper) {
        return new FindingsDocumentParser(objectMapper);
    }

    @Bean
    public ResearchWorker researchWorker(FindingsDocumentParser parser) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("research.llm.api-key is not set; every worker will report a fetch failure");
            return new UnconfiguredResearchWorker();
        }
        log.info("Research workers use model {} at {}", modelName, baseUrl);
        ChatModel chatModel = OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(timeout)
                .build();
        return new LlmResearchWorker(chatModel, parser);
    }
}
