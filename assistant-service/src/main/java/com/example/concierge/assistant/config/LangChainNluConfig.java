package com.example.concierge.assistant.config;

import com.example.concierge.assistant.nlu.CityDirectory;
import com.example.concierge.assistant.nlu.DateNormalizer;
import com.example.concierge.assistant.nlu.LlmSlotExtractor;
import com.example.concierge.assistant.nlu.RuleBasedSlotExtractor;
import com.example.concierge.assistant.nlu.SlotExtractionAgent;
import com.example.concierge.assistant.nlu.SlotExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Wires the model-backed slot extractor. Active only with {@code assistant.nlu.provider=ollama};
 * otherwise the rule-based extractor is the only {@link SlotExtractor}.
 */
@Configuration
@ConditionalOnProperty(prefix = "assistant.nlu", name = "provider", havingValue = "ollama")
public class LangChainNluConfig {

    @Bean
    public ChatLanguageModel chatLanguageModel(AssistantOllamaProperties props) {
        return OllamaChatModel.builder()
                .baseUrl(props.getBaseUrl())
                .modelName(props.getModel())
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .temperature(props.getTemperature())
                .format("json")
                .build();
    }

    @Bean
    public SlotExtractionAgent slotExtractionAgent(ChatLanguageModel model) {
        return AiServices.builder(SlotExtractionAgent.class)
                .chatLanguageModel(model)
                .build();
    }

    @Bean
    @Primary
    public SlotExtractor llmSlotExtractor(SlotExtractionAgent agent, RuleBasedSlotExtractor rules,
                                          CityDirectory cities, DateNormalizer dates, ObjectMapper mapper) {
        return new LlmSlotExtractor(agent, rules, cities, dates, mapper);
    }
}
