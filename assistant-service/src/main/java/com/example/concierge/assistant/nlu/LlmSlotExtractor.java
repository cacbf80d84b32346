package com.example.concierge.assistant.nlu;

import com.example.concierge.assistant.conversation.CityRef;
import com.example.concierge.assistant.conversation.Intent;
import com.example.concierge.assistant.conversation.Preference;
import com.example.concierge.assistant.conversation.SlotExtraction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Asks the language model for slots and falls back to the rule-based extractor for every
 * field the model leaves empty, or for the whole message when the call fails.
 */
public class LlmSlotExtractor implements SlotExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmSlotExtractor.class);

    private final SlotExtractionAgent agent;
    private final RuleBasedSlotExtractor rules;
    private final CityDirectory cities;
    private final DateNormalizer dates;
    private final ObjectMapper mapper;

    public LlmSlotExtractor(SlotExtractionAgent agent, RuleBasedSlotExtractor rules,
                            CityDirectory cities, DateNormalizer dates, ObjectMapper mapper) {
        this.agent = agent;
        this.rules = rules;
        this.cities = cities;
        this.dates = dates;
        this.mapper = mapper;
    }

    @Override
    public SlotExtraction extract(String text) {
        SlotExtraction fallback = rules.extract(text);
        if (text == null || text.isBlank()) return fallback;
        try {
            String raw = agent.extract(text);
            JsonNode node = mapper.readTree(stripFences(raw));
            if (node == null || !node.isObject()) {
                log.warn("[LlmSlotExtractor] Non-object answer, using rules: {}", raw);
                return fallback;
            }
            Intent intent = Intent.fromValue(node.path("intent").asText(""));
            CityRef from = city(node.path("from").asText(""));
            CityRef to = city(node.path("to").asText(""));
            String date = dates.normalize(node.path("date").asText("")).orElse(null);
            Preference preference = Preference.fromValue(node.path("preference").asText(""));
            return new SlotExtraction(
                    intent != null ? intent : fallback.intent(),
                    CityRef.isPresent(from) ? from : fallback.from(),
                    CityRef.isPresent(to) ? to : fallback.to(),
                    date != null ? date : fallback.date(),
                    preference != Preference.NONE ? preference : fallback.preference());
        } catch (Exception e) {
            log.warn("[LlmSlotExtractor] Model extraction failed, using rules: {}", e.toString());
            return fallback;
        }
    }

    private CityRef city(String name) {
        if (name == null || name.isBlank()) return null;
        return cities.resolve(name).orElse(CityRef.of(name.trim().toLowerCase(Locale.ROOT)));
    }

    /** Models like to wrap JSON in markdown fences; keep only the outermost object. */
    static String stripFences(String raw) {
        if (raw == null) return "{}";
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) return raw.trim();
        return raw.substring(start, end + 1);
    }
}
