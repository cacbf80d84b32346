package com.example.concierge.assistant.nlu;

import com.example.concierge.assistant.conversation.CityRef;
import com.example.concierge.assistant.conversation.Intent;
import com.example.concierge.assistant.conversation.Preference;
import com.example.concierge.assistant.conversation.SlotExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword and regex extractor. Intent patterns are tried in declaration order; anything
 * unmatched is treated as a flight search.
 */
@Component
public class RuleBasedSlotExtractor implements SlotExtractor {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedSlotExtractor.class);

    private static final Map<Intent, List<Pattern>> INTENT_PATTERNS = new LinkedHashMap<>();
    static {
        INTENT_PATTERNS.put(Intent.RESTART, List.of(
                Pattern.compile("\\b(?:start over|restart|reset|new search)\\b")));
        INTENT_PATTERNS.put(Intent.PAYMENT_DONE, List.of(
                Pattern.compile("\\b(?:i have paid|i've paid|paid|payment (?:done|complete|completed|successful))\\b")));
        INTENT_PATTERNS.put(Intent.CONFIRM, List.of(
                Pattern.compile("\\bconfirm\\s*(?:&|and)\\s*pay\\b"),
                Pattern.compile("\\b(?:book it|go ahead|proceed|yes,? book)\\b"),
                Pattern.compile("^\\s*(?:confirm|yes)\\s*[.!]?\\s*$")));
        INTENT_PATTERNS.put(Intent.BOOK_FLIGHT, List.of(
                Pattern.compile("\\b(?:reserve|buy|purchase)\\s+(?:a\\s+)?(?:flights?|tickets?)\\b"),
                Pattern.compile("\\b(?:confirm|finalize)\\s+(?:booking|reservation)\\b")));
        INTENT_PATTERNS.put(Intent.SEARCH_FLIGHTS, List.of(
                Pattern.compile("\\b(?:search|find|book|get|show)\\s+(?:me\\s+)?(?:flights?|tickets?)\\b"),
                Pattern.compile("\\b(?:fly|travel|go)\\s+(?:to|from)\\b"),
                Pattern.compile("\\b(?:flights?|ticket|booking)\\b")));
    }

    private static final Pattern CHEAP = Pattern.compile("\\b(?:cheap|cheapest|lowest|budget|affordable)\\b");
    private static final Pattern EARLY = Pattern.compile("\\b(?:fast|fastest|quick|earliest|morning)\\b");
    private static final Pattern PREMIUM = Pattern.compile("\\b(?:business|first class|premium|luxury)\\b");
    private static final Pattern FROM_WORD = Pattern.compile("\\bfrom\\b");

    private final CityDirectory cities;
    private final DateNormalizer dates;

    public RuleBasedSlotExtractor(CityDirectory cities, DateNormalizer dates) {
        this.cities = cities;
        this.dates = dates;
    }

    @Override
    public SlotExtraction extract(String text) {
        if (text == null || text.isBlank()) return SlotExtraction.empty();
        try {
            String low = text.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
            Intent intent = intentOf(low);
            CityRef[] route = route(low);
            String date = dates.normalize(low).orElse(null);
            Preference preference = preferenceOf(low);
            SlotExtraction out = new SlotExtraction(intent, route[0], route[1], date, preference);
            log.debug("[RuleBasedSlotExtractor] '{}' -> {}", text, out);
            return out;
        } catch (RuntimeException e) {
            log.warn("[RuleBasedSlotExtractor] Extraction failed for '{}': {}", text, e.toString());
            return SlotExtraction.empty();
        }
    }

    static Intent intentOf(String low) {
        for (Map.Entry<Intent, List<Pattern>> en : INTENT_PATTERNS.entrySet()) {
            for (Pattern p : en.getValue()) {
                if (p.matcher(low).find()) return en.getKey();
            }
        }
        return Intent.SEARCH_FLIGHTS;
    }

    static Preference preferenceOf(String low) {
        if (CHEAP.matcher(low).find()) return Preference.CHEAPEST;
        if (EARLY.matcher(low).find()) return Preference.EARLIEST;
        if (PREMIUM.matcher(low).find()) return Preference.BUSINESS;
        return Preference.NONE;
    }

    private CityRef[] route(String low) {
        List<CityDirectory.CityMention> mentions = cities.findMentions(low);
        if (mentions.isEmpty()) return new CityRef[]{null, null};
        if (mentions.size() == 1) {
            CityDirectory.CityMention only = mentions.get(0);
            String before = wordBefore(low, only.position());
            boolean isOrigin = "from".equals(before)
                    || (!"to".equals(before) && FROM_WORD.matcher(low).find());
            return isOrigin ? new CityRef[]{only.city(), null} : new CityRef[]{null, only.city()};
        }
        CityDirectory.CityMention first = mentions.get(0);
        CityDirectory.CityMention second = mentions.get(1);
        // "to goa from pune" names the destination first
        if ("to".equals(wordBefore(low, first.position())) && "from".equals(wordBefore(low, second.position()))) {
            return new CityRef[]{second.city(), first.city()};
        }
        return new CityRef[]{first.city(), second.city()};
    }

    private static String wordBefore(String text, int position) {
        String head = text.substring(0, Math.max(0, position)).trim();
        if (head.isEmpty()) return "";
        int space = head.lastIndexOf(' ');
        return space < 0 ? head : head.substring(space + 1);
    }
}
