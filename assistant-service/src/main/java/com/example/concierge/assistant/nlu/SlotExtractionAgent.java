package com.example.concierge.assistant.nlu;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;

/**
 * LangChain4j AI service that reads one chat message and answers with a JSON slot object.
 */
public interface SlotExtractionAgent {

    @SystemMessage("You extract flight booking slots from a single user message. Answer with ONE JSON object and nothing else, "
            + "using exactly these keys: intent, from, to, date, preference. "
            + "intent is one of: search_flights, book_flight, confirm, payment_done, restart. "
            + "from and to are city names in lower case, or empty string when not mentioned. "
            + "date is YYYY-MM-DD, or the raw phrase the user wrote (e.g. 'tomorrow'), or empty string. "
            + "preference is one of: cheapest, earliest, business, or empty string. Never invent values.")
    String extract(@UserMessage String message);
}
