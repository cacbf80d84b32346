package com.example.concierge.assistant.nlu;

import com.example.concierge.assistant.conversation.SlotExtraction;

/**
 * Pulls intent and slots out of a single user message. Best effort: implementations never throw
 * and leave a field null when they cannot fill it.
 */
public interface SlotExtractor {

    SlotExtraction extract(String text);
}
