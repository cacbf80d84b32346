package com.example.concierge.assistant.conversation;

/**
 * Slots pulled out of one user message. Every field may be null or blank.
 */
public record SlotExtraction(Intent intent, CityRef from, CityRef to, String date, Preference preference) {

    public static SlotExtraction empty() {
        return new SlotExtraction(null, null, null, null, Preference.NONE);
    }

    public SlotExtraction withIntent(Intent newIntent) {
        return new SlotExtraction(newIntent, from, to, date, preference);
    }
}
