package com.example.concierge.assistant.conversation;

import java.util.Locale;

/**
 * Canonical city name plus its IATA code when known. A blank name means "not provided".
 */
public record CityRef(String name, String code) {

    public static CityRef of(String name) {
        return new CityRef(name, null);
    }

    public boolean isPresent() {
        return name != null && !name.isBlank();
    }

    public static boolean isPresent(CityRef ref) {
        return ref != null && ref.isPresent();
    }

    /** Title-cased name for replies, e.g. "new delhi" -> "New Delhi". */
    public String displayName() {
        if (!isPresent()) return "";
        StringBuilder sb = new StringBuilder();
        for (String part : name.trim().split("\\s+")) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
        }
        return sb.toString();
    }
}
