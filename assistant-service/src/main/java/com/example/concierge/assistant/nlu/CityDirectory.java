package com.example.concierge.assistant.nlu;

import com.example.concierge.assistant.conversation.CityRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Alias table: city names, common variants and airport codes resolve to a canonical city and its IATA code.
 */
@Component
public class CityDirectory {

    /** A city found in free text, with the character offset where it starts. */
    public record CityMention(CityRef city, int position) {}

    private static final Map<String, String> ALIAS_TO_CITY = new HashMap<>();
    private static final Map<String, String> CITY_TO_IATA = new HashMap<>();
    private static final List<Pattern> ALIAS_PATTERNS = new ArrayList<>();

    static {
        // Metro
        addMapping("mumbai", "BOM", "bombay", "bom", "mumbai city");
        addMapping("delhi", "DEL", "new delhi", "del", "ncr");
        addMapping("bangalore", "BLR", "bengaluru", "blr");
        addMapping("chennai", "MAA", "madras", "maa");
        addMapping("hyderabad", "HYD", "hyd", "cyberabad");
        addMapping("kolkata", "CCU", "calcutta", "ccu");
        addMapping("ahmedabad", "AMD", "amd");
        addMapping("pune", "PNQ", "pnq");
        addMapping("kochi", "COK", "cochin", "cok");
        addMapping("goa", "GOI", "goi", "panaji");
        addMapping("jaipur", "JAI", "pink city");
        addMapping("lucknow", "LKO", "lko");
        addMapping("guwahati", "GAU", "gau");
        addMapping("chandigarh", "IXC", "ixc");
        // Tier-2
        addMapping("indore", "IDR", "idr");
        addMapping("bhopal", "BHO");
        addMapping("coimbatore", "CJB", "covai", "cjb");
        addMapping("mysore", "MYQ", "mysuru");
        addMapping("visakhapatnam", "VTZ", "vizag", "vtz");
        addMapping("nagpur", "NAG");
        addMapping("vadodara", "BDQ", "baroda", "bdq");
        addMapping("amritsar", "ATQ", "atq");
        addMapping("bhubaneswar", "BBI", "bbi");
        // Leisure
        addMapping("udaipur", "UDR", "udr");
        addMapping("jodhpur", "JDH", "jdh");
        addMapping("varanasi", "VNS", "banaras", "kashi", "vns");
        addMapping("srinagar", "SXR", "kashmir", "sxr");
        addMapping("darjeeling", "IXB", "bagdogra");
        // Business hubs served by Delhi
        addMapping("gurgaon", "DEL", "gurugram");
        addMapping("noida", "DEL");
        // International
        addMapping("dubai", "DXB", "dxb");
        addMapping("singapore", "SIN");
        addMapping("bangkok", "BKK", "bkk");
        addMapping("london", "LHR", "lhr");
        addMapping("new york", "JFK", "nyc", "jfk");
        addMapping("paris", "CDG", "cdg");
        addMapping("tokyo", "NRT");
        addMapping("sydney", "SYD");
        addMapping("doha", "DOH");
        addMapping("kathmandu", "KTM");
        addMapping("colombo", "CMB");
        addMapping("kuala lumpur", "KUL");
        addMapping("hong kong", "HKG");

        // Longest alias first so "new delhi" wins over "delhi".
        ALIAS_TO_CITY.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .forEach(a -> ALIAS_PATTERNS.add(Pattern.compile("\\b" + Pattern.quote(a) + "\\b")));
    }

    private static void addMapping(String city, String iata, String... aliases) {
        CITY_TO_IATA.put(city, iata);
        ALIAS_TO_CITY.put(city, city);
        for (String a : aliases) {
            ALIAS_TO_CITY.put(a.toLowerCase(Locale.ROOT), city);
        }
    }

    private static String slug(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    /** Exact lookup of a single city name, alias or IATA code. */
    public Optional<CityRef> resolve(String input) {
        String key = slug(input);
        if (key.isEmpty()) return Optional.empty();
        String city = ALIAS_TO_CITY.get(key);
        if (city == null) {
            String upper = key.toUpperCase(Locale.ROOT);
            city = CITY_TO_IATA.entrySet().stream()
                    .filter(en -> en.getValue().equals(upper))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(null);
        }
        return Optional.ofNullable(city).map(c -> new CityRef(c, CITY_TO_IATA.get(c)));
    }

    /** IATA code for a city reference, preferring the code it already carries. */
    public Optional<String> codeFor(CityRef ref) {
        if (!CityRef.isPresent(ref)) return Optional.empty();
        if (ref.code() != null && !ref.code().isBlank()) return Optional.of(ref.code().toUpperCase(Locale.ROOT));
        return resolve(ref.name()).map(CityRef::code);
    }

    /**
     * Every known city mentioned in the text, in order of appearance. Overlapping matches keep the longest alias;
     * a city mentioned twice is reported once.
     */
    public List<CityMention> findMentions(String text) {
        String low = slug(text);
        List<CityMention> found = new ArrayList<>();
        boolean[] taken = new boolean[low.length()];
        for (Pattern p : ALIAS_PATTERNS) {
            Matcher m = p.matcher(low);
            while (m.find()) {
                if (overlaps(taken, m.start(), m.end())) continue;
                for (int i = m.start(); i < m.end(); i++) taken[i] = true;
                String city = ALIAS_TO_CITY.get(m.group());
                found.add(new CityMention(new CityRef(city, CITY_TO_IATA.get(city)), m.start()));
            }
        }
        found.sort(Comparator.comparingInt(CityMention::position));
        List<CityMention> distinct = new ArrayList<>();
        for (CityMention cm : found) {
            boolean seen = distinct.stream().anyMatch(d -> d.city().name().equals(cm.city().name()));
            if (!seen) distinct.add(cm);
        }
        return distinct;
    }

    private static boolean overlaps(boolean[] taken, int start, int end) {
        for (int i = start; i < end; i++) {
            if (taken[i]) return true;
        }
        return false;
    }
}
