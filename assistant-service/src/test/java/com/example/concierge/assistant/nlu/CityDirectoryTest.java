package com.example.concierge.assistant.nlu;

import com.example.concierge.assistant.conversation.CityRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CityDirectoryTest {

    private final CityDirectory cities = new CityDirectory();

    @Test
    void resolvesNamesAliasesAndCodes() {
        assertThat(cities.resolve("Bombay")).contains(new CityRef("mumbai", "BOM"));
        assertThat(cities.resolve("  Bengaluru ")).contains(new CityRef("bangalore", "BLR"));
        assertThat(cities.resolve("maa")).contains(new CityRef("chennai", "MAA"));
        assertThat(cities.resolve("GOI")).contains(new CityRef("goa", "GOI"));
        assertThat(cities.resolve("atlantis")).isEmpty();
    }

    @Test
    void codeForPrefersCarriedCode() {
        assertThat(cities.codeFor(new CityRef("delhi", "del"))).contains("DEL");
        assertThat(cities.codeFor(CityRef.of("calcutta"))).contains("CCU");
        assertThat(cities.codeFor(CityRef.of("nowhere"))).isEmpty();
        assertThat(cities.codeFor(null)).isEmpty();
    }

    @Test
    void mentionsInOrderWithLongestAliasWinning() {
        List<CityDirectory.CityMention> mentions = cities.findMentions("Flights from New Delhi to Mumbai");
        assertThat(mentions).extracting(m -> m.city().name()).containsExactly("delhi", "mumbai");
    }

    @Test
    void repeatedCityReportedOnce() {
        assertThat(cities.findMentions("goa, goa, and more goa")).hasSize(1);
    }
}
