package com.example.concierge.assistant.source;

import java.util.List;

/**
 * An upstream flight-offer provider.
 */
public interface SourceClient {

    /** Name used for reliability lookup and reporting, e.g. "Amadeus". */
    String name();

    /**
     * @param fromCode origin IATA code
     * @param toCode   destination IATA code
     * @param date     ISO date
     * @throws SourceUnavailableException when the provider cannot be reached or rejects the call
     * @throws SourceTimeoutException     when the provider does not answer in time
     */
    List<RawOffer> fetch(String fromCode, String toCode, String date);
}
