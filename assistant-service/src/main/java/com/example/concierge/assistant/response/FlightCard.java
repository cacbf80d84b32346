package com.example.concierge.assistant.response;

/**
 * Display model for one flight in the chat UI.
 */
public class FlightCard {
    private final String id;
    private final String airline;
    private final String airlineName;
    private final String code;
    private final String time;
    private final String searchDate;
    private final int price;
    private final String formattedPrice;
    private final String duration;
    private final String stops; // "Direct" | "1 stop" | "2 stops"
    private final int stopsCount;
    private final String fareClass;
    private final String source;
    private final double confidence;
    private final String dataQuality;
    private final boolean direct;
    private boolean cheapest;
    private boolean fastest;

    public FlightCard(String id, String airline, String airlineName, String code, String time, String searchDate,
                      int price, String formattedPrice, String duration, String stops, int stopsCount,
                      String fareClass, String source, double confidence, String dataQuality) {
        this.id = id;
        this.airline = airline;
        this.airlineName = airlineName;
        this.code = code;
        this.time = time;
        this.searchDate = searchDate;
        this.price = price;
        this.formattedPrice = formattedPrice;
        this.duration = duration;
        this.stops = stops;
        this.stopsCount = stopsCount;
        this.fareClass = fareClass;
        this.source = source;
        this.confidence = confidence;
        this.dataQuality = dataQuality;
        this.direct = stopsCount == 0;
    }

    public String getId() { return id; }
    public String getAirline() { return airline; }
    public String getAirlineName() { return airlineName; }
    public String getCode() { return code; }
    public String getTime() { return time; }
    public String getSearchDate() { return searchDate; }
    public int getPrice() { return price; }
    public String getFormattedPrice() { return formattedPrice; }
    public String getDuration() { return duration; }
    public String getStops() { return stops; }
    public int getStopsCount() { return stopsCount; }
    public String getFareClass() { return fareClass; }
    public String getSource() { return source; }
    public double getConfidence() { return confidence; }
    public String getDataQuality() { return dataQuality; }
    public boolean isDirect() { return direct; }

    public boolean isCheapest() { return cheapest; }
    void setCheapest(boolean cheapest) { this.cheapest = cheapest; }

    public boolean isFastest() { return fastest; }
    void setFastest(boolean fastest) { this.fastest = fastest; }
}
