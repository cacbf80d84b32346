package com.example.concierge.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "assistant.sources.amadeus")
public class AmadeusProperties {
    private boolean enabled = false;
    private String baseUrl = "https://test.api.amadeus.com";
    private String tokenPath = "/v1/security/oauth2/token";
    private String offersPath = "/v2/shopping/flight-offers";
    private String clientId = "";
    private String clientSecret = "";
    private String currency = "INR";
    private int adults = 1;
    private long requestTimeoutMs = 8000;
    private long tokenTtlSeconds = 1500; // upper bound; the server's expires_in wins when shorter

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getTokenPath() { return tokenPath; }
    public void setTokenPath(String tokenPath) { this.tokenPath = tokenPath; }

    public String getOffersPath() { return offersPath; }
    public void setOffersPath(String offersPath) { this.offersPath = offersPath; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }

    public int getAdults() { return adults; }
    public void setAdults(int adults) { this.adults = adults; }

    public long getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public long getTokenTtlSeconds() { return tokenTtlSeconds; }
    public void setTokenTtlSeconds(long tokenTtlSeconds) { this.tokenTtlSeconds = tokenTtlSeconds; }
}
