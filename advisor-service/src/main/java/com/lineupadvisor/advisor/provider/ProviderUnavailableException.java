package com.lineupadvisor.advisor.provider;

/**
 * A provider could not be asked for data this time (rate limit reached, upstream down).
 */
public class ProviderUnavailableException extends RuntimeException {

    private final String provider;

    public ProviderUnavailableException(String provider, String message) {
        super(provider + ": " + message);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
