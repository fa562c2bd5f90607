package com.lineupadvisor.common.exception;

/**
 * Raised when a strategy profile, baseline table or bye-week table is invalid.
 * Thrown at load time so that no request is ever scored against a broken configuration.
 */
public class ConfigurationException extends RuntimeException {
    private final String source;

    public ConfigurationException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public ConfigurationException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
