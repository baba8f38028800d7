package com.fintech.candlestream.config;

/**
 * Invalid or missing startup settings. Thrown while the application context
 * is being built, so the process does not start.
 */
public class ConfigurationException extends RuntimeException {
    
    public ConfigurationException(String message) {
        super(message);
    }
}
