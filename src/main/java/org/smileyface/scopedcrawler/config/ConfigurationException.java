package org.smileyface.scopedcrawler.config;

/**
 * Raised when crawl configuration is invalid: empty proxy list, malformed glob pattern,
 * non-positive page budget, unknown config fields and so on. Always surfaced before a
 * crawl reaches the RUNNING state.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
