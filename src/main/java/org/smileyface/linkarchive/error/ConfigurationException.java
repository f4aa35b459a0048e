package org.smileyface.linkarchive.error;

/**
 * Setup is unusable: invalid properties, unreadable link list, missing fetcher. Raised before
 * any URL is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
