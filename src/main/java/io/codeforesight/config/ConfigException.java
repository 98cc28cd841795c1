package io.codeforesight.config;

/**
 * Invalid or contradictory configuration. Fatal: the run aborts before any stage executes.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
