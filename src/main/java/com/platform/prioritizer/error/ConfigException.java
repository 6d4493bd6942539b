package com.platform.prioritizer.error;

/**
 * Malformed or contradictory experiment configuration. Aborts the run before any work unit starts.
 */
public class ConfigException extends PrioritizerException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRunFatal() {
        return true;
    }
}
