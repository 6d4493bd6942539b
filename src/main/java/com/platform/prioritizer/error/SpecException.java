package com.platform.prioritizer.error;

/**
 * Malformed aggregation spec, e.g. a categorical with neither choices nor a choice query.
 */
public class SpecException extends PrioritizerException {

    public SpecException(String message) {
        super(message);
    }

    public SpecException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRunFatal() {
        return true;
    }
}
