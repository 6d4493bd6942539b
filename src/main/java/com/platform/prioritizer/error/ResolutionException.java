package com.platform.prioritizer.error;

/**
 * Ambiguous cohort or label data for one as-of date. Fatal for the split only.
 */
public class ResolutionException extends PrioritizerException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRunFatal() {
        return false;
    }
}
