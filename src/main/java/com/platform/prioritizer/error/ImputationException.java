package com.platform.prioritizer.error;

/**
 * A metric without a resolvable imputation rule, or a missing value under the {@code error} rule.
 */
public class ImputationException extends PrioritizerException {

    public ImputationException(String message) {
        super(message);
    }

    public ImputationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRunFatal() {
        return true;
    }
}
