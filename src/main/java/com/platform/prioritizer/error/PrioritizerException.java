package com.platform.prioritizer.error;

/**
 * Root of the pipeline's failure taxonomy.
 * <p>
 * Run-fatal failures indicate a configuration defect: the run stops and the
 * manifest records the cause. Other failures are scoped to a split, a model
 * class or a single work unit, and the run continues with the remaining work.
 */
public abstract class PrioritizerException extends RuntimeException {

    protected PrioritizerException(String message) {
        super(message);
    }

    protected PrioritizerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRunFatal();
}
