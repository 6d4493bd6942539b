package com.platform.prioritizer.error;

/**
 * The fitting collaborator rejected a training matrix. Fatal for the work unit only.
 */
public class FitException extends PrioritizerException {

    public FitException(String message) {
        super(message);
    }

    public FitException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRunFatal() {
        return false;
    }
}
