package com.platform.prioritizer.error;

/**
 * A model class identifier no fitting collaborator can resolve. Fatal for that class only.
 */
public class GridException extends PrioritizerException {

    public GridException(String message) {
        super(message);
    }

    public GridException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRunFatal() {
        return false;
    }
}
