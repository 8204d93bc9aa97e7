package org.camunda.bpm.getstarted.autolayout.exceptions;

/**
 * Base class for failures that abort a layout run. No layout field of the graph
 * is modified when one of these is thrown.
 */
public class LayoutException extends RuntimeException {
    public LayoutException(String message) {
        super(message);
    }

    public LayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
