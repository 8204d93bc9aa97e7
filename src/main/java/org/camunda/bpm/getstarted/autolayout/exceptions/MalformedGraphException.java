package org.camunda.bpm.getstarted.autolayout.exceptions;

/**
 * The process graph is inconsistent, e.g. a sequence flow references a node id
 * that is not part of the graph.
 */
public class MalformedGraphException extends LayoutException {
    public MalformedGraphException(String message) {
        super(message);
    }
}
