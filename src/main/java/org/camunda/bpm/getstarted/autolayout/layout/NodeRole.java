package org.camunda.bpm.getstarted.autolayout.layout;

/**
 * Structural roles of a node, derived from its type and flow degree.
 * Join and Split are not exclusive with each other or with the event roles.
 */
public enum NodeRole {
    ELEMENT("Element"),
    START_EVENT("Start Event"),
    END_EVENT("End Event"),
    JOIN("Join"),
    SPLIT("Split");

    private final String label;

    NodeRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
