package org.camunda.bpm.getstarted.autolayout.bpmn.models;

/**
 * One point of a sequence flow polyline (BPMN DI {@code di:waypoint}).
 */
public record Waypoint(double x, double y) {
}
