package org.camunda.bpm.getstarted.autolayout.bpmn.models;

/**
 * Position and size of a node in diagram pixels. (x, y) is the top-left corner,
 * as in BPMN DI {@code dc:Bounds}.
 */
public record Bounds(
        double x,
        double y,
        double width,
        double height
) {
    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }
}
