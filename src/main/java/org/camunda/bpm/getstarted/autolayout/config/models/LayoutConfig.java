package org.camunda.bpm.getstarted.autolayout.config.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Constants of one layout run. Pixel values are used by the coordinate mapper,
 * grid values by the placer.
 *
 * Example:
 * {
 *   "columnPitch": 150,
 *   "rowPitch": 100,
 *   "margin": 50,
 *   "rowStride": 1
 * }
 *
 * @param columnPitch            horizontal distance between two grid columns, in pixels
 * @param rowPitch               vertical distance between two grid rows, in pixels
 * @param margin                 pixel offset added to both coordinates
 * @param rowStride              grid rows between independent chains, split branches and shifted cells
 * @param startColumn            column of nodes without predecessors
 * @param nodeWidth              width given to every node
 * @param nodeHeight             height given to every node
 * @param maxSequencerIterations upper bound of sequencer rounds, never below nodes + flows + 1; 0 derives it from the graph size
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutConfig(
        int columnPitch,
        int rowPitch,
        int margin,
        int rowStride,
        int startColumn,
        double nodeWidth,
        double nodeHeight,
        int maxSequencerIterations
) {
    public static final int DEFAULT_COLUMN_PITCH = 150;
    public static final int DEFAULT_ROW_PITCH = 100;
    public static final int DEFAULT_MARGIN = 50;
    public static final int DEFAULT_ROW_STRIDE = 1;
    public static final int DEFAULT_START_COLUMN = 1;
    public static final double DEFAULT_NODE_WIDTH = 100;
    public static final double DEFAULT_NODE_HEIGHT = 100;

    public LayoutConfig {
        if (rowStride < 1) {
            throw new IllegalArgumentException("rowStride must be at least 1, got " + rowStride);
        }
        if (columnPitch <= 0 || rowPitch <= 0) {
            throw new IllegalArgumentException("columnPitch and rowPitch must be positive");
        }
        if (nodeWidth <= 0 || nodeHeight <= 0) {
            throw new IllegalArgumentException("nodeWidth and nodeHeight must be positive");
        }
        if (maxSequencerIterations < 0) {
            throw new IllegalArgumentException("maxSequencerIterations must not be negative");
        }
    }

    public static LayoutConfig defaults() {
        return new LayoutConfig(DEFAULT_COLUMN_PITCH, DEFAULT_ROW_PITCH, DEFAULT_MARGIN, DEFAULT_ROW_STRIDE,
                DEFAULT_START_COLUMN, DEFAULT_NODE_WIDTH, DEFAULT_NODE_HEIGHT, 0);
    }

    // Missing keys fall back to the defaults
    @JsonCreator
    public static LayoutConfig fromJson(
            @JsonProperty("columnPitch") Integer columnPitch,
            @JsonProperty("rowPitch") Integer rowPitch,
            @JsonProperty("margin") Integer margin,
            @JsonProperty("rowStride") Integer rowStride,
            @JsonProperty("startColumn") Integer startColumn,
            @JsonProperty("nodeWidth") Double nodeWidth,
            @JsonProperty("nodeHeight") Double nodeHeight,
            @JsonProperty("maxSequencerIterations") Integer maxSequencerIterations) {
        return new LayoutConfig(
                columnPitch != null ? columnPitch : DEFAULT_COLUMN_PITCH,
                rowPitch != null ? rowPitch : DEFAULT_ROW_PITCH,
                margin != null ? margin : DEFAULT_MARGIN,
                rowStride != null ? rowStride : DEFAULT_ROW_STRIDE,
                startColumn != null ? startColumn : DEFAULT_START_COLUMN,
                nodeWidth != null ? nodeWidth : DEFAULT_NODE_WIDTH,
                nodeHeight != null ? nodeHeight : DEFAULT_NODE_HEIGHT,
                maxSequencerIterations != null ? maxSequencerIterations : 0);
    }

    /**
     * Sequencer round limit for a graph of the given size. Every round sequences a
     * node or drops a flow, so nodes + flows + 1 rounds always suffice; a configured
     * value below that is raised to it.
     */
    public int sequencerIterationLimit(int nodeCount, int flowCount) {
        return Math.max(maxSequencerIterations, nodeCount + flowCount + 1);
    }
}
