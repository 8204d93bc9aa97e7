package org.camunda.bpm.getstarted.autolayout.bpmn.models;

import lombok.Builder;

import java.util.List;

@Builder
public record FlowNode(
        String id,
        NodeType type,
        String name,
        List<String> incomingFlowIds,  // sequence flow ids ending here, in insertion order
        List<String> outgoingFlowIds,  // sequence flow ids starting here, in insertion order

        // layout output, null until the layouter committed a run
        Integer row,
        Integer column,
        Bounds bounds
) {
    public FlowNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Flow node id must not be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Flow node '" + id + "' has no type");
        }
        incomingFlowIds = incomingFlowIds == null ? List.of() : List.copyOf(incomingFlowIds);
        outgoingFlowIds = outgoingFlowIds == null ? List.of() : List.copyOf(outgoingFlowIds);
    }

    public FlowNode(String id, NodeType type, String name) {
        this(id, type, name, List.of(), List.of(), null, null, null);
    }

    public boolean isLaidOut() {
        return bounds != null;
    }

    // Custom toBuilder method for safe copying with modifications
    public FlowNodeBuilder toBuilder() {
        return FlowNode.builder()
                .id(this.id)
                .type(this.type)
                .name(this.name)
                .incomingFlowIds(this.incomingFlowIds)
                .outgoingFlowIds(this.outgoingFlowIds)
                .row(this.row)
                .column(this.column)
                .bounds(this.bounds);
    }
}
