package org.camunda.bpm.getstarted.autolayout.bpmn.models;

/**
 * BPMN flow node kinds known to the layouter, keyed by their BPMN 2.0 XML local name.
 */
public enum NodeType {
    TASK("task"),
    USER_TASK("userTask"),
    SERVICE_TASK("serviceTask"),
    SCRIPT_TASK("scriptTask"),
    BUSINESS_RULE_TASK("businessRuleTask"),
    SEND_TASK("sendTask"),
    RECEIVE_TASK("receiveTask"),
    MANUAL_TASK("manualTask"),
    SUB_PROCESS("subProcess"),
    START_EVENT("startEvent"),
    END_EVENT("endEvent"),
    INTERMEDIATE_CATCH_EVENT("intermediateCatchEvent"),
    INTERMEDIATE_THROW_EVENT("intermediateThrowEvent"),
    BOUNDARY_EVENT("boundaryEvent"),
    EXCLUSIVE_GATEWAY("exclusiveGateway"),
    INCLUSIVE_GATEWAY("inclusiveGateway"),
    PARALLEL_GATEWAY("parallelGateway"),
    EVENT_BASED_GATEWAY("eventBasedGateway"),
    COMPLEX_GATEWAY("complexGateway"),
    DATA_OBJECT("dataObject");

    private final String bpmnName;

    NodeType(String bpmnName) {
        this.bpmnName = bpmnName;
    }

    public String getBpmnName() {
        return bpmnName;
    }

    public boolean isStartEvent() {
        return this == START_EVENT;
    }

    public boolean isEndEvent() {
        return this == END_EVENT;
    }

    public boolean isGateway() {
        return switch (this) {
            case EXCLUSIVE_GATEWAY, INCLUSIVE_GATEWAY, PARALLEL_GATEWAY, EVENT_BASED_GATEWAY, COMPLEX_GATEWAY -> true;
            default -> false;
        };
    }

    /**
     * Gateways whose outgoing flows are routed with a vertical turn.
     * Event based and complex gateways are routed like any other node.
     */
    public boolean isBranchingGateway() {
        return this == EXCLUSIVE_GATEWAY || this == INCLUSIVE_GATEWAY || this == PARALLEL_GATEWAY;
    }

    /**
     * Resolves a BPMN XML local name such as "userTask" or "parallelGateway".
     *
     * @throws IllegalArgumentException if the name is not a supported node kind
     */
    public static NodeType fromBpmnName(String bpmnName) {
        for (NodeType type : values()) {
            if (type.bpmnName.equals(bpmnName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported BPMN node type: " + bpmnName);
    }
}
