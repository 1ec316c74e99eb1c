package io.computeorchestrator.hypervisor;

/**
 * Exception thrown when a hypervisor operation fails on a node.
 */
public class HypervisorException extends Exception {

    private final String nodeId;

    public HypervisorException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public HypervisorException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
