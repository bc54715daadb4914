package com.liftsys.compiler.assembly;

/**
 * 结构树或片段违反组装契约（负深度、子节点深度不大于父节点等）
 */
public class AssemblyException extends RuntimeException {
    private final String nodeId;

    public AssemblyException(String message, String nodeId) {
        super(nodeId != null ? message + " [node " + nodeId + "]" : message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
