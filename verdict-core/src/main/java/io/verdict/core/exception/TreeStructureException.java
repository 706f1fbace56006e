package io.verdict.core.exception;

import java.io.Serial;

/// Thrown when the start node is missing, a node id does not match its key, or an
/// edge references a node id that does not exist.
public class TreeStructureException extends TreeValidationException {
    @Serial private static final long serialVersionUID = -1953807356115248127L;

    private final String nodeId;
    private final String referencedNodeId;

    /// @param message description of the defect, not null
    /// @param nodeId node declaring the defect, null for tree-level defects
    /// @param referencedNodeId the id that failed to resolve, may be null
    public TreeStructureException(String message, String nodeId, String referencedNodeId) {
        super(TreeErrorKind.STRUCTURE, message);
        this.nodeId = nodeId;
        this.referencedNodeId = referencedNodeId;
    }

    /// @return the node declaring the defect, or null for tree-level defects
    public String getNodeId() {
        return nodeId;
    }

    /// @return the id that failed to resolve, or null if not a reference defect
    public String getReferencedNodeId() {
        return referencedNodeId;
    }
}
