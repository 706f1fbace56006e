package io.verdict.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when nodes cannot be reached from the start node. Lists all of them.
public class UnreachableNodesException extends TreeValidationException {
    @Serial private static final long serialVersionUID = -2230947815706284406L;

    private final List<String> unreachableNodeIds;

    public UnreachableNodesException(List<String> unreachableNodeIds) {
        super(
                TreeErrorKind.UNREACHABLE,
                "Decision tree contains unreachable nodes: "
                        + String.join(", ", unreachableNodeIds));
        this.unreachableNodeIds = List.copyOf(unreachableNodeIds);
    }

    /// @return unmodifiable list of unreachable node ids in declaration order
    public List<String> getUnreachableNodeIds() {
        return unreachableNodeIds;
    }
}
