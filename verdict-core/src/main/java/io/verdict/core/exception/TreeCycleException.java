package io.verdict.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a cycle is reachable from the start node.
public class TreeCycleException extends TreeValidationException {
    @Serial private static final long serialVersionUID = 8832951046263390817L;

    private final List<String> cycle;

    /// @param cycle node ids along the cycle, first and last entries equal, not null
    public TreeCycleException(List<String> cycle) {
        super(
                TreeErrorKind.CYCLE,
                "Decision tree contains a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /// Returns the detected cycle, starting and ending on the same node.
    ///
    /// @return unmodifiable list of node ids, never null
    public List<String> getCycle() {
        return cycle;
    }
}
