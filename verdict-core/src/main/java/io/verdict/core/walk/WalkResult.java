package io.verdict.core.walk;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Outcome of a walk: the answered questions and where the walk stopped.
///
/// ### Contracts
/// - `COMPLETED`: `finalNodeId` is an End node and `outcome` is its prompt
/// - `STALLED`: `finalNodeId` is the node that produced no next node and
///   `outcome` is null
///
/// @param treeId id of the tree walked, not null
/// @param status how the walk ended, not null
/// @param steps answered questions in order, unmodifiable, not null
/// @param finalNodeId node the walk stopped on, not null
/// @param outcome End node prompt, null if stalled
public record WalkResult(
        String treeId,
        WalkStatus status,
        List<WalkStep> steps,
        String finalNodeId,
        String outcome) {

    public WalkResult {
        Objects.requireNonNull(treeId, "treeId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(finalNodeId, "finalNodeId must not be null");
        steps = List.copyOf(steps);
    }

    /// @return `true` if an End node was reached
    public boolean isCompleted() {
        return status == WalkStatus.COMPLETED;
    }

    /// Returns the ids of all nodes visited, in order, ending with the final node.
    ///
    /// @return visited node ids, never null
    public List<String> path() {
        List<String> path = new ArrayList<>();
        for (WalkStep step : steps) {
            path.add(step.nodeId());
        }
        if (path.isEmpty() || !path.get(path.size() - 1).equals(finalNodeId)) {
            path.add(finalNodeId);
        }
        return List.copyOf(path);
    }
}
