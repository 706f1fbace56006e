package io.verdict.core.walk;

public enum WalkStatus {
    /// An End node was reached.
    COMPLETED,
    /// A non-End node produced no next node.
    STALLED
}
