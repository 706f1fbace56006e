package io.verdict.core.walk;

import io.verdict.core.tree.DecisionNode;

/// Listener for walk progress events.
///
/// All methods have default no-op implementations, allowing listeners to
/// override only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onNodeEntered(node)     - walk arrived at node (including the final one)
/// onStepRecorded(step)    - oracle answered, next node chosen
/// onWalkFinished(result)  - End node reached or walk stalled
/// ```
public interface WalkListener {

    default void onNodeEntered(DecisionNode node) {}

    default void onStepRecorded(WalkStep step) {}

    default void onWalkFinished(WalkResult result) {}

    /// No-op listener instance that ignores all events.
    WalkListener NOOP = new WalkListener() {};
}
