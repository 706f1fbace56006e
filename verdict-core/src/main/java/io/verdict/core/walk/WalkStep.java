package io.verdict.core.walk;

/// One answered question of a walk.
///
/// @param questionNumber 1-based position in the walk
/// @param nodeId the node that asked, not null
/// @param prompt the question asked, not null
/// @param response the oracle's answer, not null
/// @param nextNodeId the chosen next node, null if the walk could not proceed
public record WalkStep(
        int questionNumber, String nodeId, String prompt, String response, String nextNodeId) {}
