package io.verdict.core.tree;

/// A labeled outgoing edge of a SingleChoice node.
///
/// A response selects the choice when it equals, or contains, either the key or
/// the label (case-insensitive). Null components are normalized to empty strings.
///
/// @param key short answer token, never null (may be empty)
/// @param label human readable answer, never null (may be empty)
/// @param nextNodeId target node id, never null (empty means "no next node")
public record Choice(String key, String label, String nextNodeId) {

    public Choice {
        key = key == null ? "" : key;
        label = label == null ? "" : label;
        nextNodeId = nextNodeId == null ? "" : nextNodeId;
    }

    /// Creates a choice whose label equals its key.
    public static Choice of(String key, String nextNodeId) {
        return new Choice(key, key, nextNodeId);
    }
}
