package io.verdict.core.resolution;

import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.NodeType;
import java.util.Optional;

/// Strategy interface choosing the next node for one node type.
///
/// Implementations must be pure functions of the node and the response: no
/// hidden state, no mutation of the node, no exceptions for unmatched responses.
/// An unmatched response falls through to the node's default edge.
///
/// ### Example implementation
/// {@snippet :
/// public class TextNodeResolver implements NodeResolver {
///     public NodeType getNodeType() {
///         return NodeType.TEXT;
///     }
///     public Optional<String> resolve(DecisionNode node, String response) {
///         return NodeResolver.defaultEdge(node);
///     }
/// }
/// }
///
/// @see NodeResolverRegistry for lookup by type
public interface NodeResolver {

    /// Returns the node type this resolver handles.
    ///
    /// @return node type, never null
    NodeType getNodeType();

    /// Chooses the next node.
    ///
    /// @param node the current node, not null
    /// @param response the external answer, not null (may be empty)
    /// @return next node id, or empty if the walk cannot proceed from this node
    Optional<String> resolve(DecisionNode node, String response);

    /// Returns the node's default edge.
    ///
    /// @param node the node, not null
    /// @return the default next node id, or empty if absent or blank
    static Optional<String> defaultEdge(DecisionNode node) {
        return edge(node.getDefaultNextNodeId());
    }

    /// Converts an edge target to a resolution result.
    ///
    /// @param nextNodeId target id, may be null
    /// @return the id, or empty if null or empty
    static Optional<String> edge(String nextNodeId) {
        return nextNodeId == null || nextNodeId.isEmpty()
                ? Optional.empty()
                : Optional.of(nextNodeId);
    }
}
