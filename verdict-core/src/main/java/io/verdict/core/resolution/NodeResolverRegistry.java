package io.verdict.core.resolution;

import io.verdict.core.tree.NodeType;
import java.util.Optional;

/// Registry of {@link NodeResolver}s keyed by node type.
///
/// A registered resolver replaces any previous one for the same type.
public interface NodeResolverRegistry {

    /// Get resolver for the given node type.
    ///
    /// @param nodeType the node type
    /// @return Optional containing the resolver if found
    Optional<NodeResolver> getResolver(NodeType nodeType);

    /// Register a resolver under {@link NodeResolver#getNodeType()}.
    ///
    /// @param resolver the resolver to register
    void register(NodeResolver resolver);

    /// Check if a resolver is registered for the given node type.
    ///
    /// @param nodeType the node type
    /// @return true if a resolver is registered
    boolean hasResolver(NodeType nodeType);
}
