package io.verdict.core.resolution;

import io.verdict.core.tree.DecisionNode;
import java.util.Objects;
import java.util.Optional;

/// Transition function of the decision graph: picks the next node id for a node
/// and an external response.
///
/// Dispatches on {@link DecisionNode#getNodeType()} to the registered
/// {@link NodeResolver}. Node types without a resolver follow their default edge.
/// A `null` response is treated as empty text.
///
/// Resolution never throws for an unmatched response and never mutates the node.
/// An empty result means the walk cannot proceed; for End nodes that is the
/// normal end of a walk, for any other node it is for the caller to report.
///
/// @implNote Thread-safe once the registry is no longer modified.
public class NextNodeResolver {

    private final NodeResolverRegistry registry;

    public NextNodeResolver(NodeResolverRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Chooses the next node.
    ///
    /// @param node the current node, not null
    /// @param response external answer, may be null
    /// @return next node id, or empty if there is none
    public Optional<String> resolve(DecisionNode node, String response) {
        Objects.requireNonNull(node, "node must not be null");
        String text = response == null ? "" : response;

        return registry.getResolver(node.getNodeType())
                .map(resolver -> resolver.resolve(node, text))
                .orElseGet(() -> NodeResolver.defaultEdge(node));
    }
}
