package io.verdict.core.resolution;

import io.verdict.core.tree.NodeType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Default implementation of NodeResolverRegistry.
///
/// Registers the built-in resolvers for End, Text, SingleChoice and Number nodes.
/// Nothing is registered for {@link NodeType#UNKNOWN}; {@link NextNodeResolver}
/// sends such nodes down their default edge.
///
/// @implNote Register custom resolvers before sharing the registry across threads.
public class DefaultNodeResolverRegistry implements NodeResolverRegistry {

    private final Map<NodeType, NodeResolver> registry = new EnumMap<>(NodeType.class);

    /// Creates a registry with all built-in resolvers pre-registered.
    ///
    /// @param equalityTolerance tolerance for `Equal` rules on Number nodes
    public DefaultNodeResolverRegistry(double equalityTolerance) {
        register(new EndNodeResolver());
        register(new TextNodeResolver());
        register(new SingleChoiceNodeResolver());
        register(new NumberNodeResolver(equalityTolerance));
    }

    @Override
    public Optional<NodeResolver> getResolver(NodeType nodeType) {
        return Optional.ofNullable(registry.get(nodeType));
    }

    @Override
    public void register(NodeResolver resolver) {
        Objects.requireNonNull(resolver, "resolver must not be null");
        registry.put(resolver.getNodeType(), resolver);
    }

    @Override
    public boolean hasResolver(NodeType nodeType) {
        return registry.containsKey(nodeType);
    }
}
