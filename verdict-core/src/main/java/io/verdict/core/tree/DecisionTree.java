package io.verdict.core.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable decision tree definition: a directed graph of typed decision nodes.
///
/// Nodes are stored in an id-keyed map in declaration order; every edge is a
/// node id string resolved through {@link #findNode(String)} at traversal time.
/// Nodes never reference each other directly.
///
/// ### Validation
/// The builder performs no structural checks so that a parsed but unsound
/// definition can still be inspected and reported precisely. A tree becomes
/// usable for traversal only after it passes
/// {@link io.verdict.core.validation.DecisionTreeValidator}.
///
/// @implNote Immutable and thread-safe after construction. The node map is an
/// unmodifiable view over a private copy.
///
/// @see DecisionNode for the node structure
/// @see io.verdict.core.engine.DecisionTreeEngine for loading and traversal
public final class DecisionTree {

    private final String id;
    private final String version;
    private final String startNodeId;
    private final Map<String, DecisionNode> nodes;

    private DecisionTree(Builder builder) {
        this.id = builder.id == null ? "" : builder.id;
        this.version = builder.version == null ? "" : builder.version;
        this.startNodeId = builder.startNodeId == null ? "" : builder.startNodeId;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
    }

    /// @return tree identifier, never null (may be empty)
    public String getId() {
        return id;
    }

    /// @return version string, never null (may be empty)
    public String getVersion() {
        return version;
    }

    /// Returns the entry point node ID.
    ///
    /// @return start node identifier, never null (empty if not declared)
    public String getStartNodeId() {
        return startNodeId;
    }

    /// Returns all nodes by ID, in declaration order.
    ///
    /// @return unmodifiable map of node ID to node, never null
    public Map<String, DecisionNode> getNodes() {
        return nodes;
    }

    /// Looks up a node by ID.
    ///
    /// @param nodeId node identifier, may be null
    /// @return the node, or empty if no node has that ID
    public Optional<DecisionNode> findNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /// Returns the start node.
    ///
    /// @return the start node, or empty if the start ID does not resolve
    public Optional<DecisionNode> findStartNode() {
        return findNode(startNodeId);
    }

    /// Creates a new tree builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Creates a builder pre-populated with this tree, for producing edited copies.
    ///
    /// @return new builder instance, never null
    public Builder toBuilder() {
        return new Builder().id(id).version(version).startNodeId(startNodeId).nodes(nodes);
    }

    /// Builder for constructing immutable DecisionTree instances.
    ///
    /// Node insertion order is preserved.
    public static final class Builder {
        private String id;
        private String version;
        private String startNodeId;
        private final Map<String, DecisionNode> nodes = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder startNodeId(String startNodeId) {
            this.startNodeId = startNodeId;
            return this;
        }

        /// Replaces all nodes.
        ///
        /// @param nodes map of node ID to node, not null
        /// @return this builder for chaining
        public Builder nodes(Map<String, DecisionNode> nodes) {
            Objects.requireNonNull(nodes, "nodes must not be null");
            this.nodes.clear();
            nodes.forEach(this::node);
            return this;
        }

        /// Adds or replaces a node under its own ID.
        ///
        /// @param node the node, not null
        /// @return this builder for chaining
        public Builder node(DecisionNode node) {
            Objects.requireNonNull(node, "node must not be null");
            return node(node.getId(), node);
        }

        /// Adds or replaces a node under an explicit key.
        ///
        /// @param key map key, not null
        /// @param node the node, not null
        /// @return this builder for chaining
        public Builder node(String key, DecisionNode node) {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(node, "node must not be null");
            nodes.put(key, node);
            return this;
        }

        /// Removes a node. Edges pointing at it are left in place.
        ///
        /// @param nodeId ID of the node to remove, not null
        /// @return this builder for chaining
        public Builder removeNode(String nodeId) {
            nodes.remove(Objects.requireNonNull(nodeId, "nodeId must not be null"));
            return this;
        }

        /// Builds the immutable tree.
        ///
        /// @return new DecisionTree instance, never null
        public DecisionTree build() {
            return new DecisionTree(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecisionTree tree)) return false;
        return id.equals(tree.id)
                && version.equals(tree.version)
                && startNodeId.equals(tree.startNodeId)
                && nodes.equals(tree.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, startNodeId, nodes);
    }

    @Override
    public String toString() {
        return "DecisionTree{id='"
                + id
                + "', version='"
                + version
                + "', nodes="
                + nodes.size()
                + "}";
    }
}
