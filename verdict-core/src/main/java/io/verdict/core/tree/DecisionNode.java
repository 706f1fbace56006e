package io.verdict.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A vertex of the decision graph.
///
/// A node asks one question (`prompt`) and declares its outgoing edges as node
/// id strings: {@link Choice}s for SingleChoice nodes, {@link Rule}s for Number
/// nodes, and an optional default edge used when nothing else matches. Edges are
/// resolved to nodes only through the owning {@link DecisionTree}.
///
/// ### Node Types
/// - `End` - terminal, no outgoing edges are ever followed
/// - `SingleChoice` - response matched against choice keys and labels
/// - `Number` - number extracted from the response, compared against rules
/// - `Text` - response ignored, default edge followed
///
/// The type is kept as written in the definition ({@link #getType()}) and
/// classified by {@link #getNodeType()}.
///
/// @implNote Immutable and thread-safe after construction. Lists are unmodifiable.
///
/// @see DecisionTree for the owning graph
public final class DecisionNode {

    private final String id;
    private final String prompt;
    private final String type;
    private final NodeType nodeType;
    private final List<Choice> choices;
    private final List<Rule> rules;
    private final String defaultNextNodeId;

    private DecisionNode(Builder builder) {
        this.id = builder.id == null ? "" : builder.id;
        this.prompt = builder.prompt == null ? "" : builder.prompt;
        this.type = builder.type == null ? "" : builder.type;
        this.nodeType = NodeType.fromDefinitionName(this.type);
        this.choices = Collections.unmodifiableList(new ArrayList<>(builder.choices));
        this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
        this.defaultNextNodeId = builder.defaultNextNodeId;
    }

    /// Returns the node identifier, equal to its key in the tree.
    ///
    /// @return node ID, never null (empty if the definition omitted it)
    public String getId() {
        return id;
    }

    /// Returns the question asked at this node, or the outcome text for End nodes.
    ///
    /// @return prompt, never null (may be empty)
    public String getPrompt() {
        return prompt;
    }

    /// Returns the type name exactly as written in the definition.
    ///
    /// @return type name, never null
    public String getType() {
        return type;
    }

    /// Returns the classified node type.
    ///
    /// @return node type, {@link NodeType#UNKNOWN} for unrecognized names, never null
    public NodeType getNodeType() {
        return nodeType;
    }

    /// @return `true` if this is an End node
    public boolean isTerminal() {
        return nodeType == NodeType.END;
    }

    /// @return unmodifiable choices in declaration order, never null (may be empty)
    public List<Choice> getChoices() {
        return choices;
    }

    /// @return unmodifiable rules in declaration order, never null (may be empty)
    public List<Rule> getRules() {
        return rules;
    }

    /// Returns the fallback edge.
    ///
    /// @return target node id, or null if absent
    public String getDefaultNextNodeId() {
        return defaultNextNodeId;
    }

    /// Returns the ids this node can transition to.
    ///
    /// Same enumeration as [#referencedNodeIds()], except that End nodes have no
    /// outgoing edges regardless of their fields.
    ///
    /// @return target node ids in enumeration order, never null
    public List<String> outgoingNodeIds() {
        if (isTerminal()) {
            return List.of();
        }
        return referencedNodeIds();
    }

    /// Returns every id this node's fields reference, whatever its type.
    ///
    /// Enumeration order is choices, then rules, then the default edge. Empty ids
    /// are skipped.
    ///
    /// @return referenced node ids in enumeration order, never null
    public List<String> referencedNodeIds() {
        List<String> targets = new ArrayList<>();
        for (Choice choice : choices) {
            if (!choice.nextNodeId().isEmpty()) {
                targets.add(choice.nextNodeId());
            }
        }
        for (Rule rule : rules) {
            if (!rule.nextNodeId().isEmpty()) {
                targets.add(rule.nextNodeId());
            }
        }
        if (defaultNextNodeId != null && !defaultNextNodeId.isEmpty()) {
            targets.add(defaultNextNodeId);
        }
        return targets;
    }

    /// Creates a new node builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Creates a builder pre-populated with this node's fields.
    ///
    /// @return new builder instance, never null
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .prompt(prompt)
                .type(type)
                .choices(choices)
                .rules(rules)
                .defaultNextNodeId(defaultNextNodeId);
    }

    /// Builder for constructing immutable DecisionNode instances.
    ///
    /// No field is required; structural checks happen during tree validation.
    public static final class Builder {
        private String id;
        private String prompt;
        private String type;
        private List<Choice> choices = List.of();
        private List<Rule> rules = List.of();
        private String defaultNextNodeId;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        /// Sets the type by definition name (e.g. `SingleChoice`).
        ///
        /// @param type type name, kept verbatim
        /// @return this builder for chaining
        public Builder type(String type) {
            this.type = type;
            return this;
        }

        /// Sets the type from a known node type.
        ///
        /// @param nodeType node type, not null
        /// @return this builder for chaining
        public Builder type(NodeType nodeType) {
            this.type = Objects.requireNonNull(nodeType, "nodeType must not be null")
                    .getDefinitionName();
            return this;
        }

        /// Sets the choices; a null list is treated as absent.
        public Builder choices(List<Choice> choices) {
            this.choices = choices == null ? List.of() : List.copyOf(choices);
            return this;
        }

        /// Sets the rules; a null list is treated as absent.
        public Builder rules(List<Rule> rules) {
            this.rules = rules == null ? List.of() : List.copyOf(rules);
            return this;
        }

        public Builder defaultNextNodeId(String defaultNextNodeId) {
            this.defaultNextNodeId = defaultNextNodeId;
            return this;
        }

        /// Builds the immutable node.
        ///
        /// @return new DecisionNode instance, never null
        public DecisionNode build() {
            return new DecisionNode(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecisionNode node)) return false;
        return id.equals(node.id)
                && prompt.equals(node.prompt)
                && type.equals(node.type)
                && choices.equals(node.choices)
                && rules.equals(node.rules)
                && Objects.equals(defaultNextNodeId, node.defaultNextNodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, prompt, type, choices, rules, defaultNextNodeId);
    }

    @Override
    public String toString() {
        return "DecisionNode{id='" + id + "', type='" + type + "'}";
    }
}
