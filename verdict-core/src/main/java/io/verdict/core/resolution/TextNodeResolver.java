package io.verdict.core.resolution;

import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.NodeType;
import java.util.Optional;

/// Text nodes record a free-form answer and always follow their default edge.
public class TextNodeResolver implements NodeResolver {

    @Override
    public NodeType getNodeType() {
        return NodeType.TEXT;
    }

    @Override
    public Optional<String> resolve(DecisionNode node, String response) {
        return NodeResolver.defaultEdge(node);
    }
}
