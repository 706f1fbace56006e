package io.verdict.core.resolution;

import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.NodeType;
import java.util.Optional;

/// End nodes are terminal: never a next node, whatever the response.
public class EndNodeResolver implements NodeResolver {

    @Override
    public NodeType getNodeType() {
        return NodeType.END;
    }

    @Override
    public Optional<String> resolve(DecisionNode node, String response) {
        return Optional.empty();
    }
}
