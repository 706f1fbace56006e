package io.verdict.core.resolution;

import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.NodeType;
import io.verdict.core.tree.Rule;
import io.verdict.core.tree.RuleOperator;
import io.verdict.core.util.NumberExtractor;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/// Routes a Number node on the first number found in the response.
///
/// Rules are evaluated in declaration order and the first passing rule wins.
/// Rules with an unrecognized operator or a non-numeric value are skipped. If
/// the response holds no number, or no rule passes, the default edge is followed.
///
/// @implNote Stateless and thread-safe.
/// @see NumberExtractor#extract(String) for how the number is found
public class NumberNodeResolver implements NodeResolver {

    private static final Logger logger = Logger.getLogger(NumberNodeResolver.class.getName());

    private final double equalityTolerance;

    /// @param equalityTolerance largest absolute difference still matching `Equal`,
    ///        must be non-negative
    public NumberNodeResolver(double equalityTolerance) {
        if (equalityTolerance < 0 || Double.isNaN(equalityTolerance)) {
            throw new IllegalArgumentException(
                    "equalityTolerance must be non-negative: " + equalityTolerance);
        }
        this.equalityTolerance = equalityTolerance;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.NUMBER;
    }

    @Override
    public Optional<String> resolve(DecisionNode node, String response) {
        OptionalDouble extracted = NumberExtractor.extract(response);
        if (extracted.isEmpty()) {
            logger.fine(() -> "No number in response for node " + node.getId());
            return NodeResolver.defaultEdge(node);
        }

        double number = extracted.getAsDouble();
        for (Rule rule : node.getRules()) {
            Optional<RuleOperator> operator = rule.resolveOperator();
            OptionalDouble threshold = rule.threshold();
            if (operator.isEmpty() || threshold.isEmpty()) {
                continue;
            }
            if (operator.get().test(number, threshold.getAsDouble(), equalityTolerance)) {
                return NodeResolver.edge(rule.nextNodeId());
            }
        }

        return NodeResolver.defaultEdge(node);
    }

    public double getEqualityTolerance() {
        return equalityTolerance;
    }
}
