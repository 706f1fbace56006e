package io.verdict.core.tree;

import io.verdict.core.util.NumberExtractor;
import java.util.Optional;
import java.util.OptionalDouble;

/// A threshold comparison edge of a Number node.
///
/// The operator and value are kept exactly as written in the definition so that
/// re-encoding is lossless. A rule whose operator is not recognized, or whose
/// value is not a number, never matches.
///
/// @param operator operator name (e.g. `LessThan`), never null
/// @param value numeric literal, never null
/// @param nextNodeId target node id, never null (empty means "no next node")
/// @see RuleOperator
public record Rule(String operator, String value, String nextNodeId) {

    public Rule {
        operator = operator == null ? "" : operator;
        value = value == null ? "" : value;
        nextNodeId = nextNodeId == null ? "" : nextNodeId;
    }

    public static Rule of(RuleOperator operator, String value, String nextNodeId) {
        return new Rule(operator.getDefinitionName(), value, nextNodeId);
    }

    /// Returns the resolved operator.
    ///
    /// @return operator, or empty if the name is not recognized
    public Optional<RuleOperator> resolveOperator() {
        return RuleOperator.fromDefinitionName(operator);
    }

    /// Returns the threshold value.
    ///
    /// @return the parsed value, or empty if `value` is not a numeric literal
    public OptionalDouble threshold() {
        return NumberExtractor.parse(value);
    }
}
