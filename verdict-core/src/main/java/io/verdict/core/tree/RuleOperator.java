package io.verdict.core.tree;

import java.util.Locale;
import java.util.Optional;

/// Comparison operators available to {@link Rule}s on Number nodes.
///
/// The left operand is always the number extracted from the response, the right
/// operand the rule's threshold value.
public enum RuleOperator {
    LESS_THAN("LessThan"),
    LESS_THAN_OR_EQUAL("LessThanOrEqual"),
    GREATER_THAN("GreaterThan"),
    GREATER_OR_EQUAL("GreaterOrEqual"),
    EQUAL("Equal");

    private final String definitionName;

    RuleOperator(String definitionName) {
        this.definitionName = definitionName;
    }

    public String getDefinitionName() {
        return definitionName;
    }

    /// Tests the operator against a response value.
    ///
    /// @param response number extracted from the response
    /// @param threshold the rule's value
    /// @param tolerance maximum absolute difference still considered equal, used by
    ///        {@link #EQUAL} only
    /// @return `true` if the comparison holds
    public boolean test(double response, double threshold, double tolerance) {
        return switch (this) {
            case LESS_THAN -> response < threshold;
            case LESS_THAN_OR_EQUAL -> response <= threshold;
            case GREATER_THAN -> response > threshold;
            case GREATER_OR_EQUAL -> response >= threshold;
            case EQUAL -> Math.abs(response - threshold) < tolerance;
        };
    }

    /// Resolves a definition name (case-insensitive) to an operator.
    ///
    /// @param name operator name, may be null
    /// @return the operator, or empty if the name is not recognized
    public static Optional<RuleOperator> fromDefinitionName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (RuleOperator operator : values()) {
            if (operator.definitionName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
