package io.verdict.core;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/// Configuration options for a Verdict decision tree engine.
///
/// Use the {@link Builder} for fluent configuration, {@link #fromProperties(Map)}
/// to read flat key/value settings, or the setters for mutable configuration.
///
/// ### Default Values
/// - `equalityTolerance`: `1.0E-4` (absolute tolerance of `Equal` rules)
/// - `definitionPath`: `rules.json` (loaded lazily by `ensureLoaded()`)
///
/// ### Property Keys
/// - `verdict.equality-tolerance`
/// - `verdict.definition-path`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link VerdictFactory}
/// and do not modify afterwards.
///
/// @see VerdictFactory#createEngine(VerdictConfig, io.verdict.core.tree.DecisionTreeParser)
public class VerdictConfig {

    public static final String EQUALITY_TOLERANCE_KEY = "verdict.equality-tolerance";
    public static final String DEFINITION_PATH_KEY = "verdict.definition-path";

    public static final double DEFAULT_EQUALITY_TOLERANCE = 1.0E-4;
    public static final String DEFAULT_DEFINITION_FILE = "rules.json";

    private double equalityTolerance = DEFAULT_EQUALITY_TOLERANCE;
    private Path definitionPath = Path.of(DEFAULT_DEFINITION_FILE);

    /// Creates a configuration with default values.
    public VerdictConfig() {}

    /// Returns the tolerance under which a response equals an `Equal` rule's value.
    ///
    /// @return absolute tolerance, non-negative
    public double getEqualityTolerance() {
        return equalityTolerance;
    }

    /// ### Contracts
    /// - **Precondition**: `equalityTolerance` must be non-negative
    ///
    /// @param equalityTolerance absolute tolerance for `Equal` rules
    /// @throws IllegalArgumentException if the tolerance is negative or NaN
    public void setEqualityTolerance(double equalityTolerance) {
        if (equalityTolerance < 0 || Double.isNaN(equalityTolerance)) {
            throw new IllegalArgumentException(
                    "equalityTolerance must be non-negative: " + equalityTolerance);
        }
        this.equalityTolerance = equalityTolerance;
    }

    /// Returns the definition file loaded by `DecisionTreeEngine.ensureLoaded()`.
    ///
    /// @return definition path, never null
    public Path getDefinitionPath() {
        return definitionPath;
    }

    /// @param definitionPath definition file location, not null
    public void setDefinitionPath(Path definitionPath) {
        this.definitionPath =
                Objects.requireNonNull(definitionPath, "definitionPath must not be null");
    }

    /// Reads configuration from flat properties, keeping defaults for missing keys.
    ///
    /// @param properties settings keyed by the `verdict.*` property keys, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if the tolerance is not a non-negative number
    public static VerdictConfig fromProperties(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        VerdictConfig config = new VerdictConfig();

        String tolerance = properties.get(EQUALITY_TOLERANCE_KEY);
        if (tolerance != null && !tolerance.isBlank()) {
            try {
                config.setEqualityTolerance(Double.parseDouble(tolerance.trim()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Invalid " + EQUALITY_TOLERANCE_KEY + ": '" + tolerance + "'", e);
            }
        }

        String definitionPath = properties.get(DEFINITION_PATH_KEY);
        if (definitionPath != null && !definitionPath.isBlank()) {
            config.setDefinitionPath(Path.of(definitionPath.trim()));
        }

        return config;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link VerdictConfig} instances.
    public static class Builder {
        private final VerdictConfig config = new VerdictConfig();

        public Builder equalityTolerance(double equalityTolerance) {
            config.setEqualityTolerance(equalityTolerance);
            return this;
        }

        public Builder definitionPath(Path definitionPath) {
            config.setDefinitionPath(definitionPath);
            return this;
        }

        /// @return the configured instance, never null
        public VerdictConfig build() {
            return config;
        }
    }
}
