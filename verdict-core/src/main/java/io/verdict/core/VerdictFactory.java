package io.verdict.core;

import io.verdict.core.engine.DecisionTreeEngine;
import io.verdict.core.resolution.DefaultNodeResolverRegistry;
import io.verdict.core.resolution.NextNodeResolver;
import io.verdict.core.resolution.NodeResolverRegistry;
import io.verdict.core.tree.DecisionTreeParser;
import io.verdict.core.validation.DecisionTreeValidator;
import io.verdict.core.walk.DecisionTreeWalker;
import java.util.Objects;

/// Factory wiring decision tree engines and walkers.
///
/// ### Usage
/// {@snippet :
/// var engine = VerdictFactory.createEngine(
///     VerdictConfig.builder().definitionPath(Path.of("rules.json")).build(),
///     new JacksonDecisionTreeParser());
/// engine.ensureLoaded();
/// WalkResult result = VerdictFactory.createWalker(engine).walk(oracle);
/// }
///
/// @see VerdictConfig
public final class VerdictFactory {

    private VerdictFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an engine with default configuration.
    ///
    /// @param parser definition text parser, not null
    /// @return new engine with no tree loaded, never null
    public static DecisionTreeEngine createEngine(DecisionTreeParser parser) {
        return createEngine(new VerdictConfig(), parser);
    }

    /// Creates an engine with the built-in node resolvers.
    ///
    /// @param config engine settings, not null
    /// @param parser definition text parser, not null
    /// @return new engine with no tree loaded, never null
    public static DecisionTreeEngine createEngine(VerdictConfig config, DecisionTreeParser parser) {
        Objects.requireNonNull(config, "config must not be null");
        return createEngine(
                config, parser, new DefaultNodeResolverRegistry(config.getEqualityTolerance()));
    }

    /// Creates an engine with a pre-configured resolver registry.
    ///
    /// Useful for custom node types or for testing with doubles.
    ///
    /// @param config engine settings, not null
    /// @param parser definition text parser, not null
    /// @param registry resolvers by node type, not null
    /// @return new engine with no tree loaded, never null
    public static DecisionTreeEngine createEngine(
            VerdictConfig config, DecisionTreeParser parser, NodeResolverRegistry registry) {
        Objects.requireNonNull(config, "config must not be null");
        return new DecisionTreeEngine(
                parser,
                new DecisionTreeValidator(),
                new NextNodeResolver(registry),
                config.getDefinitionPath());
    }

    /// Creates a walker driving traversals against the engine's active tree.
    ///
    /// @param engine the engine, not null
    /// @return new walker, never null
    public static DecisionTreeWalker createWalker(DecisionTreeEngine engine) {
        return new DecisionTreeWalker(engine);
    }
}
