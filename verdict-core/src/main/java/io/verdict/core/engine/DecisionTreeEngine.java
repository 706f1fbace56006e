package io.verdict.core.engine;

import io.verdict.core.exception.TreeLoadException;
import io.verdict.core.exception.TreeValidationException;
import io.verdict.core.resolution.NextNodeResolver;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.DecisionTreeParser;
import io.verdict.core.validation.DecisionTreeValidator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Loads, validates and traverses one active decision tree.
///
/// ### Loading
/// A candidate tree is parsed, then validated and published while holding the
/// load lock, so loads never interleave. Publication is a single write of a
/// `volatile` reference: readers see either the previous tree or the new one,
/// never a partially built one. A candidate that fails parsing or validation is
/// discarded and the previously active tree stays in effect.
///
/// {@link #ensureLoaded()} performs the lazy first load from the configured
/// definition file with a double-checked guard: a published tree is returned
/// without locking, otherwise the lock is taken and the check repeated before
/// loading.
///
/// ### Traversal
/// Lookups and {@link #resolveNext(DecisionNode, String)} never lock and never
/// mutate the tree; any number of callers may traverse concurrently.
///
/// @implNote Thread-safe.
/// @see DecisionTreeValidator for the checks applied to every load
/// @see NextNodeResolver for the transition function
public class DecisionTreeEngine {

    private static final Logger logger = Logger.getLogger(DecisionTreeEngine.class.getName());

    private final DecisionTreeParser parser;
    private final DecisionTreeValidator validator;
    private final NextNodeResolver resolver;
    private final Path definitionPath;

    private final Object loadLock = new Object();
    private volatile DecisionTree activeTree;

    /// Creates an engine with no active tree.
    ///
    /// @param parser definition text parser, not null
    /// @param validator structural validator, not null
    /// @param resolver transition function, not null
    /// @param definitionPath file loaded by {@link #ensureLoaded()}, not null
    public DecisionTreeEngine(
            DecisionTreeParser parser,
            DecisionTreeValidator validator,
            NextNodeResolver resolver,
            Path definitionPath) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.definitionPath =
                Objects.requireNonNull(definitionPath, "definitionPath must not be null");
    }

    /// Parses, validates and activates a tree definition.
    ///
    /// @param definition definition text, not null
    /// @return the newly active tree, never null
    /// @throws io.verdict.core.exception.TreeParseException if the text is malformed
    /// @throws TreeValidationException if the tree is structurally unsound
    public DecisionTree load(String definition) throws TreeLoadException {
        Objects.requireNonNull(definition, "definition must not be null");
        return load(parser.parse(definition));
    }

    /// Validates and activates an already built tree.
    ///
    /// @param tree candidate tree, not null
    /// @return the newly active tree, never null
    /// @throws TreeValidationException if the tree is structurally unsound
    public DecisionTree load(DecisionTree tree) throws TreeValidationException {
        Objects.requireNonNull(tree, "tree must not be null");
        synchronized (loadLock) {
            try {
                validator.validate(tree);
            } catch (TreeValidationException e) {
                logger.warning(
                        "Rejected decision tree '" + tree.getId() + "': " + e.getMessage());
                throw e;
            }
            activeTree = tree;
        }
        logger.info(
                "Decision tree '"
                        + tree.getId()
                        + "' version '"
                        + tree.getVersion()
                        + "' loaded and validated ("
                        + tree.getNodes().size()
                        + " nodes)");
        return tree;
    }

    /// Reads a UTF-8 definition file, then validates and activates it.
    ///
    /// @param path definition file, not null
    /// @return the newly active tree, never null
    /// @throws IOException if the file cannot be read
    /// @throws TreeLoadException if the definition is malformed or unsound
    public DecisionTree loadFromFile(Path path) throws IOException, TreeLoadException {
        Objects.requireNonNull(path, "path must not be null");
        logger.info("Loading decision tree from: " + path);
        return load(Files.readString(path, StandardCharsets.UTF_8));
    }

    /// Loads the configured definition file unless a tree is already active.
    ///
    /// Concurrent first callers load the file once; the others wait and receive
    /// the tree it produced.
    ///
    /// @return the active tree, never null
    /// @throws IOException if the definition file cannot be read
    /// @throws TreeLoadException if the definition is malformed or unsound
    public DecisionTree ensureLoaded() throws IOException, TreeLoadException {
        DecisionTree tree = activeTree;
        if (tree != null) {
            return tree;
        }
        synchronized (loadLock) {
            tree = activeTree;
            if (tree != null) {
                return tree;
            }
            return loadFromFile(definitionPath);
        }
    }

    /// @return `true` once a tree has been loaded
    public boolean isLoaded() {
        return activeTree != null;
    }

    /// Returns the active tree, if any.
    ///
    /// @return the active tree, or empty before the first successful load
    public Optional<DecisionTree> currentTree() {
        return Optional.ofNullable(activeTree);
    }

    /// Returns the active tree.
    ///
    /// @return the active tree, never null
    /// @throws IllegalStateException if no tree has been loaded
    public DecisionTree getTree() {
        DecisionTree tree = activeTree;
        if (tree == null) {
            throw new IllegalStateException("No decision tree loaded");
        }
        return tree;
    }

    /// Returns the start node of the active tree.
    ///
    /// @return start node, never null
    /// @throws IllegalStateException if no tree has been loaded
    public DecisionNode getStartNode() {
        DecisionTree tree = getTree();
        return tree.findStartNode()
                .orElseThrow(
                        () ->
                                new IllegalStateException(
                                        "Start node '" + tree.getStartNodeId() + "' missing"));
    }

    /// Looks up a node of the active tree.
    ///
    /// @param nodeId node identifier, may be null
    /// @return the node, or empty if not found
    /// @throws IllegalStateException if no tree has been loaded
    public Optional<DecisionNode> getNode(String nodeId) {
        return getTree().findNode(nodeId);
    }

    /// Chooses the next node id for a node and an external response.
    ///
    /// Pure function of its arguments; does not consult the active tree.
    ///
    /// @param node the current node, not null
    /// @param response external answer, may be null
    /// @return next node id, or empty if the walk cannot proceed
    public Optional<String> resolveNext(DecisionNode node, String response) {
        return resolver.resolve(node, response);
    }

    /// Chooses and looks up the next node in the active tree.
    ///
    /// @param node the current node, not null
    /// @param response external answer, may be null
    /// @return the next node, or empty if there is none
    /// @throws IllegalStateException if no tree has been loaded
    public Optional<DecisionNode> nextNode(DecisionNode node, String response) {
        DecisionTree tree = getTree();
        return resolveNext(node, response).flatMap(tree::findNode);
    }

    /// @return the parser used for definition text, never null
    public DecisionTreeParser getParser() {
        return parser;
    }

    /// @return the validator applied to every load, never null
    public DecisionTreeValidator getValidator() {
        return validator;
    }
}
