package io.verdict.serialization;

import io.verdict.core.exception.TreeLoadException;
import io.verdict.core.repository.DecisionTreeRepository;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.DecisionTreeParser;
import io.verdict.core.tree.NodeType;
import io.verdict.core.validation.DecisionTreeValidator;
import io.verdict.core.validation.ValidationResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Editing operations over decision tree definitions.
///
/// Every path that produces a tree for the caller, or writes one, runs the same
/// validation as the engine. An unsound tree is reported, never persisted.
///
/// The service remembers the tree most recently loaded, saved or created so an
/// editor can round-trip its working copy.
///
/// @implNote Thread-safe if the repository is. The working copy is a single
/// `volatile` reference.
/// @see DecisionTreeValidator for the checks applied
public class DecisionTreeService {

    private static final Logger logger = Logger.getLogger(DecisionTreeService.class.getName());

    static final String STARTER_TREE_ID = "new-tree";
    static final String STARTER_VERSION = "1.0.0";
    static final String STARTER_NODE_ID = "start";
    static final String STARTER_PROMPT =
            "This is the start node. Change the type to begin building your decision tree.";

    private final DecisionTreeParser parser;
    private final DecisionTreeValidator validator;
    private final DecisionTreeRepository repository;

    private volatile DecisionTree currentTree;

    public DecisionTreeService(
            DecisionTreeParser parser,
            DecisionTreeValidator validator,
            DecisionTreeRepository repository) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    /// Creates a service using the Jackson definition format.
    ///
    /// @param repository tree storage, not null
    public DecisionTreeService(DecisionTreeRepository repository) {
        this(new JacksonDecisionTreeParser(), new DecisionTreeValidator(), repository);
    }

    /// Parses and validates definition text without keeping the result.
    ///
    /// @param json definition text, not null
    /// @return the outcome, never null
    public ValidationResult validateJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            validator.validate(parser.parse(json));
            return ValidationResult.success();
        } catch (TreeLoadException e) {
            return ValidationResult.invalid(e);
        }
    }

    /// Validates an in-memory tree.
    ///
    /// @param tree the tree, not null
    /// @return the outcome, never null
    public ValidationResult validate(DecisionTree tree) {
        return validator.check(tree);
    }

    /// Parses and validates definition text, making it the working copy.
    ///
    /// @param json definition text, not null
    /// @return the validated tree, never null
    /// @throws TreeLoadException if the text is malformed or the tree unsound
    public DecisionTree loadFromJson(String json) throws TreeLoadException {
        Objects.requireNonNull(json, "json must not be null");
        DecisionTree tree = parser.parse(json);
        validator.validate(tree);
        currentTree = tree;
        return tree;
    }

    /// Reads a UTF-8 definition file, then parses and validates it.
    ///
    /// @param path definition file, not null
    /// @return the validated tree, never null
    /// @throws IOException if the file cannot be read
    /// @throws TreeLoadException if the definition is malformed or unsound
    public DecisionTree loadFromFile(Path path) throws IOException, TreeLoadException {
        Objects.requireNonNull(path, "path must not be null");
        return loadFromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    /// Loads a stored tree, validating it again.
    ///
    /// @param treeId tree identifier, not null
    /// @return the validated tree, or empty if none is stored under that ID
    /// @throws IOException if the repository cannot be read
    /// @throws TreeLoadException if the stored tree is unsound
    public Optional<DecisionTree> load(String treeId) throws IOException, TreeLoadException {
        Optional<DecisionTree> stored = repository.findById(treeId);
        if (stored.isPresent()) {
            validator.validate(stored.get());
            currentTree = stored.get();
        }
        return stored;
    }

    /// Encodes a tree as definition text.
    ///
    /// @param tree the tree, not null
    /// @return definition text, never null
    public String toJson(DecisionTree tree) {
        return parser.format(tree);
    }

    /// Validates a tree and stores it if sound.
    ///
    /// @param tree the tree, not null, with a non-blank ID
    /// @return the validation outcome; the tree was stored only if valid
    /// @throws IOException if the repository cannot be written
    public ValidationResult save(DecisionTree tree) throws IOException {
        Objects.requireNonNull(tree, "tree must not be null");
        ValidationResult result = validator.check(tree);
        if (!result.valid()) {
            logger.warning(
                    "Refusing to save invalid decision tree '"
                            + tree.getId()
                            + "': "
                            + result.message());
            return result;
        }
        repository.save(tree);
        currentTree = tree;
        return result;
    }

    /// Validates a tree and writes it to a file if sound.
    ///
    /// The file is replaced atomically; an invalid tree leaves it untouched.
    ///
    /// @param tree the tree, not null
    /// @param path target file, not null
    /// @return the validation outcome; the file was written only if valid
    /// @throws IOException if the file cannot be written
    public ValidationResult saveToFile(DecisionTree tree, Path path) throws IOException {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(path, "path must not be null");
        ValidationResult result = validator.check(tree);
        if (!result.valid()) {
            logger.warning(
                    "Refusing to write invalid decision tree '"
                            + tree.getId()
                            + "' to "
                            + path
                            + ": "
                            + result.message());
            return result;
        }

        Path absolute = path.toAbsolutePath();
        Path temp = Files.createTempFile(absolute.getParent(), "verdict", ".tmp");
        try {
            Files.writeString(temp, parser.format(tree), StandardCharsets.UTF_8);
            Files.move(
                    temp,
                    absolute,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        currentTree = tree;
        logger.info("Wrote decision tree '" + tree.getId() + "' to " + absolute);
        return result;
    }

    /// @return all stored trees, never null
    /// @throws IOException if the repository cannot be read
    public List<DecisionTree> listTrees() throws IOException {
        return repository.findAll();
    }

    /// @param treeId tree identifier, not null
    /// @return `true` if a tree was removed
    /// @throws IOException if the repository cannot be written
    public boolean delete(String treeId) throws IOException {
        return repository.delete(treeId);
    }

    /// Creates the starter tree under the default ID `new-tree`.
    ///
    /// @return starter tree, never null
    public DecisionTree newTree() {
        return newTree(STARTER_TREE_ID);
    }

    /// Creates a starter tree: version `1.0.0` with a single End start node.
    ///
    /// The result is valid and becomes the working copy. It is not stored.
    ///
    /// @param treeId ID of the new tree, not null
    /// @return starter tree, never null
    public DecisionTree newTree(String treeId) {
        Objects.requireNonNull(treeId, "treeId must not be null");
        DecisionTree tree =
                DecisionTree.builder()
                        .id(treeId)
                        .version(STARTER_VERSION)
                        .startNodeId(STARTER_NODE_ID)
                        .node(
                                DecisionNode.builder()
                                        .id(STARTER_NODE_ID)
                                        .type(NodeType.END)
                                        .prompt(STARTER_PROMPT)
                                        .build())
                        .build();
        currentTree = tree;
        return tree;
    }

    /// Returns the working copy.
    ///
    /// @return the tree most recently loaded, saved or created, or empty
    public Optional<DecisionTree> getCurrentTree() {
        return Optional.ofNullable(currentTree);
    }
}
