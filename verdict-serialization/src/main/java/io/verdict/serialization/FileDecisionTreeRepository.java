package io.verdict.serialization;

import io.verdict.core.exception.TreeParseException;
import io.verdict.core.repository.DecisionTreeRepository;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.DecisionTreeParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Directory-backed decision tree repository.
///
/// Each tree is stored as `<id>.json` in the repository directory, encoded with the
/// configured {@link DecisionTreeParser}. Writes go to a temporary file in the
/// same directory which is then moved over the target, so readers never see a
/// half-written definition.
///
/// Tree IDs become file names and must not contain path separators or start
/// with a dot.
///
/// @implNote Thread-safe for distinct IDs. Concurrent saves of the same ID are
/// last-writer-wins.
/// @see DecisionTreeRepository for contract
public class FileDecisionTreeRepository implements DecisionTreeRepository {

    private static final Logger logger =
            Logger.getLogger(FileDecisionTreeRepository.class.getName());

    static final String FILE_EXTENSION = ".json";

    private final Path directory;
    private final DecisionTreeParser parser;

    /// Creates a repository over a directory, creating it if missing.
    ///
    /// @param directory storage directory, not null
    /// @param parser definition codec, not null
    /// @throws IOException if the directory cannot be created
    public FileDecisionTreeRepository(Path directory, DecisionTreeParser parser)
            throws IOException {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        Files.createDirectories(directory);
    }

    /// Creates a repository using the Jackson definition format.
    ///
    /// @param directory storage directory, not null
    /// @throws IOException if the directory cannot be created
    public FileDecisionTreeRepository(Path directory) throws IOException {
        this(directory, new JacksonDecisionTreeParser());
    }

    @Override
    public void save(DecisionTree tree) throws IOException {
        Objects.requireNonNull(tree, "tree must not be null");
        Path target = fileFor(tree.getId());

        Path temp = Files.createTempFile(directory, tree.getId(), ".tmp");
        try {
            Files.writeString(temp, parser.format(tree), StandardCharsets.UTF_8);
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Saved decision tree '" + tree.getId() + "' to " + target);
    }

    @Override
    public Optional<DecisionTree> findById(String treeId) throws IOException {
        Path file = fileFor(treeId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    /// Lists all stored trees, ordered by file name.
    ///
    /// @throws IOException if a file cannot be read or does not hold a definition
    @Override
    public List<DecisionTree> findAll() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream =
                Files.newDirectoryStream(directory, "*" + FILE_EXTENSION)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(null);

        List<DecisionTree> trees = new ArrayList<>(files.size());
        for (Path file : files) {
            trees.add(read(file));
        }
        return trees;
    }

    @Override
    public boolean exists(String treeId) {
        return Files.isRegularFile(fileFor(treeId));
    }

    @Override
    public boolean delete(String treeId) throws IOException {
        boolean deleted = Files.deleteIfExists(fileFor(treeId));
        if (deleted) {
            logger.info("Deleted decision tree '" + treeId + "'");
        }
        return deleted;
    }

    @Override
    public int count() {
        int count = 0;
        try (DirectoryStream<Path> stream =
                Files.newDirectoryStream(directory, "*" + FILE_EXTENSION)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    count++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot list " + directory, e);
        }
        return count;
    }

    /// @return the storage directory, never null
    public Path getDirectory() {
        return directory;
    }

    private DecisionTree read(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return parser.parse(text);
        } catch (TreeParseException e) {
            throw new IOException("Corrupt decision tree file " + file + ": " + e.getMessage(), e);
        }
    }

    private Path fileFor(String treeId) {
        Objects.requireNonNull(treeId, "treeId must not be null");
        if (treeId.isBlank()) {
            throw new IllegalArgumentException("tree id must not be blank");
        }
        if (treeId.startsWith(".")
                || treeId.indexOf('/') >= 0
                || treeId.indexOf('\\') >= 0
                || treeId.indexOf('\0') >= 0) {
            throw new IllegalArgumentException(
                    "tree id is not a valid file name: '" + treeId + "'");
        }
        return directory.resolve(treeId + FILE_EXTENSION);
    }
}
