package io.verdict.core.repository;

import io.verdict.core.tree.DecisionTree;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory decision tree repository (default implementation).
///
/// Thread-safe, no external dependencies.
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
/// @see DecisionTreeRepository for contract
public final class InMemoryDecisionTreeRepository implements DecisionTreeRepository {

    private final Map<String, DecisionTree> storage = new ConcurrentHashMap<>();

    @Override
    public void save(DecisionTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (tree.getId().isBlank()) {
            throw new IllegalArgumentException("tree id must not be blank");
        }
        storage.put(tree.getId(), tree);
    }

    @Override
    public Optional<DecisionTree> findById(String treeId) {
        Objects.requireNonNull(treeId, "treeId must not be null");
        return Optional.ofNullable(storage.get(treeId));
    }

    @Override
    public List<DecisionTree> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean exists(String treeId) {
        Objects.requireNonNull(treeId, "treeId must not be null");
        return storage.containsKey(treeId);
    }

    @Override
    public boolean delete(String treeId) {
        Objects.requireNonNull(treeId, "treeId must not be null");
        return storage.remove(treeId) != null;
    }

    @Override
    public int count() {
        return storage.size();
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
