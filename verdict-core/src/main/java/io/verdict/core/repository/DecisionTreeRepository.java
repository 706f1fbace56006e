package io.verdict.core.repository;

import io.verdict.core.tree.DecisionTree;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/// Repository for decision tree definitions, keyed by tree ID.
///
/// Repositories store whatever they are given; callers that must never persist
/// an unsound tree validate first (see `DecisionTreeService` in
/// `verdict-serialization`).
///
/// ### Idempotent Operations
/// The {@link #save} method is idempotent - saving a tree with an existing ID
/// will overwrite the previous definition.
///
/// @see InMemoryDecisionTreeRepository for in-memory implementation
public interface DecisionTreeRepository {

    /// Saves a tree definition (idempotent).
    ///
    /// @param tree the tree to persist, not null, with a non-blank ID
    /// @throws IOException if the backing store cannot be written
    /// @throws IllegalArgumentException if the tree ID is blank
    void save(DecisionTree tree) throws IOException;

    /// Finds a tree by ID.
    ///
    /// @param treeId the tree identifier, not null
    /// @return the tree if found, empty otherwise
    /// @throws IOException if the backing store cannot be read
    Optional<DecisionTree> findById(String treeId) throws IOException;

    /// Lists all stored trees.
    ///
    /// @return list of all trees, never null (may be empty)
    /// @throws IOException if the backing store cannot be read
    List<DecisionTree> findAll() throws IOException;

    /// Checks if a tree exists.
    ///
    /// @param treeId the tree identifier, not null
    /// @return true if the tree exists, false otherwise
    boolean exists(String treeId);

    /// Deletes a tree by ID.
    ///
    /// @param treeId the tree to delete, not null
    /// @return true if the tree was deleted, false if not found
    /// @throws IOException if the backing store cannot be written
    boolean delete(String treeId) throws IOException;

    /// Counts stored trees.
    ///
    /// @return number of trees
    int count();
}
