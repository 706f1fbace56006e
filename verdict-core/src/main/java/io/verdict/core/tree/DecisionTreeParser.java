package io.verdict.core.tree;

import io.verdict.core.exception.TreeParseException;

/// Converts tree definition text to and from {@link DecisionTree}s.
///
/// Decouples the engine from any specific JSON library so that `verdict-core`
/// stays dependency-free. The Jackson-based implementation lives in
/// `verdict-serialization` as `JacksonDecisionTreeParser`.
///
/// Implementations only deserialize; structural soundness is checked afterwards
/// by {@link io.verdict.core.validation.DecisionTreeValidator}.
public interface DecisionTreeParser {

    /// Parses definition text into a tree.
    ///
    /// @param text definition text, not null
    /// @return the parsed (not yet validated) tree, never null
    /// @throws TreeParseException if the text is not a well-formed definition
    DecisionTree parse(String text) throws TreeParseException;

    /// Encodes a tree back to definition text.
    ///
    /// @param tree the tree to encode, not null
    /// @return definition text, never null
    String format(DecisionTree tree);
}
