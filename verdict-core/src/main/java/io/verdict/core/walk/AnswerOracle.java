package io.verdict.core.walk;

import io.verdict.core.tree.DecisionNode;

/// External answerer consulted at each non-terminal node of a walk.
///
/// Typically a human operator or a language model reading a transcript. How the
/// question is worded and transported is up to the implementation; the walk only
/// needs the free-text answer back.
@FunctionalInterface
public interface AnswerOracle {

    /// Answers the question asked by a node.
    ///
    /// @param node the node being asked, never an End node, not null
    /// @param questionNumber 1-based position of the question in the walk
    /// @return free-text answer, null is treated as empty
    /// @throws OracleException if no answer could be obtained
    String answer(DecisionNode node, int questionNumber) throws OracleException;
}
