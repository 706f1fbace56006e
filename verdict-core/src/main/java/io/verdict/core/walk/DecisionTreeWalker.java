package io.verdict.core.walk;

import io.verdict.core.engine.DecisionTreeEngine;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Drives one traversal of the engine's active tree against an {@link AnswerOracle}.
///
/// Starting at the start node, each non-End node is put to the oracle, the answer
/// is resolved to the next node, and the exchange is recorded as a
/// {@link WalkStep}. The walk ends when an End node is reached (its prompt is the
/// outcome) or when a node yields no next node, which is logged and reported as
/// {@link WalkStatus#STALLED} rather than thrown.
///
/// The tree is captured once at the start, so a concurrent reload of the engine
/// never mixes two trees within one walk.
///
/// @implNote Thread-safe; walks share no mutable state. The oracle and listener
/// must be thread-safe if shared across concurrent walks.
public class DecisionTreeWalker {

    private static final Logger logger = Logger.getLogger(DecisionTreeWalker.class.getName());

    private final DecisionTreeEngine engine;

    public DecisionTreeWalker(DecisionTreeEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /// Walks the active tree without a listener.
    ///
    /// @param oracle answer source, not null
    /// @return the walk outcome, never null
    /// @throws OracleException if the oracle fails to answer
    /// @throws IllegalStateException if no tree has been loaded
    public WalkResult walk(AnswerOracle oracle) throws OracleException {
        return walk(oracle, WalkListener.NOOP);
    }

    /// Walks the active tree from its start node.
    ///
    /// @param oracle answer source, not null
    /// @param listener progress callbacks, not null
    /// @return the walk outcome, never null
    /// @throws OracleException if the oracle fails to answer
    /// @throws IllegalStateException if no tree has been loaded
    public WalkResult walk(AnswerOracle oracle, WalkListener listener) throws OracleException {
        Objects.requireNonNull(oracle, "oracle must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        DecisionTree tree = engine.getTree();
        DecisionNode current =
                tree.findStartNode()
                        .orElseThrow(() -> new IllegalStateException("Start node missing"));
        List<WalkStep> steps = new ArrayList<>();

        while (true) {
            listener.onNodeEntered(current);
            logger.fine("Processing node: " + current.getId() + ", type: " + current.getType());

            if (current.isTerminal()) {
                logger.info("Reached end node: " + current.getId());
                return finish(
                        new WalkResult(
                                tree.getId(),
                                WalkStatus.COMPLETED,
                                steps,
                                current.getId(),
                                current.getPrompt()),
                        listener);
            }

            // Validation rules out cycles, so a walk visits each node at most once.
            if (steps.size() >= tree.getNodes().size()) {
                throw new IllegalStateException(
                        "Walk exceeded "
                                + tree.getNodes().size()
                                + " steps in tree "
                                + tree.getId());
            }

            int questionNumber = steps.size() + 1;
            String answer = oracle.answer(current, questionNumber);
            String response = answer == null ? "" : answer;
            Optional<String> nextNodeId = engine.resolveNext(current, response);

            WalkStep step =
                    new WalkStep(
                            questionNumber,
                            current.getId(),
                            current.getPrompt(),
                            response,
                            nextNodeId.orElse(null));
            steps.add(step);
            listener.onStepRecorded(step);

            Optional<DecisionNode> next = nextNodeId.flatMap(tree::findNode);
            if (next.isEmpty()) {
                logger.warning(
                        "No next node determined at node '"
                                + current.getId()
                                + "' for response: "
                                + response);
                return finish(
                        new WalkResult(
                                tree.getId(), WalkStatus.STALLED, steps, current.getId(), null),
                        listener);
            }
            current = next.get();
        }
    }

    private static WalkResult finish(WalkResult result, WalkListener listener) {
        listener.onWalkFinished(result);
        return result;
    }
}
