package io.verdict.core.validation;

import io.verdict.core.exception.TreeCycleException;
import io.verdict.core.exception.TreeLoadException;
import io.verdict.core.exception.TreeStructureException;
import io.verdict.core.exception.TreeValidationException;
import io.verdict.core.exception.UnreachableNodesException;
import io.verdict.core.tree.Choice;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.Rule;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Static soundness checks applied to a decision tree before it may be traversed.
///
/// Checks run in a fixed order and the first failure aborts:
/// 1. start node declared and present, node ids match their keys
/// 2. every choice, rule and default edge references an existing node
/// 3. no cycle is reachable from the start node
/// 4. every node is reachable from the start node
///
/// Edges are enumerated as choices, then rules, then the default edge. End nodes
/// are leaves in the cycle check only; reachability follows their fields too.
///
/// @implNote Stateless and thread-safe.
/// @see DecisionNode#outgoingNodeIds()
/// @see DecisionNode#referencedNodeIds()
public final class DecisionTreeValidator {

    /// Validates a tree, throwing on the first defect found.
    ///
    /// @param tree the tree to validate, not null
    /// @throws TreeStructureException if the start node or a reference is invalid
    /// @throws TreeCycleException if a cycle is reachable from the start node
    /// @throws UnreachableNodesException if any node is unreachable from the start node
    public void validate(DecisionTree tree) throws TreeValidationException {
        Objects.requireNonNull(tree, "tree must not be null");
        checkStartNode(tree);
        checkNodeIds(tree);
        checkReferences(tree);
        checkCycles(tree);
        checkReachability(tree);
    }

    /// Validates a tree without throwing.
    ///
    /// @param tree the tree to validate, not null
    /// @return the outcome, never null
    public ValidationResult check(DecisionTree tree) {
        try {
            validate(tree);
            return ValidationResult.success();
        } catch (TreeLoadException e) {
            return ValidationResult.invalid(e);
        }
    }

    private void checkStartNode(DecisionTree tree) throws TreeStructureException {
        String startNodeId = tree.getStartNodeId();
        if (startNodeId.isEmpty()) {
            throw new TreeStructureException("Decision tree must have a startNodeId", null, null);
        }
        if (!tree.getNodes().containsKey(startNodeId)) {
            throw new TreeStructureException(
                    "Start node '" + startNodeId + "' not found in nodes", null, startNodeId);
        }
    }

    private void checkNodeIds(DecisionTree tree) throws TreeStructureException {
        for (Map.Entry<String, DecisionNode> entry : tree.getNodes().entrySet()) {
            String nodeId = entry.getValue().getId();
            if (!entry.getKey().equals(nodeId)) {
                throw new TreeStructureException(
                        "Node key '" + entry.getKey() + "' does not match node id '" + nodeId + "'",
                        entry.getKey(),
                        null);
            }
        }
    }

    private void checkReferences(DecisionTree tree) throws TreeStructureException {
        Set<String> nodeIds = tree.getNodes().keySet();

        for (DecisionNode node : tree.getNodes().values()) {
            for (Choice choice : node.getChoices()) {
                if (isDangling(choice.nextNodeId(), nodeIds)) {
                    throw new TreeStructureException(
                            "Node '"
                                    + node.getId()
                                    + "' choice '"
                                    + choice.key()
                                    + "' references non-existent node '"
                                    + choice.nextNodeId()
                                    + "'",
                            node.getId(),
                            choice.nextNodeId());
                }
            }

            List<Rule> rules = node.getRules();
            for (int i = 0; i < rules.size(); i++) {
                Rule rule = rules.get(i);
                if (isDangling(rule.nextNodeId(), nodeIds)) {
                    throw new TreeStructureException(
                            "Node '"
                                    + node.getId()
                                    + "' rule #"
                                    + (i + 1)
                                    + " ("
                                    + rule.operator()
                                    + " "
                                    + rule.value()
                                    + ") references non-existent node '"
                                    + rule.nextNodeId()
                                    + "'",
                            node.getId(),
                            rule.nextNodeId());
                }
            }

            String defaultNext = node.getDefaultNextNodeId();
            if (defaultNext != null && isDangling(defaultNext, nodeIds)) {
                throw new TreeStructureException(
                        "Node '"
                                + node.getId()
                                + "' defaultNextNodeId references non-existent node '"
                                + defaultNext
                                + "'",
                        node.getId(),
                        defaultNext);
            }
        }
    }

    private static boolean isDangling(String target, Set<String> nodeIds) {
        return !target.isEmpty() && !nodeIds.contains(target);
    }

    /// Depth-first search from the start node with a visited set and an on-path set.
    ///
    /// Iterative: each stack frame holds a node id and the iterator over its
    /// remaining outgoing edges. Reaching a node that is still on the current path
    /// closes a cycle.
    private void checkCycles(DecisionTree tree) throws TreeCycleException {
        Set<String> visited = new HashSet<>();
        LinkedHashSet<String> onPath = new LinkedHashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        enter(tree, tree.getStartNodeId(), visited, onPath, stack);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.edges().hasNext()) {
                stack.pop();
                onPath.remove(frame.nodeId());
                continue;
            }

            String target = frame.edges().next();
            if (onPath.contains(target)) {
                throw new TreeCycleException(cyclePath(onPath, target));
            }
            if (!visited.contains(target)) {
                enter(tree, target, visited, onPath, stack);
            }
        }
    }

    private static void enter(
            DecisionTree tree,
            String nodeId,
            Set<String> visited,
            Set<String> onPath,
            Deque<Frame> stack) {
        DecisionNode node = tree.getNodes().get(nodeId);
        if (node == null) {
            return;
        }
        visited.add(nodeId);
        if (node.isTerminal()) {
            return;
        }
        onPath.add(nodeId);
        stack.push(new Frame(nodeId, node.outgoingNodeIds().iterator()));
    }

    private static List<String> cyclePath(LinkedHashSet<String> onPath, String closingNode) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String nodeId : onPath) {
            if (nodeId.equals(closingNode)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(nodeId);
            }
        }
        cycle.add(closingNode);
        return cycle;
    }

    private void checkReachability(DecisionTree tree) throws UnreachableNodesException {
        Set<String> reachable = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        reachable.add(tree.getStartNodeId());
        queue.add(tree.getStartNodeId());

        while (!queue.isEmpty()) {
            DecisionNode node = tree.getNodes().get(queue.poll());
            if (node == null) {
                continue;
            }
            for (String target : node.referencedNodeIds()) {
                if (reachable.add(target)) {
                    queue.add(target);
                }
            }
        }

        List<String> unreachable = new ArrayList<>();
        for (String nodeId : tree.getNodes().keySet()) {
            if (!reachable.contains(nodeId)) {
                unreachable.add(nodeId);
            }
        }
        if (!unreachable.isEmpty()) {
            throw new UnreachableNodesException(unreachable);
        }
    }

    private record Frame(String nodeId, Iterator<String> edges) {}
}
