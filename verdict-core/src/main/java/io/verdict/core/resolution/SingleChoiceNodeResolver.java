package io.verdict.core.resolution;

import io.verdict.core.tree.Choice;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.NodeType;
import java.util.Locale;
import java.util.Optional;

/// Matches a free-text response against the choices of a SingleChoice node.
///
/// The response and each choice's key and label are trimmed and lower-cased.
/// Choices are tried in declaration order; the first whose key or label equals
/// the response, or appears inside it, wins. Containment lets a verbose answer
/// such as "it's a billing issue" select the `billing` choice. Blank keys and
/// labels never match. Without a match the default edge is followed.
///
/// @implNote Stateless and thread-safe.
public class SingleChoiceNodeResolver implements NodeResolver {

    @Override
    public NodeType getNodeType() {
        return NodeType.SINGLE_CHOICE;
    }

    @Override
    public Optional<String> resolve(DecisionNode node, String response) {
        String normalizedResponse = normalize(response);

        for (Choice choice : node.getChoices()) {
            if (matches(normalizedResponse, choice.key())
                    || matches(normalizedResponse, choice.label())) {
                return NodeResolver.edge(choice.nextNodeId());
            }
        }

        return NodeResolver.defaultEdge(node);
    }

    private static boolean matches(String normalizedResponse, String candidate) {
        String normalizedCandidate = normalize(candidate);
        if (normalizedCandidate.isEmpty()) {
            return false;
        }
        return normalizedResponse.equals(normalizedCandidate)
                || normalizedResponse.contains(normalizedCandidate);
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
